package io.github.hongjungwan.responsemask.api.exception;

/**
 * 노드를 독립적으로 복제할 수 없을 때 발생 (기본 생성자 없음, 스트림/스레드 등 복제 불가 JDK 타입).
 */
public class MaskCloneException extends MaskingException {

    private final Class<?> nodeType;

    public MaskCloneException(Class<?> nodeType, String message) {
        this(nodeType, message, null);
    }

    public MaskCloneException(Class<?> nodeType, String message, Throwable cause) {
        super(String.format("Cannot clone %s: %s", nodeType.getName(), message), cause);
        this.nodeType = nodeType;
    }

    public Class<?> getNodeType() {
        return nodeType;
    }
}
