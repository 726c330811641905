package io.github.hongjungwan.responsemask.api.exception;

/**
 * 객체 그래프 중첩 깊이가 설정된 최대치를 넘었을 때 발생.
 */
public class MaskDepthExceededException extends MaskingException {

    private final int maxDepth;

    public MaskDepthExceededException(int maxDepth, Class<?> nodeType) {
        super(String.format("Object graph exceeds max depth %d at %s", maxDepth, nodeType.getName()));
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
