package io.github.hongjungwan.responsemask.api.exception;

/**
 * 멤버 읽기/쓰기가 접근 제한 또는 접근자 예외로 실패했을 때 발생.
 */
public class MaskIntrospectionException extends MaskingException {

    private final Class<?> ownerType;
    private final String memberName;

    public MaskIntrospectionException(Class<?> ownerType, String memberName, String message, Throwable cause) {
        super(String.format("Cannot access %s.%s: %s", ownerType.getName(), memberName, message), cause);
        this.ownerType = ownerType;
        this.memberName = memberName;
    }

    public Class<?> getOwnerType() {
        return ownerType;
    }

    public String getMemberName() {
        return memberName;
    }
}
