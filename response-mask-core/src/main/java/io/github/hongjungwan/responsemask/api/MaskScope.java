package io.github.hongjungwan.responsemask.api;

/**
 * 규칙 평가 시점의 문맥.
 *
 * @param context       호출 문맥 (엔드포인트 등). 없으면 null
 * @param declaringType 멤버를 소유한 객체의 런타임 타입
 * @param enclosingType 소유 객체에 도달한 상위 객체의 런타임 타입. 루트이면 null
 * @param memberName    평가 중인 멤버 이름
 * @param policyName    적용 정책명 (null 입력 시 기본 정책으로 치환된 값)
 */
public record MaskScope(
        Object context,
        Class<?> declaringType,
        Class<?> enclosingType,
        String memberName,
        String policyName
) {

    public boolean hasContext() {
        return context != null;
    }

    /** 루트 객체의 멤버인지 여부 */
    public boolean isRoot() {
        return enclosingType == null;
    }
}
