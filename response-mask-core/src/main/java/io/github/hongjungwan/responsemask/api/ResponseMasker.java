package io.github.hongjungwan.responsemask.api;

/**
 * 응답 객체 그래프 마스킹 진입점.
 *
 * 입력 그래프를 깊은 복제한 뒤 복제본에서 규칙에 일치하는 멤버를 지우고 반환.
 * 호출자가 전달한 원본은 절대 변경되지 않음.
 */
public interface ResponseMasker {

    /**
     * 호출 문맥 없이 마스킹. 문맥 조건이 있는 규칙은 일치하지 않음.
     *
     * @param data       마스킹 대상 (null이면 null 반환)
     * @param policyName 정책명 (null이면 기본 정책)
     * @return 마스킹된 복제본
     */
    <T> T mask(T data, String policyName);

    /**
     * 호출 문맥 기반 마스킹.
     *
     * @param data       마스킹 대상 (null이면 null 반환)
     * @param context    호출 문맥 (엔드포인트 등, null 허용)
     * @param policyName 정책명 (null이면 기본 정책)
     * @return 마스킹된 복제본
     * @throws io.github.hongjungwan.responsemask.api.exception.MaskCloneException 복제 불가 노드 포함 시
     * @throws io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException 멤버 읽기/쓰기 실패 시
     */
    <T> T mask(T data, Object context, String policyName);
}
