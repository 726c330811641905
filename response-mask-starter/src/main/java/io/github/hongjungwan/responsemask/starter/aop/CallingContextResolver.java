package io.github.hongjungwan.responsemask.starter.aop;

import org.aspectj.lang.JoinPoint;

/**
 * 마스킹 호출 문맥 결정 인터페이스.
 *
 * 엔드포인트 조건(@MaskWhen endpoints)은 여기서 반환한 객체의 타입으로 평가됨.
 * 기본 구현체로 {@link TargetBeanContextResolver}가 제공됨.
 */
@FunctionalInterface
public interface CallingContextResolver {

    /**
     * 가로챈 호출의 문맥 객체 반환.
     *
     * @return 호출 문맥 (예: 컨트롤러 인스턴스). 문맥이 없으면 null
     */
    Object resolve(JoinPoint joinPoint);
}
