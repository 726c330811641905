package io.github.hongjungwan.responsemask.starter.aop;

import org.aspectj.lang.JoinPoint;

/**
 * 대상 빈(컨트롤러 등 프록시 뒤의 실제 인스턴스)을 호출 문맥으로 사용.
 */
public class TargetBeanContextResolver implements CallingContextResolver {

    @Override
    public Object resolve(JoinPoint joinPoint) {
        return joinPoint.getTarget();
    }
}
