package io.github.hongjungwan.responsemask.starter.aop;

import io.github.hongjungwan.responsemask.api.ResponseMasker;
import io.github.hongjungwan.responsemask.api.annotation.MaskResult;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.util.ClassUtils;

import java.util.concurrent.CompletionStage;

/**
 * AOP 기반 반환값 마스킹 Aspect.
 *
 * @MaskResult가 적용된 메서드(또는 타입의 모든 메서드)의 반환값을 호출 문맥과 정책으로 마스킹.
 * 메서드 선언이 타입 선언보다 우선. CompletionStage 반환값은 완료 시점에 마스킹.
 * ResponseEntity/HttpEntity 반환값은 본문만 마스킹하고 상태 코드와 헤더는 유지.
 * 마스킹 실패는 그대로 호출자에게 전파.
 */
@Aspect
@Slf4j
public class MaskResultAspect {

    private static final boolean HTTP_ENTITY_PRESENT =
            ClassUtils.isPresent("org.springframework.http.HttpEntity", MaskResultAspect.class.getClassLoader());

    private final ResponseMasker responseMasker;
    private final CallingContextResolver contextResolver;

    public MaskResultAspect(ResponseMasker responseMasker, CallingContextResolver contextResolver) {
        this.responseMasker = responseMasker;
        this.contextResolver = contextResolver;
    }

    /**
     * 메서드에 선언된 @MaskResult.
     */
    @Around("@annotation(maskResult)")
    public Object maskMethodResult(ProceedingJoinPoint joinPoint, MaskResult maskResult) throws Throwable {
        return proceedAndMask(joinPoint, maskResult);
    }

    /**
     * 타입에 선언된 @MaskResult (메서드 선언이 없는 경우만).
     */
    @Around("@within(maskResult) && !@annotation(io.github.hongjungwan.responsemask.api.annotation.MaskResult)")
    public Object maskTypeResult(ProceedingJoinPoint joinPoint, MaskResult maskResult) throws Throwable {
        return proceedAndMask(joinPoint, maskResult);
    }

    private Object proceedAndMask(ProceedingJoinPoint joinPoint, MaskResult maskResult) throws Throwable {
        Object result = joinPoint.proceed();
        if (result == null) {
            return null;
        }

        Object context = contextResolver.resolve(joinPoint);
        String policy = resolvePolicy(maskResult);

        if (result instanceof CompletionStage<?> stage) {
            return stage.thenApply(value -> mask(joinPoint, value, context, policy));
        }
        return mask(joinPoint, result, context, policy);
    }

    private Object mask(ProceedingJoinPoint joinPoint, Object value, Object context, String policy) {
        Object masked = HTTP_ENTITY_PRESENT && HttpEntityBodyMasker.supports(value)
                ? HttpEntityBodyMasker.maskBody(value, body -> responseMasker.mask(body, context, policy))
                : responseMasker.mask(value, context, policy);
        log.debug("Masked result of {} (policy={})", joinPoint.getSignature().toShortString(), policy);
        return masked;
    }

    /** 빈 정책명은 기본 정책(null)으로 위임 */
    private String resolvePolicy(MaskResult maskResult) {
        String policy = maskResult.policy();
        return policy == null || policy.isBlank() ? null : policy;
    }
}
