package io.github.hongjungwan.responsemask.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 메서드 반환값 자동 마스킹 어노테이션 (Spring Boot Starter의 AOP에서 처리).
 *
 * 메서드 또는 타입에 적용. 메서드 선언이 타입 선언보다 우선.
 * 반환값은 복제 후 마스킹되며 원본 객체는 변경되지 않음.
 *
 * @RestController
 * public class PartnerController {
 *
 *     @MaskResult(policy = "partner")
 *     public Employee getEmployee(String employeeId) {
 *         return repository.find(employeeId);  // 컨트롤러 인스턴스가 호출 문맥으로 전달됨
 *     }
 * }
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MaskResult {

    /**
     * 적용할 정책명.
     * 비어 있으면 설정된 기본 정책 사용.
     */
    String policy() default "";
}
