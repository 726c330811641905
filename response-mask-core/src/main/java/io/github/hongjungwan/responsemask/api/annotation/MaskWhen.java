package io.github.hongjungwan.responsemask.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 응답 마스킹 대상 멤버 지정 어노테이션.
 *
 * 필드, getter/setter, record 컴포넌트에 적용. 조건이 모두 충족되면 해당 멤버 값을 지움(null 또는 기본값).
 * 비어 있는 속성은 조건으로 사용하지 않음. 여러 개 선언 시 하나라도 일치하면 마스킹.
 *
 * public class Employee {
 *     @MaskWhen(policies = "public")
 *     private String residentNumber;          // "public" 정책에서 제거
 *
 *     @MaskWhen(endpoints = PartnerController.class)
 *     private BigDecimal salary;              // PartnerController 호출 시 제거
 *
 *     @MaskWhen(enclosingTypes = Department.class)
 *     private List<Employee> reports;         // Department를 통해 도달한 경우만 제거
 * }
 */
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(MaskWhens.class)
@Documented
public @interface MaskWhen {

    /** 적용할 정책명. 비어 있으면 모든 정책에 적용 */
    String[] policies() default {};

    /**
     * 호출 문맥(엔드포인트) 타입. 문맥 객체가 이 타입 중 하나의 인스턴스일 때만 적용.
     * 지정 시 문맥이 없으면 일치하지 않음.
     */
    Class<?>[] endpoints() default {};

    /** 멤버를 소유한 객체의 런타임 타입 조건 */
    Class<?>[] declaringTypes() default {};

    /**
     * 소유 객체에 도달하기 직전 상위 객체의 런타임 타입 조건.
     * 루트 객체의 멤버에는 일치하지 않음.
     */
    Class<?>[] enclosingTypes() default {};
}
