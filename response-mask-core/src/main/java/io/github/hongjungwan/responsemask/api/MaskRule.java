package io.github.hongjungwan.responsemask.api;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 멤버 마스킹 규칙. 조건이 참이면 멤버 값을 지움.
 *
 * 규칙은 순수 함수여야 함 (호출 간 상태 없음, 여러 스레드에서 동시 평가).
 */
@FunctionalInterface
public interface MaskRule {

    /** 주어진 문맥에서 멤버를 지워야 하는지 판단 */
    boolean matches(MaskScope scope);

    default MaskRule and(MaskRule other) {
        Objects.requireNonNull(other, "other");
        return scope -> matches(scope) && other.matches(scope);
    }

    default MaskRule or(MaskRule other) {
        Objects.requireNonNull(other, "other");
        return scope -> matches(scope) || other.matches(scope);
    }

    /** 항상 마스킹 */
    static MaskRule always() {
        return scope -> true;
    }

    /** 지정 정책에서만 마스킹. 중복된 정책명은 하나로 취급 */
    static MaskRule forPolicies(String... policies) {
        Set<String> names = Set.copyOf(Arrays.asList(policies));
        return scope -> scope.policyName() != null && names.contains(scope.policyName());
    }

    /** 호출 문맥이 지정 타입 중 하나일 때만 마스킹. 문맥이 없으면 불일치 */
    static MaskRule forEndpoints(Class<?>... endpointTypes) {
        List<Class<?>> types = List.of(endpointTypes);
        return scope -> scope.hasContext()
                && types.stream().anyMatch(type -> type.isInstance(scope.context()));
    }

    /** 상위 객체가 지정 타입 중 하나일 때만 마스킹. 루트에서는 불일치 */
    static MaskRule whenEnclosedBy(Class<?>... enclosingTypes) {
        List<Class<?>> types = List.of(enclosingTypes);
        return scope -> !scope.isRoot()
                && types.stream().anyMatch(type -> type.isAssignableFrom(scope.enclosingType()));
    }
}
