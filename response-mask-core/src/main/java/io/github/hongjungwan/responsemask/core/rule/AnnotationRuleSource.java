package io.github.hongjungwan.responsemask.core.rule;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.api.MaskScope;
import io.github.hongjungwan.responsemask.api.annotation.MaskWhen;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import io.github.hongjungwan.responsemask.spi.MemberRef;

import java.lang.reflect.AnnotatedElement;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link MaskWhen} 어노테이션 기반 규칙 공급자.
 *
 * 프로퍼티는 getter/setter, record는 컴포넌트/접근자/필드의 어노테이션을 모두 수집.
 * 같은 어노테이션이 여러 요소로 전파된 경우 하나로 취급.
 */
public class AnnotationRuleSource implements MaskRuleSource {

    @Override
    public List<MaskRule> rulesFor(MemberRef member) {
        Set<MaskWhen> declared = new LinkedHashSet<>();
        for (AnnotatedElement element : member.annotatedElements()) {
            declared.addAll(Arrays.asList(element.getAnnotationsByType(MaskWhen.class)));
        }

        if (declared.isEmpty()) {
            return List.of();
        }

        return declared.stream()
                .<MaskRule>map(AnnotationMaskRule::from)
                .toList();
    }

    /** 어노테이션 속성을 조건으로 변환한 규칙. 모든 조건이 충족되어야 일치. */
    record AnnotationMaskRule(
            Set<String> policies,
            List<Class<?>> endpoints,
            List<Class<?>> declaringTypes,
            List<Class<?>> enclosingTypes
    ) implements MaskRule {

        static AnnotationMaskRule from(MaskWhen annotation) {
            return new AnnotationMaskRule(
                    Set.copyOf(Arrays.asList(annotation.policies())),
                    List.of(annotation.endpoints()),
                    List.of(annotation.declaringTypes()),
                    List.of(annotation.enclosingTypes())
            );
        }

        @Override
        public boolean matches(MaskScope scope) {
            if (!policies.isEmpty()
                    && (scope.policyName() == null || !policies.contains(scope.policyName()))) {
                return false;
            }
            if (!endpoints.isEmpty()
                    && (!scope.hasContext() || endpoints.stream().noneMatch(t -> t.isInstance(scope.context())))) {
                return false;
            }
            if (!declaringTypes.isEmpty()
                    && declaringTypes.stream().noneMatch(t -> t.isAssignableFrom(scope.declaringType()))) {
                return false;
            }
            if (!enclosingTypes.isEmpty()
                    && (scope.isRoot() || enclosingTypes.stream().noneMatch(t -> t.isAssignableFrom(scope.enclosingType())))) {
                return false;
            }
            return true;
        }
    }
}
