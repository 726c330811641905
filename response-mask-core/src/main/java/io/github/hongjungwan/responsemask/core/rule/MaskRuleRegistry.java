package io.github.hongjungwan.responsemask.core.rule;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import io.github.hongjungwan.responsemask.spi.MemberRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * (타입, 멤버명) -> 규칙 목록 레지스트리. 어노테이션을 붙일 수 없는 타입(외부 라이브러리 DTO 등)에 사용.
 *
 * 등록 타입의 하위 타입에도 적용됨.
 *
 * MaskRuleRegistry registry = MaskRuleRegistry.builder()
 *         .rule(Employee.class, "salary", MaskRule.forPolicies("public"))
 *         .rule(Employee.class, "manager", MaskRule.whenEnclosedBy(Department.class))
 *         .build();
 */
public final class MaskRuleRegistry implements MaskRuleSource {

    private final Map<Class<?>, Map<String, List<MaskRule>>> rules;

    private MaskRuleRegistry(Map<Class<?>, Map<String, List<MaskRule>>> rules) {
        Map<Class<?>, Map<String, List<MaskRule>>> copy = new LinkedHashMap<>();
        rules.forEach((type, members) -> {
            Map<String, List<MaskRule>> memberCopy = new LinkedHashMap<>();
            members.forEach((name, list) -> memberCopy.put(name, List.copyOf(list)));
            copy.put(type, memberCopy);
        });
        this.rules = copy;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<MaskRule> rulesFor(MemberRef member) {
        List<MaskRule> matched = new ArrayList<>();
        for (Map.Entry<Class<?>, Map<String, List<MaskRule>>> entry : rules.entrySet()) {
            if (entry.getKey().isAssignableFrom(member.ownerType())) {
                matched.addAll(entry.getValue().getOrDefault(member.name(), List.of()));
            }
        }
        return matched;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public static final class Builder {

        private final Map<Class<?>, Map<String, List<MaskRule>>> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder rule(Class<?> type, String memberName, MaskRule rule) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(rule, "rule");
            if (memberName == null || memberName.isBlank()) {
                throw new IllegalArgumentException("Member name must not be blank");
            }
            rules.computeIfAbsent(type, k -> new LinkedHashMap<>())
                    .computeIfAbsent(memberName, k -> new ArrayList<>())
                    .add(rule);
            return this;
        }

        /** 지정 정책에서 멤버를 항상 지우는 규칙 등록 */
        public Builder erase(Class<?> type, String memberName, String... policies) {
            return rule(type, memberName, policies.length == 0 ? MaskRule.always() : MaskRule.forPolicies(policies));
        }

        public MaskRuleRegistry build() {
            return new MaskRuleRegistry(rules);
        }
    }
}
