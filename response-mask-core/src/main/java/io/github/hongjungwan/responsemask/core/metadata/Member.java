package io.github.hongjungwan.responsemask.core.metadata;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.api.MaskScope;
import io.github.hongjungwan.responsemask.spi.MemberKind;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 멤버 테이블 항목. 이름, 선언 타입, 접근자, 부착된 규칙을 보관.
 */
@Getter
public abstract class Member {

    private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
            boolean.class, false,
            byte.class, (byte) 0,
            short.class, (short) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d,
            char.class, '\0'
    );

    private final String name;
    private final MemberKind kind;
    private final Class<?> type;
    private final List<MaskRule> rules;
    private final boolean compositeCapable;

    protected Member(String name, MemberKind kind, Class<?> type, List<MaskRule> rules) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.rules = List.copyOf(rules);
        this.compositeCapable = NodeClassifier.canHoldComposite(type);
    }

    /** 대상 객체에서 현재 값 조회 */
    public abstract Object read(Object target);

    /** 쓰기 가능 여부. 읽기 전용 프로퍼티, record 컴포넌트는 false */
    public abstract boolean isWritable();

    public abstract void write(Object target, Object value);

    /** 부착된 규칙 중 하나라도 일치하는지 */
    public boolean matches(MaskScope scope) {
        for (MaskRule rule : rules) {
            if (rule.matches(scope)) {
                return true;
            }
        }
        return false;
    }

    /** 지워진 상태의 값: 참조형은 null, 원시형은 기본값, Optional은 empty */
    public Object emptyValue() {
        if (type.isPrimitive()) {
            return PRIMITIVE_DEFAULTS.get(type);
        }
        if (Optional.class.equals(type)) {
            return Optional.empty();
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + " " + name + " (" + type.getSimpleName() + ", " + rules.size() + " rules)";
    }
}
