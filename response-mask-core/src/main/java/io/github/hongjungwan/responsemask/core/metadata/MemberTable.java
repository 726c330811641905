package io.github.hongjungwan.responsemask.core.metadata;

import io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException;
import lombok.Getter;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;

/**
 * 타입별 멤버 테이블. 한 번 생성되어 모든 탐색에서 재사용.
 *
 * 일반 클래스: properties, fields. record: components + 정규 생성자.
 */
@Getter
public class MemberTable {

    private final Class<?> ownerType;
    private final List<Member> properties;
    private final List<Member> fields;
    private final List<Member> components;
    private final Constructor<?> canonicalConstructor;

    private MemberTable(Class<?> ownerType, List<Member> properties, List<Member> fields,
                        List<Member> components, Constructor<?> canonicalConstructor) {
        this.ownerType = ownerType;
        this.properties = List.copyOf(properties);
        this.fields = List.copyOf(fields);
        this.components = List.copyOf(components);
        this.canonicalConstructor = canonicalConstructor;
    }

    static MemberTable forClass(Class<?> ownerType, List<Member> properties, List<Member> fields) {
        return new MemberTable(ownerType, properties, fields, List.of(), null);
    }

    static MemberTable forRecord(Class<?> ownerType, List<Member> components, Constructor<?> canonicalConstructor) {
        return new MemberTable(ownerType, List.of(), List.of(), components, canonicalConstructor);
    }

    public boolean isRecord() {
        return canonicalConstructor != null;
    }

    /** 규칙이 하나라도 부착된 멤버가 있는지 */
    public boolean hasRules() {
        return properties.stream().anyMatch(m -> !m.getRules().isEmpty())
                || fields.stream().anyMatch(m -> !m.getRules().isEmpty())
                || components.stream().anyMatch(m -> !m.getRules().isEmpty());
    }

    /** record 정규 생성자로 새 인스턴스 생성 */
    public Object instantiate(Object[] componentValues) {
        try {
            return canonicalConstructor.newInstance(componentValues);
        } catch (InvocationTargetException e) {
            throw new MaskIntrospectionException(ownerType, "<init>", "canonical constructor threw", e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new MaskIntrospectionException(ownerType, "<init>", "canonical constructor not invocable", e);
        }
    }
}
