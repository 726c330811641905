package io.github.hongjungwan.responsemask.core.metadata;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException;
import io.github.hongjungwan.responsemask.spi.MemberKind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;

/**
 * record 컴포넌트. 재할당 불가하므로 변경 시 정규 생성자로 새 인스턴스를 만듦.
 */
public class ComponentMember extends Member {

    private final Method accessor;

    public ComponentMember(String name, Method accessor, List<MaskRule> rules) {
        super(name, MemberKind.RECORD_COMPONENT, accessor.getReturnType(), rules);
        this.accessor = accessor;
    }

    @Override
    public Object read(Object target) {
        try {
            return accessor.invoke(target);
        } catch (InvocationTargetException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "accessor threw", e.getCause());
        } catch (IllegalAccessException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "accessor not accessible", e);
        }
    }

    @Override
    public boolean isWritable() {
        return false;
    }

    @Override
    public void write(Object target, Object value) {
        throw new MaskIntrospectionException(target.getClass(), getName(), "record component cannot be reassigned", null);
    }
}
