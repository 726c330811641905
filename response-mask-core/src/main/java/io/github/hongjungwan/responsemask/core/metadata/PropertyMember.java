package io.github.hongjungwan.responsemask.core.metadata;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException;
import io.github.hongjungwan.responsemask.spi.MemberKind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;

/**
 * getter/setter 기반 프로퍼티. setter가 없으면 읽기 전용.
 */
public class PropertyMember extends Member {

    private final Method getter;
    private final Method setter;

    public PropertyMember(String name, Method getter, Method setter, List<MaskRule> rules) {
        super(name, MemberKind.PROPERTY, getter.getReturnType(), rules);
        this.getter = getter;
        this.setter = setter;
    }

    @Override
    public Object read(Object target) {
        try {
            return getter.invoke(target);
        } catch (InvocationTargetException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "getter threw", e.getCause());
        } catch (IllegalAccessException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "getter not accessible", e);
        }
    }

    @Override
    public boolean isWritable() {
        return setter != null;
    }

    @Override
    public void write(Object target, Object value) {
        if (setter == null) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "property is read-only", null);
        }
        try {
            setter.invoke(target, value);
        } catch (InvocationTargetException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "setter threw", e.getCause());
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "setter not invocable", e);
        }
    }
}
