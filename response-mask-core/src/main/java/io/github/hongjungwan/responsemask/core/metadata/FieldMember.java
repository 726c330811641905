package io.github.hongjungwan.responsemask.core.metadata;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException;
import io.github.hongjungwan.responsemask.spi.MemberKind;

import java.lang.reflect.Field;
import java.util.List;

/**
 * 인스턴스 필드. final 필드 포함 항상 쓰기 가능 (접근 허용 후).
 */
public class FieldMember extends Member {

    private final Field field;

    public FieldMember(Field field, List<MaskRule> rules) {
        super(field.getName(), MemberKind.FIELD, field.getType(), rules);
        this.field = field;
    }

    @Override
    public Object read(Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "field not readable", e);
        }
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    @Override
    public void write(Object target, Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new MaskIntrospectionException(target.getClass(), getName(), "field not writable", e);
        }
    }
}
