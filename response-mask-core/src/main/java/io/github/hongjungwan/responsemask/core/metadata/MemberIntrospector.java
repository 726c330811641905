package io.github.hongjungwan.responsemask.core.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import io.github.hongjungwan.responsemask.spi.MemberKind;
import io.github.hongjungwan.responsemask.spi.MemberRef;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 런타임 타입의 멤버 테이블 생성기.
 *
 * 상속된 멤버와 비공개 멤버 포함. JDK 상위 클래스(Object 등)의 멤버는 제외.
 * 규칙 공급자는 타입당 멤버마다 한 번만 호출되고 결과는 Caffeine 캐시에 보관.
 */
@Slf4j
public class MemberIntrospector {

    private final MaskRuleSource ruleSource;

    // 멤버 테이블 캐시 (Class -> MemberTable)
    private final Cache<Class<?>, MemberTable> tableCache;

    public MemberIntrospector(MaskRuleSource ruleSource, long maximumCacheSize) {
        this.ruleSource = Objects.requireNonNull(ruleSource, "ruleSource");
        if (maximumCacheSize <= 0) {
            throw new IllegalArgumentException("Metadata cache size must be positive, got: " + maximumCacheSize);
        }
        this.tableCache = Caffeine.newBuilder()
                .maximumSize(maximumCacheSize)
                .build();
    }

    /** 타입의 멤버 테이블 조회 (없으면 생성 후 캐시) */
    public MemberTable tableFor(Class<?> type) {
        return tableCache.get(type, this::introspect);
    }

    private MemberTable introspect(Class<?> type) {
        MemberTable table = type.isRecord()
                ? introspectRecord(type)
                : MemberTable.forClass(type, scanProperties(type), scanFields(type));
        log.debug("Built member table for {}: {} properties, {} fields, {} components",
                type.getName(), table.getProperties().size(), table.getFields().size(), table.getComponents().size());
        return table;
    }

    /** getter 기준 프로퍼티 스캔. 하위 클래스의 선언이 우선 */
    private List<Member> scanProperties(Class<?> type) {
        Map<String, Method> getters = new TreeMap<>();
        Map<String, List<AnnotatedElement>> elements = new LinkedHashMap<>();

        for (Class<?> current : hierarchy(type)) {
            for (Method method : current.getDeclaredMethods()) {
                if (!isGetter(method)) {
                    continue;
                }
                String propertyName = extractPropertyName(method);
                getters.putIfAbsent(propertyName, method);
                elements.computeIfAbsent(propertyName, k -> new ArrayList<>()).add(method);
            }
        }

        List<Member> properties = new ArrayList<>();
        for (Map.Entry<String, Method> entry : getters.entrySet()) {
            String propertyName = entry.getKey();
            Method getter = entry.getValue();
            Method setter = findSetter(type, getter);

            List<AnnotatedElement> annotated = new ArrayList<>(elements.get(propertyName));
            // 같은 이름의 필드에 붙은 규칙도 프로퍼티에 적용
            Field backingField = findField(type, propertyName);
            if (backingField != null) {
                annotated.add(backingField);
            }
            makeAccessible(type, propertyName, getter);
            if (setter != null) {
                makeAccessible(type, propertyName, setter);
                annotated.add(setter);
            }

            List<MaskRule> rules = rulesFor(type, propertyName, MemberKind.PROPERTY, getter.getReturnType(), annotated);
            properties.add(new PropertyMember(propertyName, getter, setter, rules));
        }
        return properties;
    }

    private List<Member> scanFields(Class<?> type) {
        List<Member> fields = new ArrayList<>();
        for (Class<?> current : hierarchy(type)) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                makeAccessible(type, field.getName(), field);
                List<MaskRule> rules = rulesFor(type, field.getName(), MemberKind.FIELD, field.getType(), List.of(field));
                fields.add(new FieldMember(field, rules));
            }
        }
        return fields;
    }

    private MemberTable introspectRecord(Class<?> type) {
        RecordComponent[] recordComponents = type.getRecordComponents();
        Class<?>[] componentTypes = new Class<?>[recordComponents.length];
        List<Member> components = new ArrayList<>();

        for (int i = 0; i < recordComponents.length; i++) {
            RecordComponent component = recordComponents[i];
            String name = component.getName();
            Method accessor = component.getAccessor();
            componentTypes[i] = component.getType();
            makeAccessible(type, name, accessor);

            List<AnnotatedElement> annotated = new ArrayList<>(List.of(component, accessor));
            try {
                annotated.add(type.getDeclaredField(name));
            } catch (NoSuchFieldException e) {
                throw new MaskIntrospectionException(type, name, "record field missing", e);
            }

            List<MaskRule> rules = rulesFor(type, name, MemberKind.RECORD_COMPONENT, component.getType(), annotated);
            components.add(new ComponentMember(name, accessor, rules));
        }

        try {
            Constructor<?> constructor = type.getDeclaredConstructor(componentTypes);
            makeAccessible(type, "<init>", constructor);
            return MemberTable.forRecord(type, components, constructor);
        } catch (NoSuchMethodException e) {
            throw new MaskIntrospectionException(type, "<init>", "canonical constructor missing", e);
        }
    }

    private List<MaskRule> rulesFor(Class<?> type, String name, MemberKind kind, Class<?> memberType,
                                    List<AnnotatedElement> annotated) {
        List<MaskRule> rules = ruleSource.rulesFor(new MemberRef(type, name, kind, memberType, List.copyOf(annotated)));
        return rules != null ? rules : List.of();
    }

    /** 런타임 타입부터 JDK 타입 직전까지의 클래스 계층 */
    private List<Class<?>> hierarchy(Class<?> type) {
        List<Class<?>> classes = new ArrayList<>();
        for (Class<?> current = type; current != null && !NodeClassifier.isJdkType(current);
             current = current.getSuperclass()) {
            classes.add(current);
        }
        return classes;
    }

    /** getter 메서드 여부 확인 (get* 또는 boolean is*). */
    private boolean isGetter(Method method) {
        if (Modifier.isStatic(method.getModifiers()) || method.isSynthetic() || method.isBridge()
                || method.getParameterCount() != 0 || method.getReturnType().equals(void.class)) {
            return false;
        }
        String name = method.getName();
        if (name.length() > 3 && name.startsWith("get")) {
            return Character.isUpperCase(name.charAt(3));
        }
        if (name.length() > 2 && name.startsWith("is")) {
            Class<?> returnType = method.getReturnType();
            return Character.isUpperCase(name.charAt(2))
                    && (returnType.equals(boolean.class) || returnType.equals(Boolean.class));
        }
        return false;
    }

    /** getter 메서드명에서 프로퍼티명 추출 (getURL -> URL, getName -> name). */
    private String extractPropertyName(Method method) {
        String suffix = accessorSuffix(method);
        if (suffix.length() > 1 && Character.isUpperCase(suffix.charAt(1))) {
            return suffix;
        }
        return Character.toLowerCase(suffix.charAt(0)) + suffix.substring(1);
    }

    private String accessorSuffix(Method getter) {
        String name = getter.getName();
        return name.startsWith("get") ? name.substring(3) : name.substring(2);
    }

    /** 같은 타입 인자 하나를 받는 set* 메서드 탐색 */
    private Method findSetter(Class<?> type, Method getter) {
        String setterName = "set" + accessorSuffix(getter);
        for (Class<?> current : hierarchy(type)) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.getName().equals(setterName)
                        && method.getParameterCount() == 1
                        && method.getParameterTypes()[0].equals(getter.getReturnType())
                        && !Modifier.isStatic(method.getModifiers())
                        && !method.isBridge()) {
                    return method;
                }
            }
        }
        return null;
    }

    private Field findField(Class<?> type, String name) {
        for (Class<?> current : hierarchy(type)) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name) && !Modifier.isStatic(field.getModifiers())) {
                    return field;
                }
            }
        }
        return null;
    }

    private void makeAccessible(Class<?> type, String memberName, AccessibleObject member) {
        try {
            member.setAccessible(true);
        } catch (RuntimeException e) {
            throw new MaskIntrospectionException(type, memberName, "member is not accessible", e);
        }
    }

    /** 캐시 초기화. 테스트 또는 클래스 리로드 시 사용. */
    public void clearCache() {
        tableCache.invalidateAll();
    }
}
