package io.github.hongjungwan.responsemask.core.clone;

import io.github.hongjungwan.responsemask.api.exception.MaskCloneException;
import io.github.hongjungwan.responsemask.core.metadata.NodeClassifier;
import io.github.hongjungwan.responsemask.spi.CloneContext;
import io.github.hongjungwan.responsemask.spi.DeepCloneable;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.InetAddress;
import java.net.URI;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Currency;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 리플렉션 기반 깊은 복제기. 마스킹이 원본 그래프에 영향을 주지 않도록 독립된 복제본 생성.
 *
 * 불변 JDK 값은 공유, 공유/순환 참조 구조는 복제본에서도 유지.
 * 복제 불가 노드가 하나라도 있으면 MaskCloneException으로 전체 실패 (부분 복제본 반환 없음).
 */
@Slf4j
public class GraphCloner {

    private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
            Object.class, String.class, Boolean.class, Character.class, Byte.class, Short.class,
            Integer.class, Long.class, Float.class, Double.class, Void.class, Class.class,
            BigDecimal.class, BigInteger.class, UUID.class, Locale.class, Currency.class,
            URI.class, URL.class, Pattern.class, File.class,
            OptionalInt.class, OptionalLong.class, OptionalDouble.class
    );

    // 구현 타입이 다양한 불변 JDK 추상 타입
    private static final List<Class<?>> IMMUTABLE_SUPERTYPES = List.of(
            Path.class, InetAddress.class, Charset.class
    );

    // 객체 복제 계획 캐시 (Class -> 생성자 + 필드 목록)
    private final ConcurrentHashMap<Class<?>, ObjectCopyPlan> objectPlanCache = new ConcurrentHashMap<>();

    // record 복제 계획 캐시 (Class -> 접근자 + 정규 생성자)
    private final ConcurrentHashMap<Class<?>, RecordCopyPlan> recordPlanCache = new ConcurrentHashMap<>();

    /**
     * 깊은 복제. null이면 null.
     *
     * @throws MaskCloneException 복제 불가 노드 포함 시
     */
    public <T> T deepClone(T source) {
        if (source == null) {
            return null;
        }
        return new Session().copy(source);
    }

    /** 공유해도 안전한 불변 타입 여부 */
    static boolean isImmutable(Class<?> type) {
        if (type.isPrimitive() || IMMUTABLE_TYPES.contains(type) || Enum.class.isAssignableFrom(type)) {
            return true;
        }
        if (type.getName().startsWith("java.time.") || type.isHidden() || type.isSynthetic()) {
            return true;
        }
        for (Class<?> supertype : IMMUTABLE_SUPERTYPES) {
            if (supertype.isAssignableFrom(type)) {
                return true;
            }
        }
        return false;
    }

    /** 캐시 초기화. 테스트 또는 클래스 리로드 시 사용. */
    public void clearCache() {
        objectPlanCache.clear();
        recordPlanCache.clear();
    }

    /**
     * 1회 복제 세션. 원본 인스턴스 -> 복제본 매핑으로 공유/순환 참조 보존.
     */
    private final class Session implements CloneContext {

        private final Map<Object, Object> copies = new IdentityHashMap<>();

        // 생성 전 등록이 불가능한 값(record, Map.Entry)의 순환 탐지
        private final Set<Object> pendingValues = Collections.newSetFromMap(new IdentityHashMap<>());

        @Override
        @SuppressWarnings("unchecked")
        public <V> V copy(V value) {
            if (value == null) {
                return null;
            }

            Class<?> type = value.getClass();
            if (isImmutable(type)) {
                return value;
            }

            Object existing = copies.get(value);
            if (existing != null) {
                return (V) existing;
            }

            return (V) copyNode(value, type);
        }

        private Object copyNode(Object value, Class<?> type) {
            if (value instanceof DeepCloneable<?> cloneable) {
                return copyCloneable(cloneable, type);
            }
            if (type.isArray()) {
                return copyArray(value, type);
            }
            if (value instanceof Collection<?> collection) {
                return copyCollection(collection);
            }
            if (value instanceof Map<?, ?> map) {
                return copyMap(map);
            }
            if (value instanceof Optional<?> optional) {
                Optional<?> result = optional.map(this::copy);
                copies.put(value, result);
                return result;
            }
            if (type.isRecord()) {
                return copyRecord(value, type);
            }
            if (value instanceof Map.Entry<?, ?> entry && NodeClassifier.isJdkType(type)) {
                return copyEntry(entry, type);
            }
            if (NodeClassifier.isJdkType(type)) {
                return copyJdkValue(value, type);
            }
            return copyObject(value, type);
        }

        private Object copyCloneable(DeepCloneable<?> cloneable, Class<?> type) {
            Object result = cloneable.deepClone(this);
            if (result == null || result == cloneable) {
                throw new MaskCloneException(type, "deepClone() must return a new instance");
            }
            copies.put(cloneable, result);
            return result;
        }

        private Object copyArray(Object source, Class<?> type) {
            int length = Array.getLength(source);
            Object target = Array.newInstance(type.getComponentType(), length);
            copies.put(source, target);

            if (type.getComponentType().isPrimitive()) {
                System.arraycopy(source, 0, target, 0, length);
                return target;
            }
            for (int i = 0; i < length; i++) {
                Array.set(target, i, copy(Array.get(source, i)));
            }
            return target;
        }

        @SuppressWarnings("unchecked")
        private Object copyCollection(Collection<?> source) {
            if (source instanceof EnumSet<?> enumSet) {
                Object result = enumSet.clone();
                copies.put(source, result);
                return result;
            }

            Comparator<?> comparator = source instanceof SortedSet<?> sorted ? sorted.comparator() : null;
            Collection<Object> target = (Collection<Object>) instantiateContainer(source.getClass(), comparator);
            if (target == null) {
                target = fallbackCollection(source, comparator);
            }
            copies.put(source, target);

            for (Object element : source) {
                target.add(copy(element));
            }
            return target;
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        private Object copyMap(Map<?, ?> source) {
            Map<Object, Object> target;
            if (source instanceof EnumMap<?, ?> enumMap) {
                target = new EnumMap(enumMap);
            } else {
                Comparator<?> comparator = source instanceof SortedMap<?, ?> sorted ? sorted.comparator() : null;
                target = (Map<Object, Object>) instantiateContainer(source.getClass(), comparator);
                if (target == null) {
                    target = comparator != null || source instanceof SortedMap
                            ? new TreeMap<>((Comparator<Object>) comparator)
                            : new LinkedHashMap<>();
                }
            }
            copies.put(source, target);

            for (Map.Entry<?, ?> entry : source.entrySet()) {
                target.put(copy(entry.getKey()), copy(entry.getValue()));
            }
            return target;
        }

        @SuppressWarnings("unchecked")
        private Collection<Object> fallbackCollection(Collection<?> source, Comparator<?> comparator) {
            if (source instanceof SortedSet<?>) {
                return new TreeSet<>((Comparator<Object>) comparator);
            }
            if (source instanceof List<?>) {
                return new ArrayList<>(source.size());
            }
            if (source instanceof Set<?>) {
                return new LinkedHashSet<>();
            }
            return new LinkedList<>();
        }

        /**
         * 원본과 같은 런타임 타입의 빈 컨테이너 생성. 공개 생성자가 없는 JDK 구현(불변 컬렉션 등)이면 null.
         */
        private Object instantiateContainer(Class<?> type, Comparator<?> comparator) {
            boolean jdkType = NodeClassifier.isJdkType(type);
            if (jdkType && !Modifier.isPublic(type.getModifiers())) {
                return null;
            }
            try {
                Constructor<?> constructor = comparator != null
                        ? type.getDeclaredConstructor(Comparator.class)
                        : type.getDeclaredConstructor();
                if (jdkType && !Modifier.isPublic(constructor.getModifiers())) {
                    return null;
                }
                if (!jdkType) {
                    constructor.setAccessible(true);
                }
                return comparator != null ? constructor.newInstance(comparator) : constructor.newInstance();
            } catch (NoSuchMethodException e) {
                return null;
            } catch (InvocationTargetException e) {
                throw new MaskCloneException(type, "container constructor threw", e.getCause());
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new MaskCloneException(type, "container is not instantiable", e);
            }
        }

        private Object copyRecord(Object source, Class<?> type) {
            if (!pendingValues.add(source)) {
                throw new MaskCloneException(type, "cyclic reference through a record cannot be reproduced");
            }
            try {
                RecordCopyPlan plan = recordPlanCache.computeIfAbsent(type, GraphCloner::recordPlanFor);
                Object[] values = new Object[plan.accessors().length];
                for (int i = 0; i < values.length; i++) {
                    values[i] = copy(plan.accessors()[i].invoke(source));
                }
                Object result = plan.constructor().newInstance(values);
                copies.put(source, result);
                return result;
            } catch (InvocationTargetException e) {
                throw new MaskCloneException(type, "record accessor or constructor threw", e.getCause());
            } catch (ReflectiveOperationException | IllegalArgumentException e) {
                throw new MaskCloneException(type, "record is not reconstructible", e);
            } finally {
                pendingValues.remove(source);
            }
        }

        /** JDK Map.Entry 구현: 키/값을 복제해 같은 가변성의 엔트리로 재생성 */
        private Object copyEntry(Map.Entry<?, ?> source, Class<?> type) {
            if (!pendingValues.add(source)) {
                throw new MaskCloneException(type, "cyclic reference through a map entry cannot be reproduced");
            }
            try {
                Object key = copy(source.getKey());
                Object value = copy(source.getValue());
                Map.Entry<?, ?> result;
                if (source instanceof AbstractMap.SimpleEntry<?, ?>) {
                    result = new AbstractMap.SimpleEntry<>(key, value);
                } else if (key != null && value != null) {
                    result = Map.entry(key, value);
                } else {
                    result = new AbstractMap.SimpleImmutableEntry<>(key, value);
                }
                copies.put(source, result);
                return result;
            } finally {
                pendingValues.remove(source);
            }
        }

        /** 가변 JDK 값: 공개 clone()이 있으면 사용 (Date, Calendar 등) */
        private Object copyJdkValue(Object source, Class<?> type) {
            if (!(source instanceof Cloneable)) {
                throw new MaskCloneException(type, "JDK type is neither immutable nor Cloneable");
            }
            try {
                Method cloneMethod = type.getMethod("clone");
                Object result = cloneMethod.invoke(source);
                copies.put(source, result);
                return result;
            } catch (InvocationTargetException e) {
                throw new MaskCloneException(type, "clone() threw", e.getCause());
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new MaskCloneException(type, "clone() is not accessible", e);
            }
        }

        private Object copyObject(Object source, Class<?> type) {
            ObjectCopyPlan plan = objectPlanCache.computeIfAbsent(type, GraphCloner::objectPlanFor);
            try {
                Object target = plan.constructor().newInstance();
                copies.put(source, target);

                for (Field field : plan.fields()) {
                    field.set(target, copy(field.get(source)));
                }
                return target;
            } catch (InvocationTargetException e) {
                throw new MaskCloneException(type, "no-arg constructor threw", e.getCause());
            } catch (ReflectiveOperationException | IllegalArgumentException e) {
                throw new MaskCloneException(type, "field copy failed", e);
            }
        }
    }

    private static ObjectCopyPlan objectPlanFor(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> current = type; current != Object.class; current = current.getSuperclass()) {
            if (NodeClassifier.isJdkType(current)) {
                throw new MaskCloneException(type,
                        "extends JDK type " + current.getName() + " whose state cannot be copied field by field");
            }
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                fields.add(field);
            }
        }

        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            fields.forEach(field -> field.setAccessible(true));
            log.debug("Prepared copy plan for {} ({} fields)", type.getName(), fields.size());
            return new ObjectCopyPlan(constructor, List.copyOf(fields));
        } catch (NoSuchMethodException e) {
            throw new MaskCloneException(type, "no no-arg constructor; implement DeepCloneable to supply a copy", e);
        } catch (RuntimeException e) {
            throw new MaskCloneException(type, "type is not accessible for reflection", e);
        }
    }

    private static RecordCopyPlan recordPlanFor(Class<?> type) {
        RecordComponent[] components = type.getRecordComponents();
        Method[] accessors = new Method[components.length];
        Class<?>[] componentTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            accessors[i] = components[i].getAccessor();
            componentTypes[i] = components[i].getType();
        }

        try {
            Constructor<?> constructor = type.getDeclaredConstructor(componentTypes);
            constructor.setAccessible(true);
            for (Method accessor : accessors) {
                accessor.setAccessible(true);
            }
            return new RecordCopyPlan(accessors, constructor);
        } catch (NoSuchMethodException e) {
            throw new MaskCloneException(type, "canonical constructor missing", e);
        } catch (RuntimeException e) {
            throw new MaskCloneException(type, "record is not accessible for reflection", e);
        }
    }

    /** 일반 객체 복제 계획 */
    private record ObjectCopyPlan(Constructor<?> constructor, List<Field> fields) {}

    /** record 복제 계획 */
    private record RecordCopyPlan(Method[] accessors, Constructor<?> constructor) {}
}
