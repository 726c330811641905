package io.github.hongjungwan.responsemask.core.walker;

import io.github.hongjungwan.responsemask.api.MaskScope;
import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import io.github.hongjungwan.responsemask.api.exception.MaskDepthExceededException;
import io.github.hongjungwan.responsemask.api.exception.MaskIntrospectionException;
import io.github.hongjungwan.responsemask.core.metadata.Member;
import io.github.hongjungwan.responsemask.core.metadata.MemberIntrospector;
import io.github.hongjungwan.responsemask.core.metadata.MemberTable;
import io.github.hongjungwan.responsemask.core.metadata.NodeClassifier;
import io.github.hongjungwan.responsemask.core.metadata.NodeShape;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.Set;

/**
 * 재귀 마스킹 탐색기. 1회 마스킹 호출 전용 (스레드 간 공유 금지).
 *
 * 이미 복제된 그래프를 제자리에서 변경. 멤버 순서: 프로퍼티 -> 필드.
 * 규칙 일치 멤버는 지우고 하위로 내려가지 않음. 불일치 멤버는 SCALAR가 아니면 재귀 탐색.
 * record는 재할당이 불가하므로 변경 시 새 인스턴스를 반환하고 상위 슬롯에 다시 기록.
 */
@Slf4j
public class MaskWalker {

    private final MemberIntrospector introspector;
    private final Object context;
    private final String policyName;
    private final int maxDepth;
    private final boolean cycleDetection;

    // 방문 노드 -> (상위 타입 -> 처리 결과). 규칙이 상위 타입에 따라 달라지므로 경로별로 한 번씩 처리
    private final Map<Object, Map<Class<?>, Object>> processed = new IdentityHashMap<>();

    public MaskWalker(MemberIntrospector introspector, MaskConfig config, Object context, String policyName) {
        this.introspector = introspector;
        this.context = context;
        this.policyName = config.resolvePolicy(policyName);
        this.maxDepth = config.getMaxDepth();
        this.cycleDetection = config.isCycleDetection();
    }

    /** 루트 노드부터 탐색. 반환값은 루트 자신 (루트가 record이고 변경된 경우 새 인스턴스) */
    public Object walk(Object root) {
        return walk(root, null, 0);
    }

    private Object walk(Object node, Class<?> enclosingType, int depth) {
        if (node == null) {
            return null;
        }

        Class<?> type = node.getClass();
        NodeShape shape = NodeClassifier.classify(type);
        if (shape == NodeShape.SCALAR) {
            return node;
        }
        if (depth > maxDepth) {
            throw new MaskDepthExceededException(maxDepth, type);
        }

        Map<Class<?>, Object> visits = null;
        if (cycleDetection) {
            visits = processed.computeIfAbsent(node, key -> new HashMap<>());
            Object done = visits.get(enclosingType);
            if (done != null) {
                log.trace("Skipping already visited {} (enclosing={})", type.getName(), enclosingType);
                return done;
            }
            visits.put(enclosingType, node);
        }

        Object result = switch (shape) {
            case SEQUENCE -> walkSequence(node, enclosingType, depth);
            case COMPOSITE -> walkComposite(node, enclosingType, depth);
            case SCALAR -> node;
        };

        if (visits != null && result != node) {
            visits.put(enclosingType, result);
        }
        return result;
    }

    // ========== Sequence ==========

    /** 시퀀스 자체는 지우지 않고 원소만 탐색. 상위 타입은 그대로 원소에 전달 */
    private Object walkSequence(Object node, Class<?> enclosingType, int depth) {
        if (node.getClass().isArray()) {
            int length = Array.getLength(node);
            for (int i = 0; i < length; i++) {
                Object element = Array.get(node, i);
                Object result = walk(element, enclosingType, depth + 1);
                if (result != element) {
                    Array.set(node, i, result);
                }
            }
            return node;
        }

        if (node instanceof List<?> list) {
            walkList(list, enclosingType, depth);
            return node;
        }

        if (node instanceof Collection<?> collection) {
            walkCollection(collection, enclosingType, depth);
            return node;
        }

        if (node instanceof Map<?, ?> map) {
            walkMapValues(map, enclosingType, depth);
            return node;
        }

        if (node instanceof Optional<?> optional && optional.isPresent()) {
            Object value = optional.get();
            Object result = walk(value, enclosingType, depth + 1);
            return result != value ? Optional.of(result) : node;
        }

        return node;
    }

    /** RandomAccess 목록은 인덱스로 교체 (스냅샷 반복자가 set을 지원하지 않는 구현 대응) */
    @SuppressWarnings("unchecked")
    private void walkList(List<?> list, Class<?> enclosingType, int depth) {
        List<Object> target = (List<Object>) list;
        ListIterator<Object> iterator = list instanceof RandomAccess ? null : target.listIterator();
        int size = target.size();

        for (int index = 0; index < size; index++) {
            Object element = iterator != null ? iterator.next() : target.get(index);
            Object result = walk(element, enclosingType, depth + 1);
            if (result == element) {
                continue;
            }
            try {
                if (iterator != null) {
                    iterator.set(result);
                } else {
                    target.set(index, result);
                }
            } catch (UnsupportedOperationException e) {
                throw new MaskIntrospectionException(list.getClass(), "[" + index + "]",
                        "list does not support element replacement", e);
            }
        }
    }

    /**
     * Set/Queue 등: 원소가 제자리 변경되면 해시 위치가 달라지므로 복합 원소가 있으면 다시 채움.
     */
    @SuppressWarnings("unchecked")
    private void walkCollection(Collection<?> collection, Class<?> enclosingType, int depth) {
        List<Object> results = new ArrayList<>(collection.size());
        boolean refill = false;
        for (Object element : collection) {
            Object result = walk(element, enclosingType, depth + 1);
            results.add(result);
            refill |= result != null && NodeClassifier.classify(result.getClass()) != NodeShape.SCALAR;
        }

        if (refill) {
            Collection<Object> target = (Collection<Object>) collection;
            try {
                target.clear();
                target.addAll(results);
            } catch (UnsupportedOperationException e) {
                throw new MaskIntrospectionException(collection.getClass(), "[]",
                        "collection does not support element replacement", e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void walkMapValues(Map<?, ?> map, Class<?> enclosingType, int depth) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object value = entry.getValue();
            Object result = walk(value, enclosingType, depth + 1);
            if (result != value) {
                try {
                    ((Map.Entry<Object, Object>) entry).setValue(result);
                } catch (UnsupportedOperationException e) {
                    throw new MaskIntrospectionException(map.getClass(), String.valueOf(entry.getKey()),
                            "map does not support value replacement", e);
                }
            }
        }
    }

    // ========== Composite ==========

    private Object walkComposite(Object node, Class<?> enclosingType, int depth) {
        Class<?> type = node.getClass();
        MemberTable table = introspector.tableFor(type);
        if (table.isRecord()) {
            return walkRecord(node, table, enclosingType, depth);
        }

        // 프로퍼티 단계에서 지운 이름과 탐색을 마친 값
        // getter가 복사본을 반환하면 필드 값은 다른 인스턴스이므로 필드 단계에서 다시 탐색
        Set<String> erased = new HashSet<>();
        Map<String, Object> walked = new HashMap<>();

        for (Member property : table.getProperties()) {
            if (property.matches(scopeFor(type, enclosingType, property))) {
                erase(node, property);
                erased.add(property.getName());
                continue;
            }
            Object value = descend(node, property, null, depth);
            if (value != null) {
                walked.put(property.getName(), value);
            }
        }

        for (Member field : table.getFields()) {
            if (field.matches(scopeFor(type, enclosingType, field))) {
                erase(node, field);
                continue;
            }
            if (!erased.contains(field.getName())) {
                descend(node, field, walked.get(field.getName()), depth);
            }
        }

        return node;
    }

    /** record: 컴포넌트 값을 모아 변경이 있으면 정규 생성자로 재생성 */
    private Object walkRecord(Object node, MemberTable table, Class<?> enclosingType, int depth) {
        Class<?> type = node.getClass();
        List<Member> components = table.getComponents();
        Object[] values = new Object[components.size()];
        boolean changed = false;

        for (int i = 0; i < values.length; i++) {
            Member component = components.get(i);
            Object value = component.read(node);

            if (component.matches(scopeFor(type, enclosingType, component))) {
                values[i] = component.emptyValue();
                changed |= value != null && !value.equals(values[i]);
                log.debug("Masked {}.{} (policy={})", type.getSimpleName(), component.getName(), policyName);
            } else if (value != null && component.isCompositeCapable()) {
                values[i] = walk(value, type, depth + 1);
                changed |= values[i] != value;
            } else {
                values[i] = value;
            }
        }

        return changed ? table.instantiate(values) : node;
    }

    private void erase(Object node, Member member) {
        if (!member.isWritable()) {
            // 읽기 전용 프로퍼티는 값을 유지
            log.debug("Skipped read-only {}.{} matched by policy={}",
                    node.getClass().getSimpleName(), member.getName(), policyName);
            return;
        }
        member.write(node, member.emptyValue());
        log.debug("Masked {}.{} (policy={})", node.getClass().getSimpleName(), member.getName(), policyName);
    }

    /**
     * 멤버 값으로 재귀 탐색 후 변경된 값을 다시 기록.
     *
     * @param alreadyWalked 같은 이름의 프로퍼티로 이미 탐색한 값. 멤버 값이 이 인스턴스면 건너뜀
     * @return 탐색을 마친 값 (새 값을 기록했으면 그 값). 읽은 값이 없거나 새 값(record 재생성 등)을 기록하지 못했으면 null
     */
    private Object descend(Object node, Member member, Object alreadyWalked, int depth) {
        if (!member.isCompositeCapable()) {
            return null;
        }
        Object value = member.read(node);
        if (value == null || value == alreadyWalked) {
            return value;
        }

        Object result = walk(value, node.getClass(), depth + 1);
        if (result == value) {
            return value;
        }
        if (!member.isWritable()) {
            return null;
        }
        member.write(node, result);
        return result;
    }

    private MaskScope scopeFor(Class<?> declaringType, Class<?> enclosingType, Member member) {
        return new MaskScope(context, declaringType, enclosingType, member.getName(), policyName);
    }
}
