package io.github.hongjungwan.responsemask.test;

import io.github.hongjungwan.responsemask.core.metadata.NodeClassifier;
import io.github.hongjungwan.responsemask.core.metadata.NodeShape;
import org.assertj.core.api.AbstractAssert;
import org.assertj.core.util.introspection.PropertyOrFieldSupport;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 마스킹 결과 검증용 Fluent API TestKit. AssertJ 스타일 메서드 체이닝 지원.
 *
 * 경로 형식: {@code "children[0].name"} (멤버명은 '.'로 구분, 리스트/배열 인덱스와 Map 키는 [ ] 안에 지정)
 */
public class MaskAssert extends AbstractAssert<MaskAssert, Object> {

    public MaskAssert(Object actual) {
        super(actual, MaskAssert.class);
    }

    public static MaskAssert assertThatMasked(Object actual) {
        return new MaskAssert(actual);
    }

    /** 경로의 값이 지워진 상태인지 검증 (null, Optional.empty, 원시형 기본값) */
    public MaskAssert hasErased(String path) {
        isNotNull();

        Object value = valueAt(path);
        if (!isErased(value)) {
            failWithMessage("Expected <%s> to be erased but was <%s>", path, value);
        }

        return this;
    }

    /** 경로의 값이 지워지지 않았는지 검증 */
    public MaskAssert hasRetained(String path) {
        isNotNull();

        Object value = valueAt(path);
        if (isErased(value)) {
            failWithMessage("Expected <%s> to be retained but it was erased (<%s>)", path, value);
        }

        return this;
    }

    /** 경로의 값 일치 검증 */
    public MaskAssert hasValue(String path, Object expected) {
        isNotNull();

        Object value = valueAt(path);
        if (!Objects.equals(expected, value)) {
            failWithMessage("Expected <%s> to be <%s> but was <%s>", path, expected, value);
        }

        return this;
    }

    /** 원본 그래프와 SEQUENCE/COMPOSITE 노드를 하나도 공유하지 않는지 검증 */
    public MaskAssert sharesNoReferenceWith(Object original) {
        isNotNull();

        Set<Object> originalNodes = collectNodes(original);
        for (Object node : collectNodes(actual)) {
            if (originalNodes.contains(node)) {
                failWithMessage("Expected no shared references with the original but found shared <%s> (%s)",
                        node, node.getClass().getName());
            }
        }

        return this;
    }

    // ========== Path ==========

    private Object valueAt(String path) {
        Object current = actual;
        StringBuilder walked = new StringBuilder();

        for (String segment : path.split("\\.")) {
            int bracket = segment.indexOf('[');
            String name = bracket < 0 ? segment : segment.substring(0, bracket);

            if (!name.isEmpty()) {
                current = member(current, name, walked);
                append(walked, name);
            }

            while (bracket >= 0) {
                int close = segment.indexOf(']', bracket);
                if (close < 0) {
                    failWithMessage("Malformed path <%s>", path);
                }
                String key = segment.substring(bracket + 1, close);
                current = element(current, key, walked);
                walked.append('[').append(key).append(']');
                bracket = segment.indexOf('[', close);
            }
        }
        return current;
    }

    private Object member(Object target, String name, CharSequence walked) {
        if (target == null) {
            failWithMessage("Cannot read <%s> because <%s> is null", name, walked.length() == 0 ? "actual" : walked);
        }
        return PropertyOrFieldSupport.EXTRACTION.getSimpleValue(name, target);
    }

    private Object element(Object target, String key, CharSequence walked) {
        if (target == null) {
            failWithMessage("Cannot read [%s] because <%s> is null", key, walked);
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(key);
        }
        int index = Integer.parseInt(key);
        if (target instanceof List<?> list) {
            return list.get(index);
        }
        if (target.getClass().isArray()) {
            return Array.get(target, index);
        }
        failWithMessage("<%s> is neither a list, an array nor a map", walked);
        return null;
    }

    private static void append(StringBuilder walked, String name) {
        if (walked.length() > 0) {
            walked.append('.');
        }
        walked.append(name);
    }

    private static boolean isErased(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (value instanceof Boolean bool) {
            return !bool;
        }
        if (value instanceof Character character) {
            return character == '\0';
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0d;
        }
        return false;
    }

    // ========== Graph ==========

    /** 그래프의 SEQUENCE/COMPOSITE 노드를 동일성 기준으로 수집 */
    private static Set<Object> collectNodes(Object root) {
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> pending = new ArrayDeque<>();
        if (root != null) {
            pending.push(root);
        }

        while (!pending.isEmpty()) {
            Object node = pending.pop();
            if (NodeClassifier.classify(node.getClass()) == NodeShape.SCALAR || !visited.add(node)) {
                continue;
            }
            for (Object child : children(node)) {
                if (child != null) {
                    pending.push(child);
                }
            }
        }
        return visited;
    }

    private static List<Object> children(Object node) {
        List<Object> children = new ArrayList<>();
        if (node.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(node); i++) {
                children.add(Array.get(node, i));
            }
        } else if (node instanceof Collection<?> collection) {
            children.addAll(collection);
        } else if (node instanceof Map<?, ?> map) {
            children.addAll(map.keySet());
            children.addAll(map.values());
        } else if (node instanceof Optional<?> optional) {
            optional.ifPresent(children::add);
        } else {
            for (Class<?> type = node.getClass(); type != null && !NodeClassifier.isJdkType(type);
                 type = type.getSuperclass()) {
                for (Field field : type.getDeclaredFields()) {
                    if (Modifier.isStatic(field.getModifiers())) {
                        continue;
                    }
                    field.setAccessible(true);
                    try {
                        children.add(field.get(node));
                    } catch (IllegalAccessException e) {
                        throw new IllegalStateException("Cannot read " + field, e);
                    }
                }
            }
        }
        return children;
    }
}
