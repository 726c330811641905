package io.github.hongjungwan.responsemask.core.metadata;

import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 런타임 타입을 {@link NodeShape}로 분류. 결과는 타입별로 캐시.
 *
 * JDK 패키지에 속한 타입은 컨테이너(배열/Collection/Map/Optional)를 제외하고 모두 SCALAR.
 */
public final class NodeClassifier {

    private static final List<String> JDK_PACKAGE_PREFIXES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun."
    );

    private static final ConcurrentHashMap<Class<?>, NodeShape> SHAPE_CACHE = new ConcurrentHashMap<>();

    private NodeClassifier() {}

    public static NodeShape classify(Class<?> type) {
        return SHAPE_CACHE.computeIfAbsent(type, NodeClassifier::computeShape);
    }

    private static NodeShape computeShape(Class<?> type) {
        if (type.isPrimitive() || Enum.class.isAssignableFrom(type)) {
            return NodeShape.SCALAR;
        }
        if (type.isArray()) {
            return type.getComponentType().isPrimitive() ? NodeShape.SCALAR : NodeShape.SEQUENCE;
        }
        if (Collection.class.isAssignableFrom(type)
                || Map.class.isAssignableFrom(type)
                || Optional.class.equals(type)) {
            return NodeShape.SEQUENCE;
        }
        // 람다 등 숨은 클래스는 내부를 탐색하지 않음
        if (isJdkType(type) || type.isHidden() || type.isSynthetic()) {
            return NodeShape.SCALAR;
        }
        return NodeShape.COMPOSITE;
    }

    /** JDK 플랫폼 타입 여부 (패키지명 기준) */
    public static boolean isJdkType(Class<?> type) {
        if (type.isPrimitive()) {
            return true;
        }
        String name = type.getName();
        for (String prefix : JDK_PACKAGE_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 선언 타입의 값이 SEQUENCE/COMPOSITE 노드일 수 있는지 확인.
     * false면 값을 읽지 않고 건너뜀. Object, 인터페이스 등은 런타임 값으로 다시 분류.
     */
    public static boolean canHoldComposite(Class<?> declaredType) {
        if (declaredType.isPrimitive() || declaredType.isEnum()) {
            return false;
        }
        if (classify(declaredType) != NodeShape.SCALAR) {
            return true;
        }
        return !Modifier.isFinal(declaredType.getModifiers());
    }

    /** 캐시 초기화. 테스트 또는 클래스 리로드 시 사용. */
    public static void clearCache() {
        SHAPE_CACHE.clear();
    }
}
