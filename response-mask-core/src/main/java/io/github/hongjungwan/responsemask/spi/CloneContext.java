package io.github.hongjungwan.responsemask.spi;

/**
 * 진행 중인 깊은 복제 세션. {@link DeepCloneable} 구현체가 하위 값을 복제할 때 사용.
 *
 * 동일 세션 내에서 같은 인스턴스는 한 번만 복제되어 공유/순환 참조 구조가 유지됨.
 */
public interface CloneContext {

    <V> V copy(V value);
}
