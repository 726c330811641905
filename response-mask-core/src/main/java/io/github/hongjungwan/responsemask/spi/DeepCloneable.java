package io.github.hongjungwan.responsemask.spi;

/**
 * 타입이 직접 제공하는 깊은 복제.
 *
 * 리플렉션 복제가 불가능하거나(기본 생성자 없음 등) 복제 방식을 고정하고 싶을 때 구현.
 * 반환값은 원본과 하위 객체를 공유하지 않아야 함. 하위 값은 {@link CloneContext#copy}로 복제.
 */
public interface DeepCloneable<T> {

    T deepClone(CloneContext context);
}
