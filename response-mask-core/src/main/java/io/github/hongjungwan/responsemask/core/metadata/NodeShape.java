package io.github.hongjungwan.responsemask.core.metadata;

/**
 * 객체 그래프 노드 분류.
 */
public enum NodeShape {

    /** 더 이상 탐색하지 않는 값 (원시 타입, 래퍼, String, enum, JDK 값 타입) */
    SCALAR,

    /** 배열, Collection, Map(값), Optional */
    SEQUENCE,

    /** 이름 있는 멤버를 가진 객체 */
    COMPOSITE
}
