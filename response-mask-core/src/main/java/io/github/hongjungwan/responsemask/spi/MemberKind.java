package io.github.hongjungwan.responsemask.spi;

/**
 * 멤버 종류. 탐색 순서는 PROPERTY -> FIELD.
 */
public enum MemberKind {

    /** getter(필수) + setter(선택) 쌍 */
    PROPERTY,

    /** 인스턴스 필드 */
    FIELD,

    /** record 컴포넌트 */
    RECORD_COMPONENT
}
