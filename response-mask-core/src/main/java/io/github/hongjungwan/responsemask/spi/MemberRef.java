package io.github.hongjungwan.responsemask.spi;

import java.lang.reflect.AnnotatedElement;
import java.util.List;

/**
 * 규칙 공급자에게 전달되는 멤버 정보.
 *
 * @param ownerType          멤버 테이블을 구성 중인 런타임 타입
 * @param name               멤버 이름 (프로퍼티명 또는 필드명)
 * @param kind               멤버 종류
 * @param type               선언 타입
 * @param annotatedElements  어노테이션을 읽을 요소 (getter/setter, 필드, record 컴포넌트)
 */
public record MemberRef(
        Class<?> ownerType,
        String name,
        MemberKind kind,
        Class<?> type,
        List<AnnotatedElement> annotatedElements
) {
}
