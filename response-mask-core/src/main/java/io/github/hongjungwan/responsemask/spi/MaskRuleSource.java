package io.github.hongjungwan.responsemask.spi;

import io.github.hongjungwan.responsemask.api.MaskRule;

import java.util.List;

/**
 * 마스킹 규칙 공급 SPI. 어노테이션 외 방식(설정 파일, 레지스트리 등)으로 규칙을 선언할 때 구현.
 *
 * 타입별 멤버 테이블 생성 시 멤버마다 한 번 호출되고 결과는 캐시됨.
 */
public interface MaskRuleSource {

    /** 멤버에 적용할 규칙 목록. 없으면 빈 목록 */
    List<MaskRule> rulesFor(MemberRef member);
}
