package io.github.hongjungwan.responsemask.fixture;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import io.github.hongjungwan.responsemask.spi.MemberRef;

import java.util.List;

/**
 * META-INF/services로 등록되는 규칙 공급자.
 */
public class TicketRuleSource implements MaskRuleSource {

    @Override
    public List<MaskRule> rulesFor(MemberRef member) {
        if (member.ownerType() == Ticket.class && member.name().equals("internalCode")) {
            return List.of(MaskRule.forPolicies("public"));
        }
        return List.of();
    }
}
