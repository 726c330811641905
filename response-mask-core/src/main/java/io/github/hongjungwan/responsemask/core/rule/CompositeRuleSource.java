package io.github.hongjungwan.responsemask.core.rule;

import io.github.hongjungwan.responsemask.api.MaskRule;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import io.github.hongjungwan.responsemask.spi.MemberRef;

import java.util.ArrayList;
import java.util.List;

/**
 * 여러 규칙 공급자의 결과를 순서대로 합침.
 */
public class CompositeRuleSource implements MaskRuleSource {

    private final List<MaskRuleSource> sources;

    public CompositeRuleSource(List<? extends MaskRuleSource> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public List<MaskRule> rulesFor(MemberRef member) {
        List<MaskRule> rules = new ArrayList<>();
        for (MaskRuleSource source : sources) {
            List<MaskRule> found = source.rulesFor(member);
            if (found != null) {
                rules.addAll(found);
            }
        }
        return rules;
    }

    public List<MaskRuleSource> getSources() {
        return sources;
    }
}
