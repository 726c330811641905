package io.github.hongjungwan.responsemask.api;

import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import io.github.hongjungwan.responsemask.core.internal.DefaultResponseMasker;
import io.github.hongjungwan.responsemask.core.rule.AnnotationRuleSource;
import io.github.hongjungwan.responsemask.core.rule.CompositeRuleSource;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * ResponseMasker 인스턴스 팩토리.
 *
 * 규칙 공급 순서: @MaskWhen 어노테이션 -> ServiceLoader 등록 공급자 -> 인자로 전달된 공급자.
 */
public final class ResponseMaskerFactory {

    private static volatile ResponseMasker defaultMasker;

    private ResponseMaskerFactory() {}

    /** 기본 설정 마스커 (지연 생성 후 재사용) */
    public static ResponseMasker getDefault() {
        ResponseMasker masker = defaultMasker;
        if (masker == null) {
            synchronized (ResponseMaskerFactory.class) {
                masker = defaultMasker;
                if (masker == null) {
                    masker = create(MaskConfig.defaultConfig());
                    defaultMasker = masker;
                }
            }
        }
        return masker;
    }

    /** 설정과 추가 규칙 공급자로 새 마스커 생성 */
    public static ResponseMasker create(MaskConfig config, MaskRuleSource... additionalSources) {
        return create(config, List.of(additionalSources));
    }

    public static ResponseMasker create(MaskConfig config, List<? extends MaskRuleSource> additionalSources) {
        List<MaskRuleSource> sources = new ArrayList<>();
        if (config.isAnnotationRulesEnabled()) {
            sources.add(new AnnotationRuleSource());
        }
        for (MaskRuleSource source : ServiceLoader.load(MaskRuleSource.class)) {
            sources.add(source);
        }
        sources.addAll(additionalSources);
        return new DefaultResponseMasker(config, new CompositeRuleSource(sources));
    }

    /** 기본 마스커 초기화 */
    public static void reset() {
        defaultMasker = null;
    }
}
