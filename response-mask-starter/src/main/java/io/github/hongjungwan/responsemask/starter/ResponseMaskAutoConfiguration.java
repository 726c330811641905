package io.github.hongjungwan.responsemask.starter;

import io.github.hongjungwan.responsemask.api.ResponseMasker;
import io.github.hongjungwan.responsemask.api.ResponseMaskerFactory;
import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import io.github.hongjungwan.responsemask.starter.aop.CallingContextResolver;
import io.github.hongjungwan.responsemask.starter.aop.MaskResultAspect;
import io.github.hongjungwan.responsemask.starter.aop.TargetBeanContextResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.util.List;

/**
 * Response Mask SDK Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(ResponseMaskProperties.class)
@ConditionalOnProperty(prefix = "response-mask", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(ResponseMaskAutoConfiguration.MaskResultConfiguration.class)
@Slf4j
public class ResponseMaskAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MaskConfig maskConfig(ResponseMaskProperties properties) {
        if (!properties.isCycleDetection()) {
            log.warn("Cycle detection disabled - cyclic responses will fail with MaskDepthExceededException");
        }
        return MaskConfig.builder()
                .defaultPolicyName(properties.getDefaultPolicy())
                .maxDepth(properties.getMaxDepth())
                .cycleDetection(properties.isCycleDetection())
                .metadataCacheSize(properties.getMetadataCacheSize())
                .annotationRulesEnabled(properties.isAnnotationRulesEnabled())
                .build();
    }

    /**
     * 컨텍스트에 등록된 MaskRuleSource 빈은 어노테이션/ServiceLoader 규칙 뒤에 추가.
     */
    @Bean
    @ConditionalOnMissingBean
    public ResponseMasker responseMasker(MaskConfig config, ObjectProvider<MaskRuleSource> ruleSources) {
        List<MaskRuleSource> sources = ruleSources.orderedStream().toList();
        if (!sources.isEmpty()) {
            log.info("Registering {} MaskRuleSource bean(s)", sources.size());
        }
        return ResponseMaskerFactory.create(config, sources);
    }

    /**
     * AOP 기반 @MaskResult 지원 설정.
     * response-mask.aspect.enabled=true 시 활성화 (기본값: true)
     */
    @Configuration
    @ConditionalOnProperty(prefix = "response-mask.aspect", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MaskResultConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public CallingContextResolver callingContextResolver() {
            return new TargetBeanContextResolver();
        }

        @Bean
        @ConditionalOnMissingBean
        public MaskResultAspect maskResultAspect(ResponseMasker responseMasker, CallingContextResolver contextResolver) {
            log.info("MaskResultAspect enabled - @MaskResult return values will be masked");
            return new MaskResultAspect(responseMasker, contextResolver);
        }
    }
}
