package io.github.hongjungwan.responsemask.starter;

import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Response Mask SDK 설정 Properties (prefix: response-mask).
 */
@Data
@ConfigurationProperties(prefix = "response-mask")
public class ResponseMaskProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** 정책명 미지정 시 사용할 정책 */
    private String defaultPolicy = MaskConfig.DEFAULT_POLICY;

    /** 최대 탐색 깊이 */
    private int maxDepth = 256;

    /** 순환/공유 참조 탐지 */
    private boolean cycleDetection = true;

    /** 타입별 멤버 테이블 캐시 최대 크기 */
    private long metadataCacheSize = 1024;

    /** @MaskWhen 어노테이션 규칙 사용 여부 */
    private boolean annotationRulesEnabled = true;

    /** @MaskResult AOP 설정 */
    private AspectProperties aspect = new AspectProperties();

    @Data
    public static class AspectProperties {
        /** @MaskResult AOP 활성화 여부 */
        private boolean enabled = true;
    }
}
