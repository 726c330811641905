package io.github.hongjungwan.responsemask.api.config;

import lombok.Builder;
import lombok.Getter;

/**
 * SDK 설정. 기본 정책, 탐색 깊이 제한, 순환 탐지, 메타데이터 캐시 설정 포함.
 */
@Getter
@Builder
public class MaskConfig {

    public static final String DEFAULT_POLICY = "default";

    /** 정책명 미지정(null) 시 사용할 정책 */
    @Builder.Default
    private final String defaultPolicyName = DEFAULT_POLICY;

    /** 최대 탐색 깊이. 초과 시 MaskDepthExceededException */
    @Builder.Default
    private final int maxDepth = 256;

    /** 순환/공유 참조 탐지 (동일 인스턴스 재방문 시 건너뜀) */
    @Builder.Default
    private final boolean cycleDetection = true;

    /** 타입별 멤버 테이블 캐시 최대 크기 */
    @Builder.Default
    private final long metadataCacheSize = 1024;

    /** @MaskWhen 어노테이션 규칙 사용 여부 */
    @Builder.Default
    private final boolean annotationRulesEnabled = true;

    /** 기본 설정 */
    public static MaskConfig defaultConfig() {
        return MaskConfig.builder().build();
    }

    /** null 정책명을 기본 정책으로 치환 */
    public String resolvePolicy(String policyName) {
        return policyName != null ? policyName : defaultPolicyName;
    }
}
