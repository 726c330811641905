package io.github.hongjungwan.responsemask.core.internal;

import io.github.hongjungwan.responsemask.api.ResponseMasker;
import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import io.github.hongjungwan.responsemask.core.clone.GraphCloner;
import io.github.hongjungwan.responsemask.core.metadata.MemberIntrospector;
import io.github.hongjungwan.responsemask.core.walker.MaskWalker;
import io.github.hongjungwan.responsemask.spi.MaskRuleSource;
import lombok.extern.slf4j.Slf4j;

/**
 * 기본 ResponseMasker 구현. 복제(GraphCloner) -> 탐색(MaskWalker) 순서로 처리.
 *
 * 타입별 메타데이터 캐시 외에는 호출 간 공유 상태가 없어 여러 스레드에서 동시 사용 가능.
 */
@Slf4j
public class DefaultResponseMasker implements ResponseMasker {

    private final MaskConfig config;
    private final GraphCloner cloner;
    private final MemberIntrospector introspector;

    public DefaultResponseMasker(MaskConfig config, MaskRuleSource ruleSource) {
        if (config == null) {
            throw new IllegalArgumentException("MaskConfig must not be null");
        }
        if (config.getDefaultPolicyName() == null || config.getDefaultPolicyName().isBlank()) {
            throw new IllegalArgumentException("Default policy name must not be blank");
        }
        if (config.getMaxDepth() <= 0) {
            throw new IllegalArgumentException("Max depth must be positive, got: " + config.getMaxDepth());
        }
        this.config = config;
        this.cloner = new GraphCloner();
        this.introspector = new MemberIntrospector(ruleSource, config.getMetadataCacheSize());
        log.info("ResponseMasker initialized (defaultPolicy={}, maxDepth={}, cycleDetection={})",
                config.getDefaultPolicyName(), config.getMaxDepth(), config.isCycleDetection());
    }

    @Override
    public <T> T mask(T data, String policyName) {
        return mask(data, null, policyName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T mask(T data, Object context, String policyName) {
        if (data == null) {
            return null;
        }

        // 원본과의 참조를 끊은 뒤 복제본만 변경
        T copy = cloner.deepClone(data);
        MaskWalker walker = new MaskWalker(introspector, config, context, policyName);
        return (T) walker.walk(copy);
    }

    public MaskConfig getConfig() {
        return config;
    }

    /** 캐시 초기화. 테스트 또는 클래스 리로드 시 사용. */
    public void clearCache() {
        cloner.clearCache();
        introspector.clearCache();
    }
}
