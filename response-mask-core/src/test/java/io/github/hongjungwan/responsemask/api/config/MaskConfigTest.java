package io.github.hongjungwan.responsemask.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MaskConfig 테스트")
class MaskConfigTest {

    @Nested
    @DisplayName("기본 설정")
    class DefaultConfigTests {

        @Test
        @DisplayName("기본 설정이 올바르게 적용되어야 한다")
        void shouldHaveCorrectDefaults() {
            // when
            MaskConfig config = MaskConfig.defaultConfig();

            // then
            assertThat(config.getDefaultPolicyName()).isEqualTo(MaskConfig.DEFAULT_POLICY);
            assertThat(config.getMaxDepth()).isEqualTo(256);
            assertThat(config.isCycleDetection()).isTrue();
            assertThat(config.getMetadataCacheSize()).isEqualTo(1024L);
            assertThat(config.isAnnotationRulesEnabled()).isTrue();
        }
    }

    @Nested
    @DisplayName("정책 결정")
    class PolicyResolution {

        @Test
        @DisplayName("null 정책명은 기본 정책으로 치환되어야 한다")
        void shouldResolveNullToDefaultPolicy() {
            // given
            MaskConfig config = MaskConfig.builder()
                    .defaultPolicyName("internal")
                    .build();

            // when & then
            assertThat(config.resolvePolicy(null)).isEqualTo("internal");
            assertThat(config.resolvePolicy("public")).isEqualTo("public");
        }

        @Test
        @DisplayName("빈 문자열은 정책명으로 그대로 사용해야 한다")
        void shouldKeepEmptyPolicyName() {
            assertThat(MaskConfig.defaultConfig().resolvePolicy("")).isEmpty();
        }
    }
}
