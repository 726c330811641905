package io.github.hongjungwan.responsemask.starter.aop;

import io.github.hongjungwan.responsemask.api.ResponseMasker;
import io.github.hongjungwan.responsemask.api.ResponseMaskerFactory;
import io.github.hongjungwan.responsemask.api.annotation.MaskResult;
import io.github.hongjungwan.responsemask.api.annotation.MaskWhen;
import io.github.hongjungwan.responsemask.api.config.MaskConfig;
import io.github.hongjungwan.responsemask.api.exception.MaskCloneException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.Signature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static io.github.hongjungwan.responsemask.test.MaskAssert.assertThatMasked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * MaskResultAspect 단위 테스트.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("MaskResultAspect 테스트")
class MaskResultAspectTest {

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private Signature signature;

    @Mock
    private CallingContextResolver contextResolver;

    private ResponseMasker responseMasker;
    private MaskResultAspect aspect;

    public static class PartnerController {}

    public static class EmployeeView {
        private String name;

        @MaskWhen(policies = "partner")
        private Long salary;

        @MaskWhen(endpoints = PartnerController.class)
        private String phone;

        public EmployeeView() {}

        public EmployeeView(String name, Long salary, String phone) {
            this.name = name;
            this.salary = salary;
            this.phone = phone;
        }
    }

    public static class Unclonable {
        private final String value;

        public Unclonable(String value) {
            this.value = value;
        }
    }

    @BeforeEach
    void setUp() {
        responseMasker = ResponseMaskerFactory.create(MaskConfig.builder().defaultPolicyName("partner").build());
        aspect = new MaskResultAspect(responseMasker, contextResolver);
        when(joinPoint.getSignature()).thenReturn(signature);
        when(signature.toShortString()).thenReturn("PartnerController.getEmployee()");
        when(contextResolver.resolve(any())).thenReturn(new PartnerController());
    }

    @Nested
    @DisplayName("반환값 마스킹")
    class ResultMasking {

        @Test
        @DisplayName("정책과 호출 문맥으로 반환값을 마스킹해야 한다")
        void shouldMaskResultWithPolicyAndContext() throws Throwable {
            // given
            EmployeeView original = new EmployeeView("kim", 5000L, "010-0000-0000");
            when(joinPoint.proceed()).thenReturn(original);

            // when
            Object result = aspect.maskMethodResult(joinPoint, maskResult("partner"));

            // then
            assertThatMasked(result)
                    .hasErased("salary")
                    .hasErased("phone")
                    .hasValue("name", "kim")
                    .sharesNoReferenceWith(original);
            assertThat(original.salary).isEqualTo(5000L);
        }

        @Test
        @DisplayName("빈 정책명은 기본 정책으로 평가해야 한다")
        void shouldUseDefaultPolicyForBlankPolicy() throws Throwable {
            // given
            when(joinPoint.proceed()).thenReturn(new EmployeeView("kim", 5000L, null));

            // when
            Object result = aspect.maskTypeResult(joinPoint, maskResult(""));

            // then
            assertThatMasked(result).hasErased("salary");
        }

        @Test
        @DisplayName("문맥이 없으면 엔드포인트 규칙은 일치하지 않아야 한다")
        void shouldKeepEndpointScopedMembersWithoutContext() throws Throwable {
            // given
            when(contextResolver.resolve(any())).thenReturn(null);
            when(joinPoint.proceed()).thenReturn(List.of(new EmployeeView("kim", 5000L, "010")));

            // when
            Object result = aspect.maskMethodResult(joinPoint, maskResult("internal"));

            // then
            assertThatMasked(result)
                    .hasRetained("[0].phone")
                    .hasRetained("[0].salary");
        }

        @Test
        @DisplayName("null 반환값은 마스킹하지 않아야 한다")
        void shouldPassThroughNull() throws Throwable {
            // given
            ResponseMasker mockMasker = mock(ResponseMasker.class);
            MaskResultAspect mockedAspect = new MaskResultAspect(mockMasker, contextResolver);
            when(joinPoint.proceed()).thenReturn(null);

            // when
            Object result = mockedAspect.maskMethodResult(joinPoint, maskResult("partner"));

            // then
            assertThat(result).isNull();
            verify(mockMasker, never()).mask(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("비동기 반환값")
    class AsyncResult {

        @Test
        @DisplayName("CompletionStage는 완료 시점에 마스킹해야 한다")
        void shouldMaskCompletionStageValue() throws Throwable {
            // given
            CompletableFuture<EmployeeView> future = new CompletableFuture<>();
            when(joinPoint.proceed()).thenReturn(future);

            // when
            Object result = aspect.maskMethodResult(joinPoint, maskResult("partner"));
            future.complete(new EmployeeView("kim", 5000L, "010"));

            // then
            assertThat(result).isInstanceOf(CompletableFuture.class);
            Object masked = ((CompletableFuture<?>) result).get();
            assertThatMasked(masked).hasErased("salary").hasValue("name", "kim");
        }
    }

    @Nested
    @DisplayName("예외 처리")
    class ExceptionHandling {

        @Test
        @DisplayName("대상 메서드 예외는 그대로 전파되어야 한다")
        void shouldPropagateTargetException() throws Throwable {
            // given
            when(joinPoint.proceed()).thenThrow(new IllegalStateException("not found"));

            // when & then
            assertThatThrownBy(() -> aspect.maskMethodResult(joinPoint, maskResult("partner")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("not found");
            verify(contextResolver, never()).resolve(any());
        }

        @Test
        @DisplayName("마스킹 실패는 삼키지 않고 전파해야 한다")
        void shouldPropagateMaskingFailure() throws Throwable {
            // given
            when(joinPoint.proceed()).thenReturn(new Unclonable("x"));

            // when & then
            assertThatThrownBy(() -> aspect.maskMethodResult(joinPoint, maskResult("partner")))
                    .isInstanceOf(MaskCloneException.class);
        }

        @Test
        @DisplayName("정책명을 그대로 마스커에 전달해야 한다")
        void shouldPassPolicyToMasker() throws Throwable {
            // given
            ResponseMasker mockMasker = mock(ResponseMasker.class);
            MaskResultAspect mockedAspect = new MaskResultAspect(mockMasker, contextResolver);
            when(joinPoint.proceed()).thenReturn("value");
            when(mockMasker.mask(any(), any(), any())).thenReturn("masked");

            // when
            Object named = mockedAspect.maskMethodResult(joinPoint, maskResult("partner"));
            mockedAspect.maskMethodResult(joinPoint, maskResult(" "));

            // then
            assertThat(named).isEqualTo("masked");
            verify(mockMasker).mask(eq("value"), any(PartnerController.class), eq("partner"));
            verify(mockMasker).mask(eq("value"), any(PartnerController.class), isNull());
        }
    }

    // ========== Helper Methods ==========

    private MaskResult maskResult(String policy) {
        return new MaskResult() {
            @Override
            public Class<? extends java.lang.annotation.Annotation> annotationType() {
                return MaskResult.class;
            }

            @Override
            public String policy() {
                return policy;
            }
        };
    }
}
