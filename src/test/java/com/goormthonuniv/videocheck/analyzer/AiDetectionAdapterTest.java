package com.goormthonuniv.videocheck.analyzer;

import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.exception.AnalyzerFailureException;
import com.goormthonuniv.videocheck.llm.InferenceException;
import com.goormthonuniv.videocheck.llm.InferenceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * AiDetectionAdapter 단위 테스트 (variant 호출/접기 공통 흐름 포함)
 */
@ExtendWith(MockitoExtension.class)
class AiDetectionAdapterTest {

    @Mock
    private InferenceProvider provider;

    private AiDetectionAdapter adapter;

    private final AnalysisRequest request = new AnalysisRequest(new byte[]{1, 2, 3}, "video/mp4", 60);

    @BeforeEach
    void setUp() {
        adapter = new AiDetectionAdapter(provider, Runnable::run);
    }

    private void stub(String variant, String response) {
        when(provider.invoke(eq(AiDetectionAdapter.Prompt.VARIANTS.get(variant)), any(), anyString()))
                .thenReturn(response);
    }

    @Test
    @DisplayName("성공한 variant 신뢰도 평균 (60, 80 → 70), 실패 variant 는 제외")
    void averagesSucceededVariants() {
        // given
        stub("deepfake", "confidence: 60");
        stub("synthetic", "confidence: 80");
        when(provider.invoke(eq(AiDetectionAdapter.Prompt.VARIANTS.get("manipulation")), any(), anyString()))
                .thenThrow(new InferenceException("quota exceeded"));

        // when
        AnalyzerResult result = adapter.analyze(request).join();

        // then
        assertThat(result.confidence()).isEqualTo(70);
        assertThat(result.explanation()).isEqualTo("Combined AI Detection Analysis:"
                + "\n\nAnalysis 1 (deepfake): confidence: 60"
                + "\n\nAnalysis 2 (synthetic): confidence: 80");
        assertThat(result.indicators()).containsOnlyKeys(
                "facial_inconsistencies", "temporal_artifacts", "lighting_anomalies", "compression_artifacts");
        verify(provider, times(3)).invoke(anyString(), any(), eq("video/mp4"));
    }

    @Test
    @DisplayName("평균 신뢰도는 정수로 반올림")
    void roundsMeanConfidence() {
        stub("deepfake", "confidence: 60");
        stub("synthetic", "confidence: 61");
        stub("manipulation", "confidence: 61");

        assertThat(adapter.analyze(request).join().confidence()).isEqualTo(61);
    }

    @Test
    @DisplayName("기법은 처음 나온 순서대로 합집합")
    void unionsTechniques() {
        stub("deepfake", "confidence: 90. Classic deepfake with face swap.");
        stub("synthetic", "confidence: 85. GANs and face swap artifacts.");
        stub("manipulation", "confidence: 80. Deepfake.");

        AnalyzerResult result = adapter.analyze(request).join();

        assertThat(result.techniques()).containsExactly("deepfake", "face swap", "GANs");
    }

    @Test
    @DisplayName("빈 응답은 해당 variant 실패로 본다")
    void blankResponseCountsAsFailure() {
        stub("deepfake", "   ");
        stub("synthetic", "confidence: 40");
        stub("manipulation", "confidence: 50");
        when(provider.name()).thenReturn("gemini");

        assertThat(adapter.analyze(request).join().confidence()).isEqualTo(45);
    }

    @Test
    @DisplayName("모든 variant 실패 → AnalyzerFailureException")
    void allVariantsFail() {
        // given
        when(provider.invoke(anyString(), any(), anyString())).thenThrow(new InferenceException("down"));

        // when & then
        assertThatThrownBy(() -> adapter.analyze(request).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(AnalyzerFailureException.class)
                .hasMessageContaining("All AI Detection variants failed")
                .hasMessageContaining("deepfake: down");
    }

    @Test
    @DisplayName("프롬프트 variant 표는 수정할 수 없다")
    void variantTablesAreUnmodifiable() {
        assertThatThrownBy(() -> AiDetectionAdapter.Prompt.VARIANTS.put("extra", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ManipulationAdapter.Prompt.VARIANTS.remove("temporal"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> AuthenticityAdapter.Prompt.VARIANTS.clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(AiDetectionAdapter.Prompt.VARIANTS).containsOnlyKeys("deepfake", "synthetic", "manipulation");
    }

    @Test
    @DisplayName("결과를 취소하면 실행 중인 variant 호출은 인터럽트되어 스레드를 돌려준다")
    void cancellationInterruptsRunningCalls() throws Exception {
        // given: 실제 풀 위에서 멈춰 있는 호출 3개
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(3);
        pool.setMaxPoolSize(3);
        pool.setQueueCapacity(0);
        pool.initialize();
        CountDownLatch started = new CountDownLatch(3);
        CountDownLatch interrupted = new CountDownLatch(3);
        when(provider.invoke(anyString(), any(), anyString())).thenAnswer(inv -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new InferenceException("interrupted");
            }
            return "confidence: 10";
        });

        try {
            CompletableFuture<AnalyzerResult> result = new AiDetectionAdapter(provider, pool).analyze(request);
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            // when
            result.cancel(true);

            // then
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(result).isCancelled();
        } finally {
            pool.shutdown();
        }
    }
}
