package com.storycast.observability;

import com.storycast.processing.model.SessionState;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private AnalysisMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new AnalysisMetricsService(registry);
    }

    @Test
    void testBatchSuccessCountsBatchesAndCharacters() {
        metricsService.recordBatchSuccess(3);
        metricsService.recordBatchSuccess(5);

        assertThat(registry.get("storycast.batch.success").tag("service", "storycast").counter().count())
                .isEqualTo(2.0);
        DistributionSummary characters = registry.get("storycast.batch.characters").summary();
        assertThat(characters.count()).isEqualTo(2);
        assertThat(characters.totalAmount()).isEqualTo(8.0);
    }

    @Test
    void testBatchFailureIsTaggedByErrorType() {
        metricsService.recordBatchFailure("engine");
        metricsService.recordBatchFailure("engine");
        metricsService.recordBatchFailure(null);

        assertThat(registry.get("storycast.batch.failure").tag("error_type", "engine").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("storycast.batch.failure").tag("error_type", "unknown").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void testLlmTokensAreSplitByDirection() {
        metricsService.recordLlmTokens(100, 20, "gemini-2.0-flash", "character_extraction");

        assertThat(registry.get("storycast.llm.tokens").tag("direction", "input").counter().count())
                .isEqualTo(100.0);
        assertThat(registry.get("storycast.llm.tokens").tag("direction", "output")
                .tag("model", "gemini-2.0-flash").counter().count()).isEqualTo(20.0);
    }

    @Test
    void testLatencyAndSessionTimers() {
        metricsService.recordLlmLatency(250, "gemini-2.0-flash", "character_extraction");
        metricsService.recordSessionDuration(1500, SessionState.CANCELLED);

        Timer latency = registry.get("storycast.llm.latency_ms").tag("task_type", "character_extraction").timer();
        assertThat(latency.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
        Timer session = registry.get("storycast.session.duration").tag("state", "cancelled").timer();
        assertThat(session.count()).isEqualTo(1);
        assertThat(session.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1500.0);
    }
}
