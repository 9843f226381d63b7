package com.storycast.observability;

import com.storycast.processing.model.SessionState;
import com.storycast.util.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for character analysis.
 * Only active when metrics.enabled=true.
 *
 * Metrics:
 * - storycast.llm.latency_ms: Timer for model call latency
 * - storycast.llm.tokens: Counter for estimated tokens, tagged by direction
 * - storycast.batch.success: Counter for merged batches
 * - storycast.batch.failure: Counter for skipped batches, tagged by error type
 * - storycast.batch.characters: Distribution of characters reported per merged batch
 * - storycast.session.duration: Timer for whole sessions, tagged by final state
 */
@Service
@ConditionalOnProperty(name = "metrics.enabled", havingValue = "true", matchIfMissing = false)
public class AnalysisMetricsService implements AnalysisMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisMetricsService.class);
    private static final String SERVICE_TAG = "storycast";

    private final MeterRegistry meterRegistry;

    public AnalysisMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        logger.info("Analysis metrics enabled with registry {}", meterRegistry.getClass().getSimpleName());
    }

    @Override
    public void recordLlmLatency(long durationMs, String model, String taskType) {
        Timer.builder("storycast.llm.latency_ms")
                .description("Model call latency in milliseconds")
                .tag("service", SERVICE_TAG)
                .tag("model", Strings.safe(model))
                .tag("task_type", Strings.safe(taskType))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordLlmTokens(int inputTokens, int outputTokens, String model, String taskType) {
        tokenCounter("input", model, taskType).increment(inputTokens);
        tokenCounter("output", model, taskType).increment(outputTokens);
    }

    @Override
    public void recordBatchSuccess(int characterCount) {
        Counter.builder("storycast.batch.success")
                .description("Number of batches merged into the accumulator")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry)
                .increment();
        DistributionSummary.builder("storycast.batch.characters")
                .description("Characters reported per merged batch")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry)
                .record(characterCount);
    }

    @Override
    public void recordBatchFailure(String errorType) {
        Counter.builder("storycast.batch.failure")
                .description("Number of batches skipped after an extraction failure")
                .tag("service", SERVICE_TAG)
                .tag("error_type", Strings.safe(errorType))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordSessionDuration(long durationMs, SessionState state) {
        Timer.builder("storycast.session.duration")
                .description("Analysis session duration in milliseconds")
                .tag("service", SERVICE_TAG)
                .tag("state", state != null ? state.name().toLowerCase() : "unknown")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private Counter tokenCounter(String direction, String model, String taskType) {
        return Counter.builder("storycast.llm.tokens")
                .description("Estimated tokens sent to and received from the model")
                .tag("service", SERVICE_TAG)
                .tag("direction", direction)
                .tag("model", Strings.safe(model))
                .tag("task_type", Strings.safe(taskType))
                .register(meterRegistry);
    }
}
