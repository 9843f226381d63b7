package com.storycast.observability;

import com.storycast.processing.model.SessionState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * No-op metrics when metrics.enabled is false.
 */
@Service
@ConditionalOnProperty(name = "metrics.enabled", havingValue = "false", matchIfMissing = true)
public class AnalysisMetricsServiceStub implements AnalysisMetricsServiceInterface {

    @Override
    public void recordLlmLatency(long durationMs, String model, String taskType) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordLlmTokens(int inputTokens, int outputTokens, String model, String taskType) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordBatchSuccess(int characterCount) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordBatchFailure(String errorType) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordSessionDuration(long durationMs, SessionState state) {
        // No-op when metrics are disabled
    }
}
