package com.storycast.observability;

import com.storycast.processing.model.SessionState;

/**
 * Metrics for model calls and analysis sessions, with a recording and a no-op implementation.
 */
public interface AnalysisMetricsServiceInterface {
    void recordLlmLatency(long durationMs, String model, String taskType);
    void recordLlmTokens(int inputTokens, int outputTokens, String model, String taskType);
    void recordBatchSuccess(int characterCount);
    void recordBatchFailure(String errorType);
    void recordSessionDuration(long durationMs, SessionState state);
}
