package com.storycast.processing;

import com.storycast.observability.AnalysisMetricsServiceInterface;
import com.storycast.observability.TracingServiceInterface;
import com.storycast.processing.model.AnalysisRequest;
import com.storycast.processing.model.AnalysisResult;
import com.storycast.processing.model.PassTokenBudget;
import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Entry point for character analysis. Every call gets its own {@link BatchOrchestrator}, and with it
 * its own accumulator, so sessions for different documents never share state.
 */
@Service
public class CharacterAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(CharacterAnalysisService.class);

    private final TextNormalizer textNormalizer;
    private final ParagraphBatcher paragraphBatcher;
    private final IncrementalMerger incrementalMerger;
    private final ExtractionEngine extractionEngine;
    private final PassTokenBudget extractionBudget;
    private final AnalysisMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;
    private final Duration checkpointMaxAge;

    public CharacterAnalysisService(TextNormalizer textNormalizer,
                                    ParagraphBatcher paragraphBatcher,
                                    IncrementalMerger incrementalMerger,
                                    ExtractionEngine extractionEngine,
                                    PassTokenBudget extractionBudget,
                                    AnalysisMetricsServiceInterface metricsService,
                                    TracingServiceInterface tracingService,
                                    @Value("${storycast.checkpoint.max-age-hours:24}") long checkpointMaxAgeHours) {
        this.textNormalizer = textNormalizer;
        this.paragraphBatcher = paragraphBatcher;
        this.incrementalMerger = incrementalMerger;
        this.extractionEngine = extractionEngine;
        this.extractionBudget = extractionBudget;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.checkpointMaxAge = Duration.ofHours(checkpointMaxAgeHours);
    }

    /**
     * Creates an orchestrator for one session. Use this when the caller needs to cancel the run.
     */
    public BatchOrchestrator newSession(AnalysisProgressListener listener) {
        return new BatchOrchestrator(textNormalizer, paragraphBatcher, incrementalMerger, extractionEngine,
                extractionBudget, metricsService, listener, checkpointMaxAge, Clock.systemUTC());
    }

    public AnalysisResult analyze(AnalysisRequest request, AnalysisProgressListener listener) {
        AnalysisResult result = tracingService.trace("analysis.session", () -> {
            AnalysisResult sessionResult = newSession(listener).run(request);
            Span span = tracingService.getCurrentSpan();
            span.setAttribute("session_id", sessionResult.getSessionId());
            span.setAttribute("state", sessionResult.getState().name());
            span.setAttribute("batches", sessionResult.getTotalBatches());
            span.setAttribute("failed_batches", sessionResult.getFailedBatchCount());
            span.setAttribute("characters", sessionResult.getCharacterCount());
            return sessionResult;
        });
        logger.info("Session {} finished: state={}, characters={}, dialogs={}, failedBatches={}, {}ms",
                result.getSessionId(), result.getState(), result.getCharacterCount(), result.getDialogCount(),
                result.getFailedBatchCount(), result.getDurationMs());
        return result;
    }

    public AnalysisResult analyze(AnalysisRequest request) {
        return analyze(request, AnalysisProgressListener.NOOP);
    }

    /**
     * Batch count shown before analysis starts, without running the batcher.
     */
    public int estimateBatchCount(AnalysisRequest request) {
        return paragraphBatcher.estimateBatchCount(
                textNormalizer.splitIntoParagraphs(request.getPagesToProcess()), extractionBudget.getInputTokens());
    }
}
