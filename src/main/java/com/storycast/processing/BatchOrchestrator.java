package com.storycast.processing;

import com.storycast.observability.AnalysisMetricsServiceInterface;
import com.storycast.processing.model.AnalysisCheckpoint;
import com.storycast.processing.model.AnalysisRequest;
import com.storycast.processing.model.AnalysisResult;
import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.MergedCharacterData;
import com.storycast.processing.model.ParagraphBatch;
import com.storycast.processing.model.ParagraphLayout;
import com.storycast.processing.model.ParagraphLayout.PageRange;
import com.storycast.processing.model.PassTokenBudget;
import com.storycast.processing.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one document analysis session: normalize, batch, then extract and merge batch by batch.
 *
 * <p>An instance owns the accumulator of exactly one session and can be run once. Batches are
 * processed strictly in order; batch {@code i} is merged before the engine sees batch {@code i + 1}.
 * A failed batch is recorded and skipped. {@link #cancel()} takes effect before the next batch
 * starts, never during an engine call.</p>
 */
public class BatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);
    static final String MDC_SESSION_ID = "sessionId";

    private final TextNormalizer textNormalizer;
    private final ParagraphBatcher paragraphBatcher;
    private final IncrementalMerger incrementalMerger;
    private final ExtractionEngine extractionEngine;
    private final PassTokenBudget budget;
    private final AnalysisMetricsServiceInterface metricsService;
    private final AnalysisProgressListener listener;
    private final Duration checkpointMaxAge;
    private final Clock clock;

    private final Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile SessionState state = SessionState.IDLE;

    public BatchOrchestrator(TextNormalizer textNormalizer,
                             ParagraphBatcher paragraphBatcher,
                             IncrementalMerger incrementalMerger,
                             ExtractionEngine extractionEngine,
                             PassTokenBudget budget,
                             AnalysisMetricsServiceInterface metricsService,
                             AnalysisProgressListener listener,
                             Duration checkpointMaxAge,
                             Clock clock) {
        this.textNormalizer = textNormalizer;
        this.paragraphBatcher = paragraphBatcher;
        this.incrementalMerger = incrementalMerger;
        this.extractionEngine = extractionEngine;
        this.budget = budget;
        this.metricsService = metricsService;
        this.listener = listener != null ? listener : AnalysisProgressListener.NOOP;
        this.checkpointMaxAge = checkpointMaxAge;
        this.clock = clock;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Requests cancellation. The batch in flight finishes and is merged; no further batch starts.
     */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            logger.info("Cancellation requested (state={})", state);
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Runs the session to a terminal state.
     *
     * @throws IllegalStateException if this orchestrator has already been run
     */
    public AnalysisResult run(AnalysisRequest request) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Analysis session has already been started (state=" + state + ")");
        }
        MDC.put(MDC_SESSION_ID, request.getSessionId());
        try {
            return execute(request);
        } finally {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    private AnalysisResult execute(AnalysisRequest request) {
        long startTime = clock.millis();
        state = SessionState.RUNNING;

        List<String> pages = request.getPagesToProcess();
        logger.info("Starting analysis: {} of {} pages, budget={}",
                pages.size(), request.getPages().size(), budget);

        ParagraphLayout layout = textNormalizer.splitWithPageMapping(pages);
        List<String> paragraphs = layout.getParagraphs();
        int[] pageBoundaries = layout.getPageBoundaries();

        if (layout.isEmpty()) {
            if (pages.stream().anyMatch(page -> page != null && !page.isBlank())) {
                String reason = "Normalization produced no paragraphs from non-empty input";
                logger.error("{} ({} pages)", reason, pages.size());
                notifyListener(() -> listener.onSessionComplete(List.of(), 0), -1);
                return finish(request, SessionState.FAILED, startTime, List.of(), List.of(), 0, 0, 0, 0, false, reason);
            }
            logger.info("Nothing to analyse: input is empty");
            notifyListener(() -> listener.onSessionComplete(List.of(), 0), -1);
            return finish(request, SessionState.COMPLETED, startTime, List.of(), List.of(), 0, 0, 0, 0, false, null);
        }

        String contentHash = AnalysisCheckpoint.computeContentHash(paragraphs);
        int startIndex = 0;
        int batchOffset = 0;
        boolean resumed = false;
        int pagesProcessed = 0;

        AnalysisCheckpoint checkpoint = request.getResumeFrom();
        if (checkpoint != null) {
            if (canResume(checkpoint, contentHash)) {
                for (MergedCharacterData character : checkpoint.getAccumulatedCharacters()) {
                    accumulator.put(character.getCanonicalName(), character.copy());
                }
                startIndex = checkpoint.getResumeIndex();
                batchOffset = checkpoint.getBatchesCompleted();
                pagesProcessed = checkpoint.getPagesProcessed();
                resumed = true;
                logger.info("Resuming from paragraph {}/{} with {} characters ({}% done)",
                        startIndex, paragraphs.size(), accumulator.size(), checkpoint.getProgressPercent());
            }
        }

        List<ParagraphBatch> batches = paragraphBatcher.createBatchesFromIndex(
                paragraphs, budget.getInputTokens(), startIndex);
        int totalBatches = batchOffset + batches.size();
        logger.info("{} paragraphs in {} batches ({} to run)", paragraphs.size(), totalBatches, batches.size());

        List<Integer> failedBatches = new ArrayList<>();
        int attempted = 0;
        SessionState finalState = SessionState.COMPLETED;

        for (ParagraphBatch batch : batches) {
            if (cancelRequested.get()) {
                logger.info("Cancelled before batch {}/{}", batchOffset + batch.getBatchIndex() + 1, totalBatches);
                finalState = SessionState.CANCELLED;
                break;
            }
            int batchIndex = batchOffset + batch.getBatchIndex();
            attempted++;

            List<ExtractedCharacterData> extracted;
            try {
                extracted = extractionEngine.analyze(batch.getText(), batchIndex, totalBatches, budget);
                incrementalMerger.merge(accumulator, extracted);
            } catch (ExtractionEngineException e) {
                recordBatchFailure(batchIndex, totalBatches, failedBatches, e, "engine");
                continue;
            } catch (RuntimeException e) {
                recordBatchFailure(batchIndex, totalBatches, failedBatches, e, e.getClass().getSimpleName());
                continue;
            }

            metricsService.recordBatchSuccess(extracted.size());
            PageRange pageRange = textNormalizer.findPagesForParagraphRange(
                    batch.getStartParagraphIndex(), batch.getEndParagraphIndex(), pageBoundaries);
            pagesProcessed = Math.max(pagesProcessed, pageRange.getLastPage() + 1);
            logger.info("Batch {}/{} merged: paragraphs {}-{}, pages {}, {} characters so far",
                    batchIndex + 1, totalBatches, batch.getStartParagraphIndex(), batch.getEndParagraphIndex(),
                    pageRange, accumulator.size());

            List<MergedCharacterData> snapshot = snapshot();
            notifyListener(() -> listener.onBatchComplete(batchIndex, totalBatches, snapshot), batchIndex);

            AnalysisCheckpoint next = new AnalysisCheckpoint(request.getSessionId(), contentHash,
                    batch.getEndParagraphIndex(), paragraphs.size(), batchIndex + 1, totalBatches,
                    pageRange.getFirstPage(), pageRange.getLastPage(), pagesProcessed, clock.millis(), snapshot);
            notifyListener(() -> listener.onCheckpoint(next), batchIndex);
        }

        if (finalState == SessionState.COMPLETED) {
            pagesProcessed = pages.size();
        }
        List<MergedCharacterData> characters = snapshot();
        notifyListener(() -> listener.onSessionComplete(characters, failedBatches.size()), -1);

        logger.info("Analysis {}: {} characters, {}/{} batches attempted, {} failed",
                finalState.name().toLowerCase(), characters.size(), attempted, batches.size(), failedBatches.size());
        return finish(request, finalState, startTime, characters, failedBatches, totalBatches, attempted,
                paragraphs.size(), pagesProcessed, resumed, null);
    }

    private boolean canResume(AnalysisCheckpoint checkpoint, String contentHash) {
        if (!contentHash.equals(checkpoint.getContentHash())) {
            logger.warn("Ignoring checkpoint: content changed (checkpoint={}, current={})",
                    checkpoint.getContentHash(), contentHash);
            return false;
        }
        if (checkpoint.isComplete()) {
            logger.info("Ignoring checkpoint: previous run already covered every paragraph");
            return false;
        }
        long ageMillis = clock.millis() - checkpoint.getTimestamp();
        if (ageMillis > checkpointMaxAge.toMillis()) {
            logger.info("Ignoring checkpoint: {} minutes old, limit is {}",
                    Duration.ofMillis(ageMillis).toMinutes(), checkpointMaxAge.toMinutes());
            return false;
        }
        return true;
    }

    private void recordBatchFailure(int batchIndex, int totalBatches, List<Integer> failedBatches,
                                    Exception cause, String errorType) {
        logger.error("Batch {}/{} failed, skipping: {}", batchIndex + 1, totalBatches, cause.getMessage(), cause);
        failedBatches.add(batchIndex);
        metricsService.recordBatchFailure(errorType);
        notifyListener(() -> listener.onBatchFailed(batchIndex, totalBatches, cause), batchIndex);
    }

    // Listener errors are logged and do not affect the session.
    private void notifyListener(Runnable callback, int batchIndex) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("Progress listener failed (batch {}): {}", batchIndex, e.getMessage(), e);
        }
    }

    private List<MergedCharacterData> snapshot() {
        List<MergedCharacterData> copies = new ArrayList<>();
        for (MergedCharacterData character : incrementalMerger.toList(accumulator)) {
            copies.add(character.copy());
        }
        return copies;
    }

    private AnalysisResult finish(AnalysisRequest request, SessionState finalState, long startTime,
                                  List<MergedCharacterData> characters, List<Integer> failedBatches,
                                  int totalBatches, int attempted, int paragraphCount, int pagesProcessed,
                                  boolean resumed, String failureReason) {
        state = finalState;
        long durationMs = clock.millis() - startTime;
        metricsService.recordSessionDuration(durationMs, finalState);
        boolean partial = request.isPartial() || finalState == SessionState.CANCELLED;
        return new AnalysisResult(request.getSessionId(), finalState, characters, failedBatches, totalBatches,
                attempted, paragraphCount, pagesProcessed, request.getPages().size(), partial, resumed,
                durationMs, failureReason);
    }
}
