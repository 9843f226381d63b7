package com.storycast.processing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of an analysis session. Always carries whatever characters were merged,
 * including for cancelled sessions and sessions where some batches failed.
 */
public class AnalysisResult {
    private final String sessionId;
    private final SessionState state;
    private final List<MergedCharacterData> characters;
    private final List<Integer> failedBatchIndices;
    private final int totalBatches;
    private final int batchesAttempted;
    private final int paragraphCount;
    private final int pagesProcessed;
    private final int totalPages;
    private final boolean partial;
    private final boolean resumed;
    private final long durationMs;
    private final String failureReason;

    public AnalysisResult(String sessionId, SessionState state, List<MergedCharacterData> characters,
                          List<Integer> failedBatchIndices, int totalBatches, int batchesAttempted,
                          int paragraphCount, int pagesProcessed, int totalPages, boolean partial,
                          boolean resumed, long durationMs, String failureReason) {
        this.sessionId = sessionId;
        this.state = state;
        this.characters = Collections.unmodifiableList(new ArrayList<>(characters));
        this.failedBatchIndices = Collections.unmodifiableList(new ArrayList<>(failedBatchIndices));
        this.totalBatches = totalBatches;
        this.batchesAttempted = batchesAttempted;
        this.paragraphCount = paragraphCount;
        this.pagesProcessed = pagesProcessed;
        this.totalPages = totalPages;
        this.partial = partial;
        this.resumed = resumed;
        this.durationMs = durationMs;
        this.failureReason = failureReason;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Characters sorted by dialog count, most lines first.
     */
    public List<MergedCharacterData> getCharacters() {
        return characters;
    }

    public List<Integer> getFailedBatchIndices() {
        return failedBatchIndices;
    }

    public int getFailedBatchCount() {
        return failedBatchIndices.size();
    }

    public int getTotalBatches() {
        return totalBatches;
    }

    public int getBatchesAttempted() {
        return batchesAttempted;
    }

    public int getParagraphCount() {
        return paragraphCount;
    }

    public int getPagesProcessed() {
        return pagesProcessed;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public boolean isPartial() {
        return partial;
    }

    public boolean isResumed() {
        return resumed;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /**
     * @return why the session ended in {@link SessionState#FAILED}, otherwise null
     */
    public String getFailureReason() {
        return failureReason;
    }

    public int getCharacterCount() {
        return characters.size();
    }

    public int getDialogCount() {
        return characters.stream().mapToInt(MergedCharacterData::getDialogCount).sum();
    }

    public boolean isFullSuccess() {
        return state == SessionState.COMPLETED && failedBatchIndices.isEmpty();
    }
}
