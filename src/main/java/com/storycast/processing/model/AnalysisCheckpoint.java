package com.storycast.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Snapshot emitted after each merged batch so an interrupted analysis can be resumed
 * from the next paragraph instead of from the start of the document.
 *
 * <p>The content hash ties the checkpoint to the exact paragraph list it was taken from;
 * a checkpoint whose hash does not match the current paragraphs must not be resumed.</p>
 */
public class AnalysisCheckpoint {
    private static final int CONTENT_HASH_LENGTH = 16;

    private final String sessionId;
    private final String contentHash;
    private final int lastProcessedParagraphIndex;
    private final int totalParagraphs;
    private final int batchesCompleted;
    private final int totalBatches;
    private final int firstPageOfBatch;
    private final int lastPageOfBatch;
    private final int pagesProcessed;
    private final long timestamp;
    private final List<MergedCharacterData> accumulatedCharacters;

    @JsonCreator
    public AnalysisCheckpoint(@JsonProperty("sessionId") String sessionId,
                              @JsonProperty("contentHash") String contentHash,
                              @JsonProperty("lastProcessedParagraphIndex") int lastProcessedParagraphIndex,
                              @JsonProperty("totalParagraphs") int totalParagraphs,
                              @JsonProperty("batchesCompleted") int batchesCompleted,
                              @JsonProperty("totalBatches") int totalBatches,
                              @JsonProperty("firstPageOfBatch") int firstPageOfBatch,
                              @JsonProperty("lastPageOfBatch") int lastPageOfBatch,
                              @JsonProperty("pagesProcessed") int pagesProcessed,
                              @JsonProperty("timestamp") long timestamp,
                              @JsonProperty("accumulatedCharacters") List<MergedCharacterData> accumulatedCharacters) {
        this.sessionId = sessionId;
        this.contentHash = contentHash;
        this.lastProcessedParagraphIndex = lastProcessedParagraphIndex;
        this.totalParagraphs = totalParagraphs;
        this.batchesCompleted = batchesCompleted;
        this.totalBatches = totalBatches;
        this.firstPageOfBatch = firstPageOfBatch;
        this.lastPageOfBatch = lastPageOfBatch;
        this.pagesProcessed = pagesProcessed;
        this.timestamp = timestamp;
        this.accumulatedCharacters = accumulatedCharacters != null
                ? Collections.unmodifiableList(new ArrayList<>(accumulatedCharacters))
                : List.of();
    }

    /**
     * Hashes the paragraph list (SHA-256, first 16 hex characters).
     */
    public static String computeContentHash(List<String> paragraphs) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("\n", paragraphs).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, CONTENT_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getContentHash() {
        return contentHash;
    }

    public int getLastProcessedParagraphIndex() {
        return lastProcessedParagraphIndex;
    }

    public int getTotalParagraphs() {
        return totalParagraphs;
    }

    public int getBatchesCompleted() {
        return batchesCompleted;
    }

    public int getTotalBatches() {
        return totalBatches;
    }

    public int getFirstPageOfBatch() {
        return firstPageOfBatch;
    }

    public int getLastPageOfBatch() {
        return lastPageOfBatch;
    }

    public int getPagesProcessed() {
        return pagesProcessed;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public List<MergedCharacterData> getAccumulatedCharacters() {
        return accumulatedCharacters;
    }

    @JsonIgnore
    public boolean isComplete() {
        return lastProcessedParagraphIndex >= totalParagraphs - 1;
    }

    @JsonIgnore
    public int getResumeIndex() {
        return lastProcessedParagraphIndex + 1;
    }

    @JsonIgnore
    public int getProgressPercent() {
        if (totalParagraphs <= 0) {
            return 100;
        }
        return Math.min(100, (lastProcessedParagraphIndex + 1) * 100 / totalParagraphs);
    }

    @Override
    public String toString() {
        return "AnalysisCheckpoint{session=" + sessionId + ", hash=" + contentHash
                + ", paragraph=" + lastProcessedParagraphIndex + "/" + totalParagraphs
                + ", batches=" + batchesCompleted + "/" + totalBatches
                + ", characters=" + accumulatedCharacters.size() + "}";
    }
}
