package com.storycast.processing;

import com.storycast.processing.model.AnalysisCheckpoint;
import com.storycast.processing.model.MergedCharacterData;

import java.util.List;

/**
 * Receives progress from a running analysis session. Character lists are snapshots: later batches
 * do not change them.
 */
public interface AnalysisProgressListener {

    AnalysisProgressListener NOOP = new AnalysisProgressListener() {
        @Override
        public void onBatchComplete(int batchIndex, int totalBatches, List<MergedCharacterData> characters) {
        }

        @Override
        public void onSessionComplete(List<MergedCharacterData> characters, int failedBatchCount) {
        }
    };

    /**
     * Called once per batch that was merged, in batch order.
     */
    void onBatchComplete(int batchIndex, int totalBatches, List<MergedCharacterData> characters);

    /**
     * Called once when the session ends for any reason, with everything merged so far.
     * A session that fails before its first batch reports an empty list.
     */
    void onSessionComplete(List<MergedCharacterData> characters, int failedBatchCount);

    default void onBatchFailed(int batchIndex, int totalBatches, Exception cause) {
    }

    /**
     * Called after each merged batch with a checkpoint the host may store to resume later.
     */
    default void onCheckpoint(AnalysisCheckpoint checkpoint) {
    }
}
