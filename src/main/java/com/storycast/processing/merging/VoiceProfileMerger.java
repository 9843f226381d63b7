package com.storycast.processing.merging;

import com.storycast.processing.model.VoiceProfile;

/**
 * Reconciles the voice already recorded for a character with one reported by a later batch.
 */
public interface VoiceProfileMerger {

    /**
     * @param existing voice recorded so far, may be null
     * @param incoming voice from the current batch, may be null
     * @return the merged voice, or null when both are null
     */
    VoiceProfile merge(VoiceProfile existing, VoiceProfile incoming);
}
