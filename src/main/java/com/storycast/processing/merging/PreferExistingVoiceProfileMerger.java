package com.storycast.processing.merging;

import com.storycast.processing.model.VoiceProfile;

/**
 * Keeps the first voice ever reported for a character.
 */
public class PreferExistingVoiceProfileMerger implements VoiceProfileMerger {

    @Override
    public VoiceProfile merge(VoiceProfile existing, VoiceProfile incoming) {
        return existing != null ? existing : incoming;
    }

    @Override
    public String toString() {
        return "prefer-existing";
    }
}
