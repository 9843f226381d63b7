package com.storycast.processing.merging;

import com.storycast.processing.model.VoiceProfile;

/**
 * Takes the latest voice whenever one is reported.
 */
public class PreferNewVoiceProfileMerger implements VoiceProfileMerger {

    @Override
    public VoiceProfile merge(VoiceProfile existing, VoiceProfile incoming) {
        return incoming != null ? incoming : existing;
    }

    @Override
    public String toString() {
        return "prefer-new";
    }
}
