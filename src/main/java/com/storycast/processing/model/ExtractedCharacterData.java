package com.storycast.processing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One character as reported by the model for a single batch.
 * Consumed by the merger right after the batch completes.
 */
public class ExtractedCharacterData {
    private final String name;
    private final List<String> dialogs;
    private final List<String> traits;
    private final VoiceProfile voiceProfile;

    public ExtractedCharacterData(String name, List<String> dialogs, List<String> traits,
                                  VoiceProfile voiceProfile) {
        this.name = name != null ? name : "";
        this.dialogs = dialogs != null ? Collections.unmodifiableList(new ArrayList<>(dialogs)) : List.of();
        this.traits = traits != null ? Collections.unmodifiableList(new ArrayList<>(traits)) : List.of();
        this.voiceProfile = voiceProfile;
    }

    public ExtractedCharacterData(String name, List<String> dialogs, List<String> traits) {
        this(name, dialogs, traits, null);
    }

    public String getName() {
        return name;
    }

    public List<String> getDialogs() {
        return dialogs;
    }

    public List<String> getTraits() {
        return traits;
    }

    /**
     * @return the inferred voice, or null when the model gave none
     */
    public VoiceProfile getVoiceProfile() {
        return voiceProfile;
    }

    @Override
    public String toString() {
        return "ExtractedCharacterData{name=" + name + ", dialogs=" + dialogs.size()
                + ", traits=" + traits.size() + ", voice=" + (voiceProfile != null) + "}";
    }
}
