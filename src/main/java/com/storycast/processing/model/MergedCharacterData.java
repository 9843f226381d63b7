package com.storycast.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Accumulated state for one character across every batch of a document.
 *
 * <p>Instances live in the accumulator map of a single analysis session, keyed by
 * {@link #getCanonicalName()}. Dialogs are append-only and keep observation order; traits are a
 * case-insensitive set that keeps the casing seen first; known variants hold the canonical forms
 * of every name the character has been reported under.</p>
 */
public class MergedCharacterData {
    private final String name;
    private final String canonicalName;
    private final List<String> dialogs;
    private final Set<String> traits;
    private final Set<String> traitKeys;
    private final Set<String> knownVariants;
    private VoiceProfile voiceProfile;

    public MergedCharacterData(String name, String canonicalName) {
        this.name = name;
        this.canonicalName = canonicalName;
        this.dialogs = new ArrayList<>();
        this.traits = new LinkedHashSet<>();
        this.traitKeys = new LinkedHashSet<>();
        this.knownVariants = new LinkedHashSet<>();
        this.knownVariants.add(canonicalName);
    }

    @JsonCreator
    public MergedCharacterData(@JsonProperty("name") String name,
                               @JsonProperty("canonicalName") String canonicalName,
                               @JsonProperty("dialogs") List<String> dialogs,
                               @JsonProperty("traits") Collection<String> traits,
                               @JsonProperty("voiceProfile") VoiceProfile voiceProfile,
                               @JsonProperty("knownVariants") Collection<String> knownVariants) {
        this(name, canonicalName);
        addDialogs(dialogs);
        addTraits(traits);
        this.voiceProfile = voiceProfile;
        if (knownVariants != null) {
            knownVariants.forEach(this::addVariant);
        }
    }

    public String getName() {
        return name;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public List<String> getDialogs() {
        return Collections.unmodifiableList(dialogs);
    }

    public Set<String> getTraits() {
        return Collections.unmodifiableSet(traits);
    }

    public VoiceProfile getVoiceProfile() {
        return voiceProfile;
    }

    public void setVoiceProfile(VoiceProfile voiceProfile) {
        this.voiceProfile = voiceProfile;
    }

    public Set<String> getKnownVariants() {
        return Collections.unmodifiableSet(knownVariants);
    }

    public void addDialogs(List<String> newDialogs) {
        if (newDialogs != null) {
            dialogs.addAll(newDialogs);
        }
    }

    /**
     * Adds a trait unless an equal one (ignoring case) is already present.
     *
     * @return true if the trait was added
     */
    public boolean addTrait(String trait) {
        if (trait == null || trait.isBlank()) {
            return false;
        }
        String display = trait.trim();
        if (!traitKeys.add(display.toLowerCase(Locale.ROOT))) {
            return false;
        }
        traits.add(display);
        return true;
    }

    public void addTraits(Collection<String> newTraits) {
        if (newTraits != null) {
            newTraits.forEach(this::addTrait);
        }
    }

    public boolean addVariant(String canonicalVariant) {
        if (canonicalVariant == null || canonicalVariant.isBlank()) {
            return false;
        }
        return knownVariants.add(canonicalVariant.toLowerCase(Locale.ROOT));
    }

    @JsonIgnore
    public int getDialogCount() {
        return dialogs.size();
    }

    /**
     * Deep copy, used for snapshots handed to callbacks and checkpoints.
     */
    public MergedCharacterData copy() {
        return new MergedCharacterData(name, canonicalName, dialogs, traits, voiceProfile, knownVariants);
    }

    @Override
    public String toString() {
        return "MergedCharacterData{name=" + name + ", canonical=" + canonicalName
                + ", dialogs=" + dialogs.size() + ", traits=" + traits + ", variants=" + knownVariants + "}";
    }
}
