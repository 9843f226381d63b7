package com.storycast.processing;

import com.storycast.processing.matching.CharacterNameMatcher;
import com.storycast.processing.merging.VoiceProfileMerger;
import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.MergedCharacterData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the characters extracted from one batch into a session's accumulator.
 *
 * <p>The accumulator is owned by the caller and keyed by canonical name; this class keeps no state
 * of its own beyond the injected strategies, so one instance can serve any number of sessions.</p>
 *
 * <p>Within a batch, entities are processed in order. When two of them resolve to the same existing
 * character the first one claims it and the second is folded into the same entry.</p>
 */
public class IncrementalMerger {

    private static final Logger logger = LoggerFactory.getLogger(IncrementalMerger.class);

    private static final Comparator<MergedCharacterData> BY_IMPORTANCE =
            Comparator.comparingInt(MergedCharacterData::getDialogCount).reversed()
                    .thenComparing(MergedCharacterData::getCanonicalName);

    private final CharacterNameMatcher nameMatcher;
    private final VoiceProfileMerger voiceProfileMerger;

    public IncrementalMerger(CharacterNameMatcher nameMatcher, VoiceProfileMerger voiceProfileMerger) {
        this.nameMatcher = nameMatcher;
        this.voiceProfileMerger = voiceProfileMerger;
    }

    public CharacterNameMatcher getNameMatcher() {
        return nameMatcher;
    }

    public VoiceProfileMerger getVoiceProfileMerger() {
        return voiceProfileMerger;
    }

    /**
     * Merges one batch into the accumulator.
     *
     * <p>Changes are staged on copies of the affected entries and written back only once the whole
     * batch has been merged, so an exception part-way leaves the accumulator untouched.</p>
     *
     * @param accumulator canonical name to character, mutated in place
     * @param batchOutput characters reported for the batch, in model order
     * @return the same accumulator instance
     */
    public Map<String, MergedCharacterData> merge(Map<String, MergedCharacterData> accumulator,
                                                  List<ExtractedCharacterData> batchOutput) {
        if (batchOutput == null || batchOutput.isEmpty()) {
            return accumulator;
        }

        Map<String, MergedCharacterData> staged = new LinkedHashMap<>();
        for (ExtractedCharacterData extracted : batchOutput) {
            String canonicalName = nameMatcher.canonicalize(extracted.getName());
            if (canonicalName.isEmpty()) {
                logger.warn("Skipping character with empty name ({} dialogs)", extracted.getDialogs().size());
                continue;
            }

            MergedCharacterData target = findExisting(accumulator, staged, extracted.getName(), canonicalName);
            if (target != null) {
                target.addDialogs(extracted.getDialogs());
                target.addTraits(extracted.getTraits());
                target.setVoiceProfile(voiceProfileMerger.merge(target.getVoiceProfile(), extracted.getVoiceProfile()));
                target.addVariant(canonicalName);
                logger.debug("Merged '{}' into '{}'", extracted.getName(), target.getName());
            } else {
                MergedCharacterData created = new MergedCharacterData(extracted.getName().trim(), canonicalName);
                created.addDialogs(extracted.getDialogs());
                created.addTraits(extracted.getTraits());
                created.setVoiceProfile(extracted.getVoiceProfile());
                staged.put(canonicalName, created);
                logger.debug("Added new character '{}' (canonical: {})", extracted.getName(), canonicalName);
            }
        }

        accumulator.putAll(staged);
        return accumulator;
    }

    /**
     * All accumulated characters, most dialog lines first, ties broken by canonical name.
     */
    public List<MergedCharacterData> toList(Map<String, MergedCharacterData> accumulator) {
        List<MergedCharacterData> characters = new ArrayList<>(accumulator.values());
        characters.sort(BY_IMPORTANCE);
        return characters;
    }

    // Exact key first, then known variants and fuzzy matching in accumulator order.
    // A hit in the accumulator is copied into the staging map before it is returned.
    private MergedCharacterData findExisting(Map<String, MergedCharacterData> accumulator,
                                             Map<String, MergedCharacterData> staged,
                                             String name, String canonicalName) {
        MergedCharacterData exact = staged.get(canonicalName);
        if (exact != null) {
            return exact;
        }
        if (accumulator.containsKey(canonicalName)) {
            return stage(accumulator.get(canonicalName), staged);
        }

        for (MergedCharacterData candidate : accumulator.values()) {
            if (nameMatcher.isVariant(name, candidate.getCanonicalName(), candidate.getKnownVariants())) {
                return stage(candidate, staged);
            }
        }
        for (MergedCharacterData candidate : staged.values()) {
            if (nameMatcher.isVariant(name, candidate.getCanonicalName(), candidate.getKnownVariants())) {
                return candidate;
            }
        }
        return null;
    }

    private static MergedCharacterData stage(MergedCharacterData original, Map<String, MergedCharacterData> staged) {
        return staged.computeIfAbsent(original.getCanonicalName(), key -> original.copy());
    }
}
