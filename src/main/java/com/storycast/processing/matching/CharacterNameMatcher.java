package com.storycast.processing.matching;

import java.util.Locale;
import java.util.Set;

/**
 * Decides whether two character names denote the same character.
 * Implementations are stateless and safe to share between sessions.
 */
public interface CharacterNameMatcher {

    /**
     * Normalized form of a name, used as the merge key.
     *
     * @param name raw name, may be null
     * @return canonical form, empty for null or blank input
     */
    String canonicalize(String name);

    /**
     * @return true if both names refer to the same character; an empty canonical form matches nothing
     */
    boolean matches(String first, String second);

    /**
     * Checks a name against a character already known under {@code canonicalReference}.
     *
     * @param name               the name to check
     * @param canonicalReference canonical name of the known character
     * @param knownVariants      canonical forms the character has been seen under
     */
    default boolean isVariant(String name, String canonicalReference, Set<String> knownVariants) {
        String canonical = canonicalize(name);
        if (canonical.isEmpty()) {
            return false;
        }
        if (knownVariants != null) {
            for (String variant : knownVariants) {
                if (variant != null && variant.toLowerCase(Locale.ROOT).equals(canonical)) {
                    return true;
                }
            }
        }
        return matches(name, canonicalReference);
    }
}
