package com.storycast.processing.matching;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matches names only when their canonical forms are equal.
 * For text where names are already normalized and a false merge is worse than a duplicate.
 */
public class StrictCharacterNameMatcher implements CharacterNameMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String canonicalize(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    @Override
    public boolean matches(String first, String second) {
        String canonicalFirst = canonicalize(first);
        return !canonicalFirst.isEmpty() && canonicalFirst.equals(canonicalize(second));
    }

    @Override
    public String toString() {
        return "strict";
    }
}
