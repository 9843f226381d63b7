package com.storycast.processing.matching;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical fuzzy matching: equal canonical forms, containment ("Harry" in "Harry Potter"),
 * or a shared word of at least {@value #MIN_WORD_LENGTH} characters.
 *
 * <p>Short words are ignored for the overlap check so titles and initials ("Mr", "Dr", "A")
 * do not merge unrelated characters.</p>
 */
public class FuzzyCharacterNameMatcher implements CharacterNameMatcher {

    static final int MIN_WORD_LENGTH = 3;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String canonicalize(String name) {
        if (name == null) {
            return "";
        }
        String stripped = PUNCTUATION.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
        return WHITESPACE.matcher(stripped.trim()).replaceAll(" ");
    }

    @Override
    public boolean matches(String first, String second) {
        String a = canonicalize(first);
        String b = canonicalize(second);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b) || a.contains(b) || b.contains(a)) {
            return true;
        }
        Set<String> wordsA = significantWords(a);
        for (String word : significantWords(b)) {
            if (wordsA.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> significantWords(String canonical) {
        Set<String> words = new HashSet<>();
        for (String word : canonical.split(" ")) {
            if (word.length() >= MIN_WORD_LENGTH) {
                words.add(word);
            }
        }
        return words;
    }

    @Override
    public String toString() {
        return "fuzzy";
    }
}
