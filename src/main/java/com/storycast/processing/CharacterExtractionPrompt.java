package com.storycast.processing;

/**
 * Builds the single-call extraction prompt for a batch: speaking characters with their dialogs (D),
 * traits (T) and a voice triple (V), as one flat JSON object keyed by character name.
 */
public final class CharacterExtractionPrompt {

    static final String TEXT_MARKER = "TEXT:\n";
    static final String JSON_MARKER = "\n\nJSON:";

    private static final String INSTRUCTIONS =
            "You are a JSON extraction engine. Extract ONLY characters who SPEAK dialog. "
            + "Ignore locations, objects, creatures and non-speaking entities.\n\n"
            + "Extract character names, their Dialogs (D), their Traits (T) and their inferred "
            + "Voice profile (V) from the story text below.\n"
            + "RULES:\n"
            + "1. ONLY include characters who have quoted dialogs\n"
            + "2. DO NOT include locations, objects, creatures or entities that don't speak\n"
            + "3. Each character must appear EXACTLY ONCE in the output\n"
            + "4. Read the ENTIRE text before answering\n\n"
            + "FORMAT: {\"<Character-Name>\":{\"D\":[\"dialog1\",\"dialog2\"],\"T\":[\"trait1\",\"trait2\"],"
            + "\"V\":\"Gender,Age,Accent\"}}\n\n"
            + "KEYS:\n"
            + "- D = every quoted dialog spoken by the character, verbatim\n"
            + "- T = physical traits and personality\n"
            + "- V = gender,age,accent. Options: male|female, child|young|middle-aged|elderly, "
            + "neutral|British|American|...\n\n";

    private CharacterExtractionPrompt() {
    }

    /**
     * @param batchText    input text, already trimmed to the input budget
     * @param batchIndex   0-based batch index
     * @param totalBatches number of batches in the session
     */
    public static String build(String batchText, int batchIndex, int totalBatches) {
        StringBuilder prompt = new StringBuilder(INSTRUCTIONS.length() + batchText.length() + 64);
        prompt.append(INSTRUCTIONS);
        prompt.append("PART ").append(batchIndex + 1).append(" OF ").append(totalBatches).append("\n\n");
        prompt.append(TEXT_MARKER).append(batchText).append(JSON_MARKER);
        return prompt.toString();
    }

    /**
     * Recovers the story text from a prompt built by {@link #build(String, int, int)}.
     *
     * @return the text section, or the whole prompt when the markers are missing
     */
    public static String extractText(String prompt) {
        int start = prompt.indexOf(TEXT_MARKER);
        int end = prompt.lastIndexOf(JSON_MARKER);
        if (start < 0 || end < start) {
            return prompt;
        }
        return prompt.substring(start + TEXT_MARKER.length(), end);
    }
}
