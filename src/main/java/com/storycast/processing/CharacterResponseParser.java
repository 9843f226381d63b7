package com.storycast.processing;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.VoiceProfile;
import com.storycast.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the model's character JSON: {@code {"Name":{"D":[...],"T":[...],"V":"gender,age,accent"}}}.
 *
 * <p>Model output is read leniently. Markdown fences and any text before the first brace are ignored.
 * Reading stops at the first repeated character key. If the output is cut off, every character completed before the cut is kept.</p>
 */
@Component
public class CharacterResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(CharacterResponseParser.class);

    private final ObjectMapper objectMapper;

    @Autowired
    public CharacterResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CharacterResponseParser() {
        this(new ObjectMapper());
    }

    /**
     * @param responseText raw model output
     * @return characters in response order
     * @throws IOException if the output holds no JSON object, or breaks before the first character
     */
    public List<ExtractedCharacterData> parse(String responseText) throws IOException {
        String json = stripFences(responseText);
        int start = json.indexOf('{');
        if (start < 0) {
            throw new IOException("No JSON object in model response: " + Strings.abbreviate(json, 200));
        }

        List<ExtractedCharacterData> characters = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        try (JsonParser parser = objectMapper.getFactory().createParser(json.substring(start))) {
            parser.nextToken();
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String key = parser.getCurrentName();
                if (!seenKeys.add(key)) {
                    logger.warn("Model repeated character '{}', ignoring the rest of the response", key);
                    break;
                }
                JsonToken valueToken = parser.nextToken();
                if (valueToken != JsonToken.START_OBJECT) {
                    logger.debug("Skipping '{}': expected an object, got {}", key, valueToken);
                    parser.skipChildren();
                    continue;
                }
                JsonNode entry = parser.readValueAsTree();
                ExtractedCharacterData character = toCharacter(key, entry);
                if (character != null) {
                    characters.add(character);
                }
            }
        } catch (JsonProcessingException e) {
            if (characters.isEmpty()) {
                throw new IOException("Failed to parse model response: " + e.getOriginalMessage(), e);
            }
            logger.warn("Model response is truncated or malformed, keeping {} complete characters: {}",
                    characters.size(), e.getOriginalMessage());
        }

        logger.debug("Parsed {} characters from model response", characters.size());
        return characters;
    }

    private ExtractedCharacterData toCharacter(String key, JsonNode entry) {
        String name = key.trim();
        if (name.isEmpty()) {
            logger.debug("Skipping character with blank name");
            return null;
        }
        List<String> dialogs = textList(firstPresent(entry, "D", "d", "dialogs"));
        List<String> traits = textList(firstPresent(entry, "T", "t", "traits"));
        return new ExtractedCharacterData(name, dialogs, traits, parseVoice(entry));
    }

    // "V"/"v" as "gender,age,accent[,pitch,speed]", or a "voice" object with named fields.
    private VoiceProfile parseVoice(JsonNode entry) {
        JsonNode compact = firstPresent(entry, "V", "v");
        if (compact != null && compact.isTextual() && compact.asText().contains(",")) {
            String[] parts = compact.asText().split(",");
            if (parts.length >= 3) {
                return new VoiceProfile(
                        Strings.safe(parts[0].trim(), VoiceProfile.DEFAULT_GENDER),
                        Strings.safe(parts[1].trim(), VoiceProfile.DEFAULT_AGE),
                        Strings.safe(parts[2].trim(), VoiceProfile.DEFAULT_ACCENT),
                        parseFloat(parts, 3, VoiceProfile.DEFAULT_PITCH),
                        parseFloat(parts, 4, VoiceProfile.DEFAULT_SPEED),
                        VoiceProfile.DEFAULT_ENERGY);
            }
        }

        JsonNode voice = entry.get("voice");
        if (voice != null && voice.isObject()) {
            return new VoiceProfile(
                    voice.path("gender").asText(VoiceProfile.DEFAULT_GENDER),
                    voice.path("age").asText(VoiceProfile.DEFAULT_AGE),
                    voice.path("accent").asText(VoiceProfile.DEFAULT_ACCENT),
                    (float) voice.path("pitch").asDouble(VoiceProfile.DEFAULT_PITCH),
                    (float) voice.path("speed").asDouble(VoiceProfile.DEFAULT_SPEED),
                    (float) voice.path("energy").asDouble(VoiceProfile.DEFAULT_ENERGY));
        }
        return null;
    }

    private static float parseFloat(String[] parts, int index, float defaultValue) {
        if (parts.length <= index) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(parts[index].trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static JsonNode firstPresent(JsonNode entry, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = entry.get(fieldName);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        } else if (node.isValueNode() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private static String stripFences(String responseText) {
        if (responseText == null) {
            return "";
        }
        String cleaned = responseText.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
