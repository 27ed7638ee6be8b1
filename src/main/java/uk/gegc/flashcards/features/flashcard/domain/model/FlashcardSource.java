package uk.gegc.flashcards.features.flashcard.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum FlashcardSource {
    MANUAL("manual"),
    AI_GENERATED("ai_generated");

    private final String value;

    FlashcardSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FlashcardSource fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        String normalized = normalize(rawValue);
        return Arrays.stream(values())
                .filter(candidate -> candidate.value.equals(normalized) || normalize(candidate.name()).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown flashcard source: " + rawValue));
    }

    private static String normalize(String input) {
        return input.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
    }
}
