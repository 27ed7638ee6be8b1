package uk.gegc.flashcards.features.flashcard.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum FlashcardStatus {
    ACTIVE("active"),
    PENDING_REVIEW("pending_review"),
    REJECTED("rejected");

    private final String value;

    FlashcardStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FlashcardStatus fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        String normalized = normalize(rawValue);
        return Arrays.stream(values())
                .filter(candidate -> candidate.value.equals(normalized) || normalize(candidate.name()).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown flashcard status: " + rawValue));
    }

    private static String normalize(String input) {
        return input.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
    }
}
