package uk.gegc.flashcards.features.generation.application;

import uk.gegc.flashcards.features.generation.domain.model.GenerationRequest;

public final class SourceTextPolicy {

    private SourceTextPolicy() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @return the trimmed text
     * @throws IllegalArgumentException if the trimmed text is shorter than 1000 or longer than 10000 characters
     */
    public static String normalize(String sourceText) {
        String trimmed = sourceText == null ? "" : sourceText.trim();
        if (trimmed.length() < GenerationRequest.SOURCE_TEXT_MIN_LENGTH
                || trimmed.length() > GenerationRequest.SOURCE_TEXT_MAX_LENGTH) {
            throw new IllegalArgumentException("Source text must be between "
                    + GenerationRequest.SOURCE_TEXT_MIN_LENGTH + " and "
                    + GenerationRequest.SOURCE_TEXT_MAX_LENGTH + " characters");
        }
        return trimmed;
    }
}
