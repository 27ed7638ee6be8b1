package uk.gegc.flashcards.features.generation.application;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * One question/answer pair proposed by the AI draft source, before it becomes a flashcard.
 */
public record FlashcardDraft(
        @JsonPropertyDescription("Question or front side of the flashcard")
        String front,
        @JsonPropertyDescription("Answer or back side of the flashcard")
        String back
) {
}
