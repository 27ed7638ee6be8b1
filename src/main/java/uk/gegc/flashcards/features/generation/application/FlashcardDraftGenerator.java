package uk.gegc.flashcards.features.generation.application;

import java.util.List;

public interface FlashcardDraftGenerator {

    /**
     * Proposes flashcards for the given source text.
     *
     * @return at least one draft whose sides are non-blank and within the flashcard length limits
     * @throws uk.gegc.flashcards.shared.exception.AiServiceException when nothing usable could be produced
     */
    List<FlashcardDraft> generate(String sourceText);
}
