package uk.gegc.flashcards.features.flashcard.domain.repository.projection;

import java.util.UUID;

public interface GenerationRequestFlashcardCount {
    UUID getGenerationRequestId();

    long getFlashcardCount();
}
