package uk.gegc.flashcards.features.generation.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestSummaryDto;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestWithFlashcardsDto;

import java.util.List;
import java.util.UUID;

public interface GenerationRequestService {

    /**
     * Stores the request and one pending flashcard per draft as a single unit. If the flashcards
     * cannot be written, the request is removed again and
     * {@link uk.gegc.flashcards.shared.exception.FlashcardPersistenceException} is thrown.
     */
    GenerationRequestWithFlashcardsDto create(UUID userId, String sourceText, List<FlashcardDraft> drafts);

    Page<GenerationRequestSummaryDto> list(UUID userId, Pageable pageable);

    GenerationRequestWithFlashcardsDto get(UUID userId, UUID generationRequestId);

    /**
     * Deletes the request; its flashcards are kept and lose the link.
     */
    void delete(UUID userId, UUID generationRequestId);
}
