package uk.gegc.flashcards.features.flashcard.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.flashcards.features.flashcard.api.dto.CreateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.api.dto.UpdateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.application.dto.BatchApproveResult;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;

import java.util.List;
import java.util.UUID;

/**
 * Owner-scoped flashcard operations. A card that belongs to another user is reported as not found.
 */
public interface FlashcardService {

    FlashcardDto createManual(UUID userId, CreateFlashcardRequest request);

    Page<FlashcardDto> list(UUID userId, FlashcardStatus status, FlashcardSource source, Pageable pageable);

    FlashcardDto get(UUID userId, UUID flashcardId);

    FlashcardDto update(UUID userId, UUID flashcardId, UpdateFlashcardRequest request);

    void delete(UUID userId, UUID flashcardId);

    FlashcardDto approve(UUID userId, UUID flashcardId);

    FlashcardDto reject(UUID userId, UUID flashcardId);

    /**
     * Approves each id independently; one failure does not affect the others.
     *
     * @param flashcardIds 1 to 50 ids
     */
    BatchApproveResult batchApprove(UUID userId, List<UUID> flashcardIds);
}
