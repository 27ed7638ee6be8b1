package uk.gegc.flashcards.features.flashcard.application.dto;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch approval. Every requested id appears in exactly one of the two lists.
 */
public record BatchApproveResult(List<UUID> approved, List<BatchApproveFailure> failed) {

    public BatchApproveResult {
        approved = List.copyOf(approved);
        failed = List.copyOf(failed);
    }
}
