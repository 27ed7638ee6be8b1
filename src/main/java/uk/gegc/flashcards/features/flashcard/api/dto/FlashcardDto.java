package uk.gegc.flashcards.features.flashcard.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "FlashcardDto", description = "Flashcard with its scheduling state")
public record FlashcardDto(
        @Schema(description = "Flashcard ID")
        UUID id,
        @Schema(description = "Generation request that produced the card, if any")
        UUID generationRequestId,
        @Schema(description = "Question side", example = "What is the capital of France?")
        String front,
        @Schema(description = "Answer side", example = "Paris")
        String back,
        @Schema(description = "How the card was created", example = "manual")
        FlashcardSource source,
        @Schema(description = "Lifecycle status", example = "active")
        FlashcardStatus status,
        @Schema(description = "Current interval in days")
        Integer intervalDays,
        @Schema(description = "Ease factor (SM-2)", example = "2.5")
        Double easeFactor,
        @Schema(description = "Next scheduled review time (UTC); null unless active")
        Instant nextReviewAt,
        @Schema(description = "Creation timestamp (UTC)")
        Instant createdAt,
        @Schema(description = "Last modification timestamp (UTC)")
        Instant updatedAt
) {
}
