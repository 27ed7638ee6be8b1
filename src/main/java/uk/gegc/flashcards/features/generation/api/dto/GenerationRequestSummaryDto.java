package uk.gegc.flashcards.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "GenerationRequestSummaryDto", description = "Generation request with the number of flashcards still linked to it")
public record GenerationRequestSummaryDto(
        UUID id,
        String sourceText,
        long flashcardsCount,
        Instant createdAt,
        Instant updatedAt
) {
}
