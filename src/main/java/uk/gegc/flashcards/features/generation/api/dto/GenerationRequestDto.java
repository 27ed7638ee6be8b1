package uk.gegc.flashcards.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "GenerationRequestDto")
public record GenerationRequestDto(
        @Schema(description = "Generation request ID")
        UUID id,
        @Schema(description = "Submitted source text")
        String sourceText,
        @Schema(description = "Creation timestamp (UTC)")
        Instant createdAt,
        @Schema(description = "Last modification timestamp (UTC)")
        Instant updatedAt
) {
}
