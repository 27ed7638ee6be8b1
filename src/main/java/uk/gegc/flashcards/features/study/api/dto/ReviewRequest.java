package uk.gegc.flashcards.features.study.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "ReviewRequest", description = "Result of reviewing one flashcard")
public record ReviewRequest(
        @Schema(description = "Reviewed flashcard", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID flashcardId,
        @Schema(description = "Recall quality: 0 (blackout) to 5 (perfect)", example = "4", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @Min(0)
        @Max(5)
        Integer quality
) {
}
