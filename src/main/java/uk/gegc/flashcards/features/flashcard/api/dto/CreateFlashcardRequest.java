package uk.gegc.flashcards.features.flashcard.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "CreateFlashcardRequest", description = "Request payload to create a manual flashcard")
public record CreateFlashcardRequest(
        @Schema(description = "Question side", example = "What is the capital of France?", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Front is required")
        @Size(max = 1000, message = "Front must be at most 1000 characters")
        String front,

        @Schema(description = "Answer side", example = "Paris", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Back is required")
        @Size(max = 2000, message = "Back must be at most 2000 characters")
        String back
) {
}
