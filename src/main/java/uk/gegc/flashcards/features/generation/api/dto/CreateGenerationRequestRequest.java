package uk.gegc.flashcards.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "CreateGenerationRequestRequest", description = "Source text to generate flashcards from")
public record CreateGenerationRequestRequest(
        @Schema(description = "Source text, 1000 to 10000 characters after trimming", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Source text is required")
        String sourceText
) {
}
