package uk.gegc.flashcards.features.flashcard.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

@Schema(name = "BatchApproveRequest", description = "IDs of pending flashcards to approve")
public record BatchApproveRequest(
        @Schema(description = "Flashcard IDs (1 to 50)", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "At least one flashcard ID is required")
        @Size(max = 50, message = "At most 50 flashcards can be approved at once")
        List<@NotNull UUID> flashcardIds
) {
}
