package uk.gegc.flashcards.features.flashcard.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Size;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;

@Schema(name = "UpdateFlashcardRequest", description = "Partial update; at least one field must be provided")
public record UpdateFlashcardRequest(
        @Schema(description = "New question side")
        @Size(min = 1, max = 1000, message = "Front must be between 1 and 1000 characters")
        String front,

        @Schema(description = "New answer side")
        @Size(min = 1, max = 2000, message = "Back must be between 1 and 2000 characters")
        String back,

        @Schema(description = "Requested status; only pending_review cards may change status", example = "active")
        FlashcardStatus status
) {

    @JsonIgnore
    @AssertTrue(message = "At least one of front, back or status must be provided")
    public boolean isAnyFieldPresent() {
        return front != null || back != null || status != null;
    }
}
