package uk.gegc.flashcards.features.study.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "StudySessionInfo")
public record StudySessionInfo(
        @Schema(description = "All flashcards currently due")
        long flashcardsDue,
        @Schema(description = "Flashcards returned in this session")
        int flashcardsInSession
) {
}
