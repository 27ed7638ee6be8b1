package uk.gegc.flashcards.features.study.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;

import java.util.List;

@Schema(name = "StudySessionDto", description = "Due flashcards, most overdue first")
public record StudySessionDto(
        StudySessionInfo session,
        List<FlashcardDto> flashcards
) {
}
