package uk.gegc.flashcards.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;

import java.util.List;

@Schema(name = "GenerationRequestWithFlashcardsDto", description = "Generation request and its flashcards in creation order")
public record GenerationRequestWithFlashcardsDto(
        GenerationRequestDto generationRequest,
        List<FlashcardDto> flashcards
) {
}
