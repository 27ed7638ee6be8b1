package uk.gegc.flashcards.features.flashcard.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface FlashcardMapper {
    FlashcardDto toDto(Flashcard entity);

    List<FlashcardDto> toDtos(List<Flashcard> entities);
}
