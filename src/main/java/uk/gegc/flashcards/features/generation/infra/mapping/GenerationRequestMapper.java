package uk.gegc.flashcards.features.generation.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestDto;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestSummaryDto;
import uk.gegc.flashcards.features.generation.domain.model.GenerationRequest;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface GenerationRequestMapper {
    GenerationRequestDto toDto(GenerationRequest entity);

    @Mapping(target = "id", source = "entity.id")
    @Mapping(target = "sourceText", source = "entity.sourceText")
    @Mapping(target = "createdAt", source = "entity.createdAt")
    @Mapping(target = "updatedAt", source = "entity.updatedAt")
    @Mapping(target = "flashcardsCount", source = "flashcardsCount")
    GenerationRequestSummaryDto toSummaryDto(GenerationRequest entity, long flashcardsCount);
}
