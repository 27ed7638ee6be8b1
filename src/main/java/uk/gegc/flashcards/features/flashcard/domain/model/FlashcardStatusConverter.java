package uk.gegc.flashcards.features.flashcard.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class FlashcardStatusConverter implements AttributeConverter<FlashcardStatus, String> {

    @Override
    public String convertToDatabaseColumn(FlashcardStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public FlashcardStatus convertToEntityAttribute(String dbData) {
        return FlashcardStatus.fromValue(dbData);
    }
}
