package uk.gegc.flashcards.features.flashcard.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class FlashcardSourceConverter implements AttributeConverter<FlashcardSource, String> {

    @Override
    public String convertToDatabaseColumn(FlashcardSource attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public FlashcardSource convertToEntityAttribute(String dbData) {
        return FlashcardSource.fromValue(dbData);
    }
}
