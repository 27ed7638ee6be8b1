package uk.gegc.flashcards.features.generation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for AI flashcard generation
 */
@Component
@ConfigurationProperties(prefix = "app.flashcards.generation")
@Data
public class FlashcardGenerationProperties {

    /**
     * Chat model used for generation
     */
    private String model = "gpt-4o-mini";

    /**
     * Sampling temperature
     */
    private double temperature = 0.3;

    private int minFlashcards = 5;

    private int maxFlashcards = 15;
}
