package uk.gegc.flashcards.features.generation.application;

/**
 * Counters for the AI generation pipeline.
 */
public interface GenerationMetricsService {

    void incrementRequestCreated(int flashcardCount);

    void incrementPersistenceFailed();

    void incrementDraftsDiscarded(int count);

    void incrementAiFailure();
}
