package uk.gegc.flashcards.features.generation.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.flashcards.features.generation.application.GenerationMetricsService;

@Service
public class GenerationMetricsServiceImpl implements GenerationMetricsService {

    private final Counter requestCreatedCounter;
    private final Counter flashcardsCreatedCounter;
    private final Counter persistenceFailedCounter;
    private final Counter draftsDiscardedCounter;
    private final Counter aiFailureCounter;

    public GenerationMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.requestCreatedCounter = Counter.builder("flashcards.generation.requests.created")
                .description("Number of generation requests persisted")
                .register(meterRegistry);
        this.flashcardsCreatedCounter = Counter.builder("flashcards.generation.flashcards.created")
                .description("Number of pending flashcards created by generation")
                .register(meterRegistry);
        this.persistenceFailedCounter = Counter.builder("flashcards.generation.persistence.failed")
                .description("Number of generation requests rolled back after a failed flashcard write")
                .register(meterRegistry);
        this.draftsDiscardedCounter = Counter.builder("flashcards.generation.drafts.discarded")
                .description("Number of AI drafts dropped for being blank or too long")
                .register(meterRegistry);
        this.aiFailureCounter = Counter.builder("flashcards.generation.ai.failed")
                .description("Number of generation attempts that produced no usable drafts")
                .register(meterRegistry);
    }

    @Override
    public void incrementRequestCreated(int flashcardCount) {
        requestCreatedCounter.increment();
        flashcardsCreatedCounter.increment(flashcardCount);
    }

    @Override
    public void incrementPersistenceFailed() {
        persistenceFailedCounter.increment();
    }

    @Override
    public void incrementDraftsDiscarded(int count) {
        draftsDiscardedCounter.increment(count);
    }

    @Override
    public void incrementAiFailure() {
        aiFailureCounter.increment();
    }
}
