package uk.gegc.flashcards.features.study.application;

import java.time.Instant;

public interface SrsAlgorithm {

    /**
     * Computes the next schedule for a card after one review.
     *
     * @param currentIntervalDays interval before the review, {@code >= 0}
     * @param currentEaseFactor   ease before the review, {@code >= 1.3}
     * @param quality             recall quality in {@code [0, 5]}
     * @param now                 review instant
     * @throws IllegalArgumentException if quality or interval are out of range
     */
    SchedulingResult applyReview(
            int currentIntervalDays,
            double currentEaseFactor,
            int quality,
            Instant now
    );

    record SchedulingResult(
            int intervalDays,
            double easeFactor,
            Instant nextReviewAt,
            Instant reviewedAt,
            int quality
    ) {}
}
