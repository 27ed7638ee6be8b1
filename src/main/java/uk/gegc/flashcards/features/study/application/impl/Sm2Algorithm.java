package uk.gegc.flashcards.features.study.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.flashcards.features.study.application.SrsAlgorithm;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class Sm2Algorithm implements SrsAlgorithm {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    private static final int PASSING_QUALITY = 3;
    private static final double MIN_EASE_FACTOR = 1.3;
    // ease_factor is stored as DECIMAL(3,2)
    public static final double MAX_EASE_FACTOR = 9.99;
    // one hundred years keeps next_review_at inside the DATETIME range
    public static final int MAX_INTERVAL_DAYS = 36_500;
    private static final int AGAIN_INTERVAL_DAYS = 0;
    private static final int FIRST_SUCCESS_INTERVAL_DAYS = 1;
    private static final int SECOND_SUCCESS_INTERVAL_DAYS = 6;

    @Override
    public SchedulingResult applyReview(
            int currentIntervalDays,
            double currentEaseFactor,
            int quality,
            Instant now
    ) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException("Quality must be between 0 and 5, got " + quality);
        }
        if (currentIntervalDays < 0) {
            throw new IllegalArgumentException("Interval must not be negative, got " + currentIntervalDays);
        }

        int intervalDays;
        double easeFactor;

        if (quality < PASSING_QUALITY) {
            intervalDays = AGAIN_INTERVAL_DAYS;
            easeFactor = currentEaseFactor;
        } else {
            intervalDays = computeIntervalDays(currentIntervalDays, currentEaseFactor);
            easeFactor = calculateUpdatedEase(currentEaseFactor, quality);
        }

        Instant nextReview = now.plus(intervalDays, ChronoUnit.DAYS);

        return new SchedulingResult(intervalDays, easeFactor, nextReview, now, quality);
    }

    private int computeIntervalDays(int currentIntervalDays, double currentEaseFactor) {
        if (currentIntervalDays == 0) return FIRST_SUCCESS_INTERVAL_DAYS;
        if (currentIntervalDays == 1) return SECOND_SUCCESS_INTERVAL_DAYS;
        long next = Math.round(currentIntervalDays * currentEaseFactor);
        return (int) Math.min(next, MAX_INTERVAL_DAYS);
    }

    // rounded to 2 decimals so repeated reviews do not accumulate float drift
    private double calculateUpdatedEase(double currentEaseFactor, int quality) {
        double updatedEase = currentEaseFactor
                + (0.1 - (5 - quality) * (0.08 + (5 - quality) * 0.02));
        double bounded = Math.min(Math.max(updatedEase, MIN_EASE_FACTOR), MAX_EASE_FACTOR);
        return BigDecimal.valueOf(bounded).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
