package uk.gegc.flashcards.features.flashcard.application;

import org.springframework.stereotype.Component;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.shared.exception.InvalidFlashcardStateException;

import java.time.Instant;
import java.util.Objects;

/**
 * Status transitions of a flashcard.
 * <pre>
 *   manual       -> ACTIVE
 *   ai_generated -> PENDING_REVIEW -> ACTIVE | REJECTED
 * </pre>
 * ACTIVE and REJECTED have no outgoing transitions. Every method mutates the given card in place
 * and takes the current instant from the caller.
 */
@Component
public class FlashcardLifecycle {

    public static final int INITIAL_INTERVAL_DAYS = 0;
    public static final double INITIAL_EASE_FACTOR = 2.5;

    public void initialize(Flashcard card, FlashcardSource source, Instant now) {
        Objects.requireNonNull(source, "source must not be null");
        card.setSource(source);
        card.setIntervalDays(INITIAL_INTERVAL_DAYS);
        card.setEaseFactor(INITIAL_EASE_FACTOR);
        switch (source) {
            case MANUAL -> {
                card.setStatus(FlashcardStatus.ACTIVE);
                card.setNextReviewAt(now);
            }
            case AI_GENERATED -> {
                card.setStatus(FlashcardStatus.PENDING_REVIEW);
                card.setNextReviewAt(null);
            }
        }
    }

    public void approve(Flashcard card, Instant now) {
        FlashcardStatus next = switch (card.getStatus()) {
            case PENDING_REVIEW -> FlashcardStatus.ACTIVE;
            case ACTIVE, REJECTED -> throw notPendingReview(card);
        };
        card.setStatus(next);
        card.setNextReviewAt(now);
    }

    public void reject(Flashcard card) {
        FlashcardStatus next = switch (card.getStatus()) {
            case PENDING_REVIEW -> FlashcardStatus.REJECTED;
            case ACTIVE, REJECTED -> throw notPendingReview(card);
        };
        card.setStatus(next);
        card.setNextReviewAt(null);
    }

    /**
     * Only active cards take part in study sessions.
     */
    public void ensureReviewable(Flashcard card) {
        boolean reviewable = switch (card.getStatus()) {
            case ACTIVE -> true;
            case PENDING_REVIEW, REJECTED -> false;
        };
        if (!reviewable) {
            throw new InvalidFlashcardStateException(
                    "Flashcard is not in active status", card.getStatus());
        }
    }

    /**
     * Applies a status requested through a generic edit. Requesting the current status is a no-op;
     * leaving PENDING_REVIEW behaves exactly like {@link #approve} or {@link #reject}; anything else is refused.
     */
    public void changeStatus(Flashcard card, FlashcardStatus requested, Instant now) {
        Objects.requireNonNull(requested, "requested status must not be null");
        if (card.getStatus() == requested) {
            return;
        }
        switch (requested) {
            case ACTIVE -> approve(card, now);
            case REJECTED -> reject(card);
            case PENDING_REVIEW -> throw new InvalidFlashcardStateException(
                    "Flashcard cannot be moved back to pending_review status", card.getStatus());
        }
    }

    private static InvalidFlashcardStateException notPendingReview(Flashcard card) {
        return new InvalidFlashcardStateException(
                "Flashcard is not in pending_review status", card.getStatus());
    }
}
