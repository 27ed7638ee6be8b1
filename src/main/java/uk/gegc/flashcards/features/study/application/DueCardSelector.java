package uk.gegc.flashcards.features.study.application;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.features.flashcard.domain.repository.FlashcardRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Picks the active cards whose review time has come. The count and the page are two separate reads,
 * so under concurrent reviews they may disagree slightly.
 */
@Component
@RequiredArgsConstructor
public class DueCardSelector {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 50;

    private final FlashcardRepository flashcardRepository;
    private final Clock clock;

    public DueCardSelection selectDue(UUID userId, int limit) {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT);
        }
        Instant now = Instant.now(clock);

        long totalDue = flashcardRepository.countByUserIdAndStatusAndNextReviewAtLessThanEqual(
                userId, FlashcardStatus.ACTIVE, now);
        List<Flashcard> cards = flashcardRepository.findByUserIdAndStatusAndNextReviewAtLessThanEqualOrderByNextReviewAtAsc(
                userId, FlashcardStatus.ACTIVE, now, PageRequest.of(0, limit));

        return new DueCardSelection(totalDue, cards);
    }
}
