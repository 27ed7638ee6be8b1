package uk.gegc.flashcards.features.study.application;

import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;

import java.util.List;

/**
 * @param totalDue all due cards of the user, may exceed {@code cards.size()}
 * @param cards    most overdue first
 */
public record DueCardSelection(long totalDue, List<Flashcard> cards) {
}
