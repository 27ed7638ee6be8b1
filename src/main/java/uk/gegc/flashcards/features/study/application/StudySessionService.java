package uk.gegc.flashcards.features.study.application;

import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.study.api.dto.StudySessionDto;

import java.util.UUID;

public interface StudySessionService {

    StudySessionDto getCurrentSession(UUID userId, int limit);

    FlashcardDto submitReview(UUID userId, UUID flashcardId, int quality);
}
