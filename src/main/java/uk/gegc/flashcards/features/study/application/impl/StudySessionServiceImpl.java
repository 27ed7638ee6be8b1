package uk.gegc.flashcards.features.study.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.application.FlashcardLifecycle;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.repository.FlashcardRepository;
import uk.gegc.flashcards.features.flashcard.infra.mapping.FlashcardMapper;
import uk.gegc.flashcards.features.study.api.dto.StudySessionDto;
import uk.gegc.flashcards.features.study.api.dto.StudySessionInfo;
import uk.gegc.flashcards.features.study.application.DueCardSelection;
import uk.gegc.flashcards.features.study.application.DueCardSelector;
import uk.gegc.flashcards.features.study.application.SrsAlgorithm;
import uk.gegc.flashcards.features.study.application.StudySessionService;
import uk.gegc.flashcards.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StudySessionServiceImpl implements StudySessionService {

    private final DueCardSelector dueCardSelector;
    private final FlashcardRepository flashcardRepository;
    private final FlashcardLifecycle lifecycle;
    private final SrsAlgorithm srsAlgorithm;
    private final FlashcardMapper flashcardMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public StudySessionDto getCurrentSession(UUID userId, int limit) {
        DueCardSelection selection = dueCardSelector.selectDue(userId, limit);
        log.debug("Study session for user {}: {} due, {} returned", userId, selection.totalDue(), selection.cards().size());
        return new StudySessionDto(
                new StudySessionInfo(selection.totalDue(), selection.cards().size()),
                flashcardMapper.toDtos(selection.cards())
        );
    }

    @Override
    @Transactional
    public FlashcardDto submitReview(UUID userId, UUID flashcardId, int quality) {
        Flashcard card = flashcardRepository.findByIdAndUserId(flashcardId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Flashcard " + flashcardId + " not found"));
        lifecycle.ensureReviewable(card);

        SrsAlgorithm.SchedulingResult result = srsAlgorithm.applyReview(
                card.getIntervalDays(),
                card.getEaseFactor(),
                quality,
                Instant.now(clock)
        );

        card.setIntervalDays(result.intervalDays());
        card.setEaseFactor(result.easeFactor());
        card.setNextReviewAt(result.nextReviewAt());

        Flashcard saved = flashcardRepository.save(card);
        log.info("Reviewed flashcard {} for user {} with quality {}: interval={}d, ease={}, next={}",
                flashcardId, userId, quality, result.intervalDays(), result.easeFactor(), result.nextReviewAt());
        return flashcardMapper.toDto(saved);
    }
}
