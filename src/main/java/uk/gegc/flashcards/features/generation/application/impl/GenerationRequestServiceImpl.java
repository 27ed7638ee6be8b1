package uk.gegc.flashcards.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.flashcards.features.flashcard.application.FlashcardLifecycle;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.repository.FlashcardRepository;
import uk.gegc.flashcards.features.flashcard.domain.repository.projection.GenerationRequestFlashcardCount;
import uk.gegc.flashcards.features.flashcard.infra.mapping.FlashcardMapper;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestSummaryDto;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestWithFlashcardsDto;
import uk.gegc.flashcards.features.generation.application.FlashcardDraft;
import uk.gegc.flashcards.features.generation.application.GenerationMetricsService;
import uk.gegc.flashcards.features.generation.application.GenerationRequestService;
import uk.gegc.flashcards.features.generation.application.SourceTextPolicy;
import uk.gegc.flashcards.features.generation.domain.model.GenerationRequest;
import uk.gegc.flashcards.features.generation.domain.repository.GenerationRequestRepository;
import uk.gegc.flashcards.features.generation.infra.mapping.GenerationRequestMapper;
import uk.gegc.flashcards.shared.exception.FlashcardPersistenceException;
import uk.gegc.flashcards.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationRequestServiceImpl implements GenerationRequestService {

    private static final Set<String> SORTABLE_PROPERTIES = Set.of("createdAt", "updatedAt");

    private final GenerationRequestRepository generationRequestRepository;
    private final FlashcardRepository flashcardRepository;
    private final FlashcardLifecycle lifecycle;
    private final GenerationRequestMapper generationRequestMapper;
    private final FlashcardMapper flashcardMapper;
    private final GenerationMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public GenerationRequestWithFlashcardsDto create(UUID userId, String sourceText, List<FlashcardDraft> drafts) {
        String trimmedSource = SourceTextPolicy.normalize(sourceText);
        if (drafts == null || drafts.isEmpty()) {
            throw new IllegalArgumentException("At least one flashcard draft is required");
        }

        AtomicReference<UUID> createdRequestId = new AtomicReference<>();
        try {
            return transactionTemplate.execute(status ->
                    persistRequestWithFlashcards(userId, trimmedSource, drafts, createdRequestId));
        } catch (FlashcardPersistenceException ex) {
            // the failed transaction is rolled back by now; cleanup runs on a fresh persistence context
            if (createdRequestId.get() != null) {
                removeGenerationRequest(createdRequestId.get());
            }
            throw ex;
        }
    }

    private GenerationRequestWithFlashcardsDto persistRequestWithFlashcards(
            UUID userId,
            String trimmedSource,
            List<FlashcardDraft> drafts,
            AtomicReference<UUID> createdRequestId
    ) {
        GenerationRequest request = new GenerationRequest();
        request.setUserId(userId);
        request.setSourceText(trimmedSource);

        GenerationRequest savedRequest;
        try {
            savedRequest = generationRequestRepository.saveAndFlush(request);
        } catch (DataAccessException ex) {
            log.error("Failed to create generation request for user {}", userId, ex);
            throw new FlashcardPersistenceException("Failed to create generation request", ex);
        }
        createdRequestId.set(savedRequest.getId());

        Instant now = Instant.now(clock);
        List<Flashcard> cards = drafts.stream()
                .map(draft -> toPendingFlashcard(userId, savedRequest.getId(), draft, now))
                .toList();

        List<Flashcard> savedCards;
        try {
            savedCards = flashcardRepository.saveAllAndFlush(cards);
        } catch (DataAccessException ex) {
            log.error("Failed to create {} flashcards for generation request {}", cards.size(), savedRequest.getId(), ex);
            metricsService.incrementPersistenceFailed();
            throw new FlashcardPersistenceException("Failed to create flashcards", ex);
        }

        metricsService.incrementRequestCreated(savedCards.size());
        log.info("Created generation request {} with {} pending flashcards for user {}",
                savedRequest.getId(), savedCards.size(), userId);

        return new GenerationRequestWithFlashcardsDto(
                generationRequestMapper.toDto(savedRequest),
                flashcardMapper.toDtos(savedCards)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public Page<GenerationRequestSummaryDto> list(UUID userId, Pageable pageable) {
        for (Sort.Order order : pageable.getSort()) {
            if (!SORTABLE_PROPERTIES.contains(order.getProperty())) {
                throw new IllegalArgumentException("Invalid sort property: " + order.getProperty()
                        + ". Allowed: createdAt, updatedAt");
            }
        }

        Page<GenerationRequest> page = generationRequestRepository.findByUserId(userId, pageable);
        if (page.isEmpty()) {
            return page.map(request -> generationRequestMapper.toSummaryDto(request, 0));
        }

        List<UUID> ids = page.getContent().stream().map(GenerationRequest::getId).toList();
        Map<UUID, Long> counts = flashcardRepository.countByGenerationRequestIds(ids).stream()
                .collect(Collectors.toMap(
                        GenerationRequestFlashcardCount::getGenerationRequestId,
                        GenerationRequestFlashcardCount::getFlashcardCount));

        return page.map(request -> generationRequestMapper.toSummaryDto(
                request, counts.getOrDefault(request.getId(), 0L)));
    }

    @Override
    @Transactional(readOnly = true)
    public GenerationRequestWithFlashcardsDto get(UUID userId, UUID generationRequestId) {
        GenerationRequest request = findOwned(userId, generationRequestId);
        List<Flashcard> cards = flashcardRepository.findByGenerationRequestIdAndUserIdOrderByCreatedAtAsc(
                generationRequestId, userId);
        return new GenerationRequestWithFlashcardsDto(
                generationRequestMapper.toDto(request),
                flashcardMapper.toDtos(cards)
        );
    }

    @Override
    @Transactional
    public void delete(UUID userId, UUID generationRequestId) {
        GenerationRequest request = findOwned(userId, generationRequestId);
        int detached = flashcardRepository.detachFromGenerationRequest(generationRequestId);
        generationRequestRepository.delete(request);
        log.info("Deleted generation request {} for user {} ({} flashcards detached)",
                generationRequestId, userId, detached);
    }

    private Flashcard toPendingFlashcard(UUID userId, UUID generationRequestId, FlashcardDraft draft, Instant now) {
        Flashcard card = new Flashcard();
        card.setUserId(userId);
        card.setGenerationRequestId(generationRequestId);
        card.setFront(draft.front().trim());
        card.setBack(draft.back().trim());
        lifecycle.initialize(card, FlashcardSource.AI_GENERATED, now);
        return card;
    }

    /**
     * Best-effort removal of a request whose flashcards could not be written, run in its own
     * transaction after the failed one has rolled back. Usually finds nothing to delete; a failure
     * here is logged and the original error is what the caller sees.
     */
    private void removeGenerationRequest(UUID generationRequestId) {
        try {
            TransactionTemplate cleanupTemplate = new TransactionTemplate(transactionTemplate.getTransactionManager());
            cleanupTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
            cleanupTemplate.executeWithoutResult(status -> {
                if (generationRequestRepository.existsById(generationRequestId)) {
                    generationRequestRepository.deleteById(generationRequestId);
                    log.info("Removed generation request {} after failed flashcard write", generationRequestId);
                }
            });
        } catch (RuntimeException cleanupEx) {
            log.error("Failed to remove generation request {} after failed flashcard write",
                    generationRequestId, cleanupEx);
        }
    }

    private GenerationRequest findOwned(UUID userId, UUID generationRequestId) {
        return generationRequestRepository.findByIdAndUserId(generationRequestId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Generation request " + generationRequestId + " not found"));
    }
}
