package uk.gegc.flashcards.features.flashcard.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.flashcards.features.flashcard.api.dto.CreateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.api.dto.UpdateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.application.FlashcardLifecycle;
import uk.gegc.flashcards.features.flashcard.application.FlashcardService;
import uk.gegc.flashcards.features.flashcard.application.dto.BatchApproveFailure;
import uk.gegc.flashcards.features.flashcard.application.dto.BatchApproveResult;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.features.flashcard.domain.repository.FlashcardRepository;
import uk.gegc.flashcards.features.flashcard.domain.repository.FlashcardSpecifications;
import uk.gegc.flashcards.features.flashcard.infra.mapping.FlashcardMapper;
import uk.gegc.flashcards.shared.exception.InvalidFlashcardStateException;
import uk.gegc.flashcards.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class FlashcardServiceImpl implements FlashcardService {

    static final int MAX_BATCH_SIZE = 50;
    private static final Set<String> SORTABLE_PROPERTIES = Set.of("createdAt", "updatedAt", "nextReviewAt");

    private final FlashcardRepository flashcardRepository;
    private final FlashcardLifecycle lifecycle;
    private final FlashcardMapper flashcardMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public FlashcardDto createManual(UUID userId, CreateFlashcardRequest request) {
        Flashcard card = new Flashcard();
        card.setUserId(userId);
        card.setFront(requireText(request.front(), "front"));
        card.setBack(requireText(request.back(), "back"));
        lifecycle.initialize(card, FlashcardSource.MANUAL, Instant.now(clock));

        Flashcard saved = flashcardRepository.save(card);
        log.info("Created manual flashcard {} for user {}", saved.getId(), userId);
        return flashcardMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<FlashcardDto> list(UUID userId, FlashcardStatus status, FlashcardSource source, Pageable pageable) {
        for (Sort.Order order : pageable.getSort()) {
            if (!SORTABLE_PROPERTIES.contains(order.getProperty())) {
                throw new IllegalArgumentException("Invalid sort property: " + order.getProperty()
                        + ". Allowed: createdAt, updatedAt, nextReviewAt");
            }
        }
        return flashcardRepository.findAll(FlashcardSpecifications.build(userId, status, source), pageable)
                .map(flashcardMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public FlashcardDto get(UUID userId, UUID flashcardId) {
        return flashcardMapper.toDto(findOwned(userId, flashcardId));
    }

    @Override
    public FlashcardDto update(UUID userId, UUID flashcardId, UpdateFlashcardRequest request) {
        Flashcard card = findOwned(userId, flashcardId);
        if (request.front() != null) {
            card.setFront(requireText(request.front(), "front"));
        }
        if (request.back() != null) {
            card.setBack(requireText(request.back(), "back"));
        }
        if (request.status() != null) {
            lifecycle.changeStatus(card, request.status(), Instant.now(clock));
        }
        Flashcard saved = flashcardRepository.save(card);
        log.info("Updated flashcard {} for user {}", flashcardId, userId);
        return flashcardMapper.toDto(saved);
    }

    @Override
    public void delete(UUID userId, UUID flashcardId) {
        Flashcard card = findOwned(userId, flashcardId);
        flashcardRepository.delete(card);
        log.info("Deleted flashcard {} for user {}", flashcardId, userId);
    }

    @Override
    public FlashcardDto approve(UUID userId, UUID flashcardId) {
        return flashcardMapper.toDto(approveOwned(userId, flashcardId));
    }

    @Override
    public FlashcardDto reject(UUID userId, UUID flashcardId) {
        Flashcard card = findOwned(userId, flashcardId);
        lifecycle.reject(card);
        Flashcard saved = flashcardRepository.save(card);
        log.info("Rejected flashcard {} for user {}", flashcardId, userId);
        return flashcardMapper.toDto(saved);
    }

    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BatchApproveResult batchApprove(UUID userId, List<UUID> flashcardIds) {
        if (flashcardIds == null || flashcardIds.isEmpty() || flashcardIds.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Between 1 and " + MAX_BATCH_SIZE + " flashcard IDs are required");
        }

        List<UUID> approved = new ArrayList<>();
        List<BatchApproveFailure> failed = new ArrayList<>();

        for (UUID flashcardId : flashcardIds) {
            try {
                transactionTemplate.executeWithoutResult(status -> approveOwned(userId, flashcardId));
                approved.add(flashcardId);
            } catch (ResourceNotFoundException | InvalidFlashcardStateException ex) {
                log.warn("Batch approval skipped flashcard {}: {}", flashcardId, ex.getMessage());
                failed.add(new BatchApproveFailure(flashcardId, ex.getMessage()));
            } catch (DataAccessException ex) {
                log.error("Batch approval failed to persist flashcard {}", flashcardId, ex);
                failed.add(new BatchApproveFailure(flashcardId, "Failed to approve flashcard"));
            }
        }

        log.info("Batch approve completed for user {}: total={}, approved={}, failed={}",
                userId, flashcardIds.size(), approved.size(), failed.size());
        return new BatchApproveResult(approved, failed);
    }

    private Flashcard approveOwned(UUID userId, UUID flashcardId) {
        Flashcard card = findOwned(userId, flashcardId);
        lifecycle.approve(card, Instant.now(clock));
        Flashcard saved = flashcardRepository.save(card);
        log.info("Approved flashcard {} for user {}", flashcardId, userId);
        return saved;
    }

    private Flashcard findOwned(UUID userId, UUID flashcardId) {
        return flashcardRepository.findByIdAndUserId(flashcardId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Flashcard " + flashcardId + " not found"));
    }

    private static String requireText(String value, String field) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return trimmed;
    }
}
