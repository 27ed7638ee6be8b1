package uk.gegc.flashcards.features.flashcard.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.features.flashcard.domain.repository.projection.GenerationRequestFlashcardCount;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FlashcardRepository extends JpaRepository<Flashcard, UUID>, JpaSpecificationExecutor<Flashcard> {

    Optional<Flashcard> findByIdAndUserId(UUID id, UUID userId);

    long countByUserIdAndStatusAndNextReviewAtLessThanEqual(UUID userId, FlashcardStatus status, Instant now);

    List<Flashcard> findByUserIdAndStatusAndNextReviewAtLessThanEqualOrderByNextReviewAtAsc(
            UUID userId, FlashcardStatus status, Instant now, Pageable pageable);

    List<Flashcard> findByGenerationRequestIdAndUserIdOrderByCreatedAtAsc(UUID generationRequestId, UUID userId);

    @Query("""
        SELECT f.generationRequestId AS generationRequestId, COUNT(f) AS flashcardCount
        FROM Flashcard f
        WHERE f.generationRequestId IN :generationRequestIds
        GROUP BY f.generationRequestId
        """)
    List<GenerationRequestFlashcardCount> countByGenerationRequestIds(
            @Param("generationRequestIds") Collection<UUID> generationRequestIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Flashcard f SET f.generationRequestId = NULL WHERE f.generationRequestId = :generationRequestId")
    int detachFromGenerationRequest(@Param("generationRequestId") UUID generationRequestId);
}
