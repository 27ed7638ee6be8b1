package uk.gegc.flashcards.features.generation.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.flashcards.features.generation.domain.model.GenerationRequest;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationRequestRepository extends JpaRepository<GenerationRequest, UUID> {

    Optional<GenerationRequest> findByIdAndUserId(UUID id, UUID userId);

    Page<GenerationRequest> findByUserId(UUID userId, Pageable pageable);
}
