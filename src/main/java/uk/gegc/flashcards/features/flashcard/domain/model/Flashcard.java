package uk.gegc.flashcards.features.flashcard.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A two-sided study card with its SM-2 scheduling state.
 * <p>
 * {@code nextReviewAt} is set exactly when the card is {@link FlashcardStatus#ACTIVE}.
 * {@code source} never changes after creation.
 */
@Entity
@Getter
@Setter
@Table(
        name = "flashcards",
        indexes = {
                @Index(name = "idx_flashcards_user_status_next_review", columnList = "user_id, status, next_review_at"),
                @Index(name = "idx_flashcards_generation_request", columnList = "generation_request_id")
        }
)
public class Flashcard {

    public static final int FRONT_MAX_LENGTH = 1000;
    public static final int BACK_MAX_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "generation_request_id")
    private UUID generationRequestId;

    @Column(name = "front", nullable = false, length = FRONT_MAX_LENGTH)
    private String front;

    @Column(name = "back", nullable = false, length = BACK_MAX_LENGTH)
    private String back;

    @Column(name = "source", nullable = false, updatable = false, length = 20)
    private FlashcardSource source;

    @Column(name = "status", nullable = false, length = 20)
    private FlashcardStatus status;

    @Column(name = "interval_days", nullable = false)
    private Integer intervalDays;

    @Column(name = "ease_factor", nullable = false, columnDefinition = "DECIMAL(3,2)")
    private Double easeFactor;

    @Column(name = "next_review_at")
    private Instant nextReviewAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
