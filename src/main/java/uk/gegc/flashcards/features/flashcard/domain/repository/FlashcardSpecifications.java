package uk.gegc.flashcards.features.flashcard.domain.repository;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class FlashcardSpecifications {

    private FlashcardSpecifications() {
    }

    public static Specification<Flashcard> build(UUID userId, FlashcardStatus status, FlashcardSource source) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("userId"), userId));

            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (source != null) {
                predicates.add(cb.equal(root.get("source"), source));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
