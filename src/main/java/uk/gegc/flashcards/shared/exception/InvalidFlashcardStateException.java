package uk.gegc.flashcards.shared.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;

/**
 * Thrown when a lifecycle transition is attempted from a status that does not permit it.
 */
@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidFlashcardStateException extends RuntimeException {

    private final FlashcardStatus currentStatus;

    public InvalidFlashcardStateException(String message, FlashcardStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }
}
