package uk.gegc.flashcards.shared.exception;

/**
 * Wraps a failure of the underlying store. The message is safe to show to clients;
 * the cause carries the technical detail and is only logged.
 */
public class FlashcardPersistenceException extends RuntimeException {

    public FlashcardPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
