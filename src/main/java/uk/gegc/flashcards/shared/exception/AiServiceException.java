package uk.gegc.flashcards.shared.exception;

/**
 * Exception thrown when the AI draft source fails or returns nothing usable
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
