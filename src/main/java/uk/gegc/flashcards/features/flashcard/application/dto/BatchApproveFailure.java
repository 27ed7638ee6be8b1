package uk.gegc.flashcards.features.flashcard.application.dto;

import java.util.UUID;

public record BatchApproveFailure(UUID id, String reason) {
}
