package uk.gegc.flashcards.features.study.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.study.api.dto.ReviewRequest;
import uk.gegc.flashcards.features.study.api.dto.StudySessionDto;
import uk.gegc.flashcards.features.study.application.StudySessionService;
import uk.gegc.flashcards.shared.exception.UnauthorizedException;

import java.util.Optional;
import java.util.UUID;

@Tag(name = "Study Sessions", description = "Due flashcards and SM-2 review submissions")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/study-sessions")
@RequiredArgsConstructor
@Validated
public class StudySessionController {

    private final StudySessionService studySessionService;

    @GetMapping("/current")
    @Operation(
            summary = "Get the current study session",
            description = "Returns active flashcards whose nextReviewAt has passed, most overdue first, plus the total due count."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Study session",
                    content = @Content(schema = @Schema(implementation = StudySessionDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid limit",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<StudySessionDto> getCurrentSession(
            Authentication authentication,
            @Parameter(description = "Maximum number of flashcards (1-50)", example = "20")
            @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(studySessionService.getCurrentSession(userId, limit));
    }

    @PostMapping("/review")
    @Operation(summary = "Submit a review", description = "Reschedules an active flashcard with SM-2.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated flashcard",
                    content = @Content(schema = @Schema(implementation = FlashcardDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Flashcard is not active",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FlashcardDto> submitReview(
            Authentication authentication,
            @Valid @RequestBody ReviewRequest request
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(studySessionService.submitReview(userId, request.flashcardId(), request.quality()));
    }

    private UUID resolveAuthenticatedUserId(Authentication authentication) {
        if (authentication == null) {
            throw new UnauthorizedException("Authentication required");
        }
        return safeParseUuid(authentication.getName())
                .orElseThrow(() -> new UnauthorizedException("Unknown principal"));
    }

    private Optional<UUID> safeParseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
