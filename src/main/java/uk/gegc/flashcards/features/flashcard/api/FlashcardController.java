package uk.gegc.flashcards.features.flashcard.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.flashcards.features.flashcard.api.dto.BatchApproveRequest;
import uk.gegc.flashcards.features.flashcard.api.dto.CreateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.api.dto.UpdateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.application.FlashcardService;
import uk.gegc.flashcards.features.flashcard.application.dto.BatchApproveResult;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.shared.exception.UnauthorizedException;

import java.util.Optional;
import java.util.UUID;

@Tag(name = "Flashcards", description = "Manual flashcards and review of AI-generated drafts")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/flashcards")
@RequiredArgsConstructor
@Validated
public class FlashcardController {

    private final FlashcardService flashcardService;

    @PostMapping
    @Operation(summary = "Create a manual flashcard", description = "Manual cards are active and due immediately.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Flashcard created",
                    content = @Content(schema = @Schema(implementation = FlashcardDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FlashcardDto> create(
            Authentication authentication,
            @Valid @RequestBody CreateFlashcardRequest request
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(flashcardService.createManual(userId, request));
    }

    @GetMapping
    @Operation(summary = "List flashcards", description = "Sortable by createdAt, updatedAt or nextReviewAt; newest first by default.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of flashcards"),
            @ApiResponse(responseCode = "400", description = "Invalid filter or sort",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Page<FlashcardDto>> list(
            Authentication authentication,
            @Parameter(description = "Status filter: active, pending_review, rejected")
            @RequestParam(required = false) String status,
            @Parameter(description = "Source filter: manual, ai_generated")
            @RequestParam(required = false) String source,
            @ParameterObject @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(flashcardService.list(
                userId,
                FlashcardStatus.fromValue(status),
                FlashcardSource.fromValue(source),
                pageable));
    }

    @GetMapping("/{flashcardId}")
    @Operation(summary = "Get a flashcard")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flashcard"),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FlashcardDto> get(
            Authentication authentication,
            @PathVariable UUID flashcardId
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(flashcardService.get(userId, flashcardId));
    }

    @PatchMapping("/{flashcardId}")
    @Operation(summary = "Update a flashcard", description = "Status changes follow the review workflow: only pending cards can become active or rejected.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flashcard updated"),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Status change not allowed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FlashcardDto> update(
            Authentication authentication,
            @PathVariable UUID flashcardId,
            @Valid @RequestBody UpdateFlashcardRequest request
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(flashcardService.update(userId, flashcardId, request));
    }

    @DeleteMapping("/{flashcardId}")
    @Operation(summary = "Delete a flashcard")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Flashcard deleted"),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Void> delete(
            Authentication authentication,
            @PathVariable UUID flashcardId
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        flashcardService.delete(userId, flashcardId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{flashcardId}/approve")
    @Operation(summary = "Approve a pending flashcard", description = "The card becomes active and due immediately.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flashcard approved"),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Flashcard is not pending review",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FlashcardDto> approve(
            Authentication authentication,
            @PathVariable UUID flashcardId
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(flashcardService.approve(userId, flashcardId));
    }

    @PostMapping("/{flashcardId}/reject")
    @Operation(summary = "Reject a pending flashcard")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Flashcard rejected"),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Flashcard is not pending review",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FlashcardDto> reject(
            Authentication authentication,
            @PathVariable UUID flashcardId
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(flashcardService.reject(userId, flashcardId));
    }

    @PostMapping("/batch-approve")
    @Operation(summary = "Approve several pending flashcards", description = "Each ID is processed independently; failures are reported per ID.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch processed",
                    content = @Content(schema = @Schema(implementation = BatchApproveResult.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<BatchApproveResult> batchApprove(
            Authentication authentication,
            @Valid @RequestBody BatchApproveRequest request
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(flashcardService.batchApprove(userId, request.flashcardIds()));
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
