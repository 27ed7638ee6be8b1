package uk.gegc.flashcards.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.flashcards.features.generation.api.dto.CreateGenerationRequestRequest;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestSummaryDto;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestWithFlashcardsDto;
import uk.gegc.flashcards.features.generation.application.FlashcardDraft;
import uk.gegc.flashcards.features.generation.application.FlashcardDraftGenerator;
import uk.gegc.flashcards.features.generation.application.GenerationRequestService;
import uk.gegc.flashcards.features.generation.application.SourceTextPolicy;
import uk.gegc.flashcards.shared.exception.UnauthorizedException;
import uk.gegc.flashcards.shared.rate_limit.RateLimitEntry;
import uk.gegc.flashcards.shared.rate_limit.RateLimitService;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Tag(name = "Generation Requests", description = "AI flashcard generation from source text")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/generation-requests")
@RequiredArgsConstructor
@Validated
@Slf4j
public class GenerationRequestController {

    static final String RATE_LIMIT_RESOURCE = "generation-requests";

    private final GenerationRequestService generationRequestService;
    private final FlashcardDraftGenerator draftGenerator;
    private final RateLimitService rateLimitService;

    @PostMapping
    @Operation(
            summary = "Generate flashcards from text",
            description = "Creates a generation request and its AI-proposed flashcards, all pending review. Rate limited per user."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Generation request created",
                    content = @Content(schema = @Schema(implementation = GenerationRequestWithFlashcardsDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "AI service failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Flashcards could not be saved",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GenerationRequestWithFlashcardsDto> create(
            Authentication authentication,
            @Valid @RequestBody CreateGenerationRequestRequest request
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        String sourceText = SourceTextPolicy.normalize(request.sourceText());

        RateLimitEntry window = rateLimitService.check(userId.toString(), RATE_LIMIT_RESOURCE);
        log.info("Processing generation request for user {} ({} characters)", userId, sourceText.length());

        List<FlashcardDraft> drafts = draftGenerator.generate(sourceText);
        GenerationRequestWithFlashcardsDto result = generationRequestService.create(userId, sourceText, drafts);

        return ResponseEntity.status(HttpStatus.CREATED)
                .headers(rateLimitHeaders(userId, window))
                .body(result);
    }

    @GetMapping
    @Operation(summary = "List generation requests", description = "Each entry carries the number of flashcards still linked to it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of generation requests"),
            @ApiResponse(responseCode = "400", description = "Invalid sort",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Page<GenerationRequestSummaryDto>> list(
            Authentication authentication,
            @ParameterObject @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(generationRequestService.list(userId, pageable));
    }

    @GetMapping("/{generationRequestId}")
    @Operation(summary = "Get a generation request with its flashcards")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Generation request"),
            @ApiResponse(responseCode = "404", description = "Generation request not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GenerationRequestWithFlashcardsDto> get(
            Authentication authentication,
            @PathVariable UUID generationRequestId
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(generationRequestService.get(userId, generationRequestId));
    }

    @DeleteMapping("/{generationRequestId}")
    @Operation(summary = "Delete a generation request", description = "Its flashcards are kept and unlinked.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Generation request deleted"),
            @ApiResponse(responseCode = "404", description = "Generation request not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Void> delete(
            Authentication authentication,
            @PathVariable UUID generationRequestId
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        generationRequestService.delete(userId, generationRequestId);
        return ResponseEntity.noContent().build();
    }

    private HttpHeaders rateLimitHeaders(UUID userId, RateLimitEntry window) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-RateLimit-Limit", String.valueOf(rateLimitService.getLimit(RATE_LIMIT_RESOURCE)));
        headers.set("X-RateLimit-Remaining",
                String.valueOf(rateLimitService.getRemaining(userId.toString(), RATE_LIMIT_RESOURCE)));
        headers.set("X-RateLimit-Reset", String.valueOf(window.resetAt().getEpochSecond()));
        return headers;
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
