package uk.gegc.flashcards.features.generation.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestDto;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestSummaryDto;
import uk.gegc.flashcards.features.generation.api.dto.GenerationRequestWithFlashcardsDto;
import uk.gegc.flashcards.features.generation.application.FlashcardDraft;
import uk.gegc.flashcards.features.generation.application.FlashcardDraftGenerator;
import uk.gegc.flashcards.features.generation.application.GenerationRequestService;
import uk.gegc.flashcards.shared.exception.AiServiceException;
import uk.gegc.flashcards.shared.exception.FlashcardPersistenceException;
import uk.gegc.flashcards.shared.exception.RateLimitExceededException;
import uk.gegc.flashcards.shared.exception.ResourceNotFoundException;
import uk.gegc.flashcards.shared.rate_limit.RateLimitEntry;
import uk.gegc.flashcards.shared.rate_limit.RateLimitService;
import uk.gegc.flashcards.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GenerationRequestController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("GenerationRequestController Tests")
class GenerationRequestControllerTest {

    private static final String USER = "10000000-0000-0000-0000-000000000001";
    private static final UUID USER_ID = UUID.fromString(USER);
    private static final UUID REQUEST_ID = UUID.fromString("30000000-0000-0000-0000-000000000003");
    private static final UUID CARD_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");
    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
    private static final Instant RESET_AT = Instant.parse("2025-06-01T11:00:00Z");
    private static final String SOURCE_TEXT = "Mitochondria are the powerhouse of the cell. ".repeat(30).trim();

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GenerationRequestService generationRequestService;

    @MockitoBean
    private FlashcardDraftGenerator draftGenerator;

    @MockitoBean
    private RateLimitService rateLimitService;

    private static String body(String sourceText) {
        return "{\"sourceText\":\"" + sourceText + "\"}";
    }

    private static GenerationRequestWithFlashcardsDto created() {
        return new GenerationRequestWithFlashcardsDto(
                new GenerationRequestDto(REQUEST_ID, SOURCE_TEXT, NOW, NOW),
                List.of(new FlashcardDto(CARD_ID, REQUEST_ID, "Q", "A", FlashcardSource.AI_GENERATED,
                        FlashcardStatus.PENDING_REVIEW, 0, 2.5, null, NOW, NOW)));
    }

    @Test
    @DisplayName("POST /api/v1/generation-requests: returns 201 with pending cards and rate-limit headers")
    @WithMockUser(username = USER)
    void create_returns201() throws Exception {
        List<FlashcardDraft> drafts = List.of(new FlashcardDraft("Q", "A"));
        when(rateLimitService.check(USER, "generation-requests")).thenReturn(new RateLimitEntry(3, RESET_AT));
        when(rateLimitService.getLimit("generation-requests")).thenReturn(10);
        when(rateLimitService.getRemaining(USER, "generation-requests")).thenReturn(7);
        when(draftGenerator.generate(SOURCE_TEXT)).thenReturn(drafts);
        when(generationRequestService.create(USER_ID, SOURCE_TEXT, drafts)).thenReturn(created());

        mockMvc.perform(post("/api/v1/generation-requests")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(SOURCE_TEXT)))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-RateLimit-Limit", "10"))
                .andExpect(header().string("X-RateLimit-Remaining", "7"))
                .andExpect(header().string("X-RateLimit-Reset", String.valueOf(RESET_AT.getEpochSecond())))
                .andExpect(jsonPath("$.generationRequest.id").value(REQUEST_ID.toString()))
                .andExpect(jsonPath("$.flashcards[0].status").value("pending_review"))
                .andExpect(jsonPath("$.flashcards[0].source").value("ai_generated"));
    }

    @Test
    @DisplayName("POST /api/v1/generation-requests: short source text returns 400 without using rate budget")
    @WithMockUser(username = USER)
    void create_shortSource_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/generation-requests")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("too short")))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(rateLimitService, draftGenerator, generationRequestService);
    }

    @Test
    @DisplayName("POST /api/v1/generation-requests: exhausted budget returns 429 with Retry-After")
    @WithMockUser(username = USER)
    void create_rateLimited_returns429() throws Exception {
        when(rateLimitService.check(anyString(), eq("generation-requests")))
                .thenThrow(new RateLimitExceededException("Rate limit exceeded", RESET_AT, 1800));

        mockMvc.perform(post("/api/v1/generation-requests")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(SOURCE_TEXT)))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "1800"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(1800));

        verifyNoInteractions(draftGenerator, generationRequestService);
    }

    @Test
    @DisplayName("POST /api/v1/generation-requests: AI failure returns 422 and stores nothing")
    @WithMockUser(username = USER)
    void create_aiFailure_returns422() throws Exception {
        when(rateLimitService.check(USER, "generation-requests")).thenReturn(new RateLimitEntry(1, RESET_AT));
        when(draftGenerator.generate(any())).thenThrow(new AiServiceException("AI service returned no usable flashcards"));

        mockMvc.perform(post("/api/v1/generation-requests")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(SOURCE_TEXT)))
                .andExpect(status().isUnprocessableEntity());

        verifyNoInteractions(generationRequestService);
    }

    @Test
    @DisplayName("POST /api/v1/generation-requests: persistence failure returns 500")
    @WithMockUser(username = USER)
    void create_persistenceFailure_returns500() throws Exception {
        when(rateLimitService.check(USER, "generation-requests")).thenReturn(new RateLimitEntry(1, RESET_AT));
        when(draftGenerator.generate(any())).thenReturn(List.of(new FlashcardDraft("Q", "A")));
        when(generationRequestService.create(eq(USER_ID), any(), any()))
                .thenThrow(new FlashcardPersistenceException("Failed to create flashcards", new RuntimeException("db")));

        mockMvc.perform(post("/api/v1/generation-requests")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(SOURCE_TEXT)))
                .andExpect(status().isInternalServerError());
    }

    @Test
    @DisplayName("GET /api/v1/generation-requests: returns summaries with flashcard counts")
    @WithMockUser(username = USER)
    void list_returns200() throws Exception {
        when(generationRequestService.list(eq(USER_ID), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(new GenerationRequestSummaryDto(REQUEST_ID, SOURCE_TEXT, 4, NOW, NOW)),
                        PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/generation-requests"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].flashcardsCount").value(4));
    }

    @Test
    @DisplayName("GET /api/v1/generation-requests/{id}: unknown request returns 404")
    @WithMockUser(username = USER)
    void get_notFound_returns404() throws Exception {
        when(generationRequestService.get(USER_ID, REQUEST_ID))
                .thenThrow(new ResourceNotFoundException("Generation request " + REQUEST_ID + " not found"));

        mockMvc.perform(get("/api/v1/generation-requests/{id}", REQUEST_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /api/v1/generation-requests/{id}: returns 204")
    @WithMockUser(username = USER)
    void delete_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/generation-requests/{id}", REQUEST_ID).with(csrf()))
                .andExpect(status().isNoContent());

        verify(generationRequestService).delete(USER_ID, REQUEST_ID);
    }
}
