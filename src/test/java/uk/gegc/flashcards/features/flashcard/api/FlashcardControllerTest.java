package uk.gegc.flashcards.features.flashcard.api;

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
import uk.gegc.flashcards.features.flashcard.api.dto.CreateFlashcardRequest;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.application.FlashcardService;
import uk.gegc.flashcards.features.flashcard.application.dto.BatchApproveFailure;
import uk.gegc.flashcards.features.flashcard.application.dto.BatchApproveResult;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.shared.exception.InvalidFlashcardStateException;
import uk.gegc.flashcards.shared.exception.ResourceNotFoundException;
import uk.gegc.flashcards.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FlashcardController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("FlashcardController Tests")
class FlashcardControllerTest {

    private static final String USER = "10000000-0000-0000-0000-000000000001";
    private static final UUID USER_ID = UUID.fromString(USER);
    private static final UUID CARD_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FlashcardService flashcardService;

    private static FlashcardDto dto(FlashcardStatus status, FlashcardSource source) {
        return new FlashcardDto(CARD_ID, null, "Q", "A", source, status, 0, 2.5,
                status == FlashcardStatus.ACTIVE ? NOW : null, NOW, NOW);
    }

    @Test
    @DisplayName("POST /api/v1/flashcards: creates an active manual card and returns 201")
    @WithMockUser(username = USER)
    void create_returns201() throws Exception {
        when(flashcardService.createManual(eq(USER_ID), any(CreateFlashcardRequest.class)))
                .thenReturn(dto(FlashcardStatus.ACTIVE, FlashcardSource.MANUAL));

        mockMvc.perform(post("/api/v1/flashcards")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\":\"Q\",\"back\":\"A\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(CARD_ID.toString()))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.source").value("manual"))
                .andExpect(jsonPath("$.easeFactor").value(2.5))
                .andExpect(jsonPath("$.intervalDays").value(0));
    }

    @Test
    @DisplayName("POST /api/v1/flashcards: blank front returns 400")
    @WithMockUser(username = USER)
    void create_blankFront_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/flashcards")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\":\"\",\"back\":\"A\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(flashcardService);
    }

    @Test
    @DisplayName("POST /api/v1/flashcards: back over 2000 characters returns 400")
    @WithMockUser(username = USER)
    void create_backTooLong_returns400() throws Exception {
        String back = "b".repeat(2001);

        mockMvc.perform(post("/api/v1/flashcards")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\":\"Q\",\"back\":\"" + back + "\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/v1/flashcards: unauthenticated returns 401")
    void create_unauthenticated_returns401() throws Exception {
        mockMvc.perform(post("/api/v1/flashcards")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"front\":\"Q\",\"back\":\"A\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET /api/v1/flashcards: passes parsed filters to the service")
    @WithMockUser(username = USER)
    void list_withFilters() throws Exception {
        when(flashcardService.list(eq(USER_ID), eq(FlashcardStatus.PENDING_REVIEW), isNull(), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(dto(FlashcardStatus.PENDING_REVIEW, FlashcardSource.AI_GENERATED)),
                        PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/flashcards").param("status", "pending_review"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].status").value("pending_review"))
                .andExpect(jsonPath("$.content[0].nextReviewAt").isEmpty());
    }

    @Test
    @DisplayName("GET /api/v1/flashcards: unknown status filter returns 400")
    @WithMockUser(username = USER)
    void list_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/flashcards").param("status", "archived"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(flashcardService);
    }

    @Test
    @DisplayName("GET /api/v1/flashcards/{id}: foreign card returns 404")
    @WithMockUser(username = USER)
    void get_notFound_returns404() throws Exception {
        when(flashcardService.get(USER_ID, CARD_ID))
                .thenThrow(new ResourceNotFoundException("Flashcard " + CARD_ID + " not found"));

        mockMvc.perform(get("/api/v1/flashcards/{id}", CARD_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Flashcard " + CARD_ID + " not found"));
    }

    @Test
    @DisplayName("PATCH /api/v1/flashcards/{id}: empty body returns 400")
    @WithMockUser(username = USER)
    void update_emptyBody_returns400() throws Exception {
        mockMvc.perform(patch("/api/v1/flashcards/{id}", CARD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(flashcardService);
    }

    @Test
    @DisplayName("PATCH /api/v1/flashcards/{id}: refused status change returns 409 with current status")
    @WithMockUser(username = USER)
    void update_invalidTransition_returns409() throws Exception {
        when(flashcardService.update(eq(USER_ID), eq(CARD_ID), any()))
                .thenThrow(new InvalidFlashcardStateException(
                        "Flashcard cannot be moved back to pending_review status", FlashcardStatus.ACTIVE));

        mockMvc.perform(patch("/api/v1/flashcards/{id}", CARD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"pending_review\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("active"));
    }

    @Test
    @DisplayName("DELETE /api/v1/flashcards/{id}: returns 204")
    @WithMockUser(username = USER)
    void delete_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/flashcards/{id}", CARD_ID).with(csrf()))
                .andExpect(status().isNoContent());

        verify(flashcardService).delete(USER_ID, CARD_ID);
    }

    @Test
    @DisplayName("POST /api/v1/flashcards/{id}/approve: returns the activated card")
    @WithMockUser(username = USER)
    void approve_returns200() throws Exception {
        when(flashcardService.approve(USER_ID, CARD_ID)).thenReturn(dto(FlashcardStatus.ACTIVE, FlashcardSource.AI_GENERATED));

        mockMvc.perform(post("/api/v1/flashcards/{id}/approve", CARD_ID).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.nextReviewAt").exists());
    }

    @Test
    @DisplayName("POST /api/v1/flashcards/{id}/reject: active card returns 409")
    @WithMockUser(username = USER)
    void reject_active_returns409() throws Exception {
        when(flashcardService.reject(USER_ID, CARD_ID))
                .thenThrow(new InvalidFlashcardStateException("Flashcard is not in pending_review status", FlashcardStatus.ACTIVE));

        mockMvc.perform(post("/api/v1/flashcards/{id}/reject", CARD_ID).with(csrf()))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /api/v1/flashcards/batch-approve: returns approved and failed ids")
    @WithMockUser(username = USER)
    void batchApprove_returns200() throws Exception {
        UUID missing = UUID.fromString("30000000-0000-0000-0000-000000000003");
        when(flashcardService.batchApprove(USER_ID, List.of(CARD_ID, missing)))
                .thenReturn(new BatchApproveResult(List.of(CARD_ID),
                        List.of(new BatchApproveFailure(missing, "Flashcard " + missing + " not found"))));

        mockMvc.perform(post("/api/v1/flashcards/batch-approve")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flashcardIds\":[\"" + CARD_ID + "\",\"" + missing + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved[0]").value(CARD_ID.toString()))
                .andExpect(jsonPath("$.failed[0].id").value(missing.toString()))
                .andExpect(jsonPath("$.failed[0].reason").value("Flashcard " + missing + " not found"));
    }

    @Test
    @DisplayName("POST /api/v1/flashcards/batch-approve: empty list returns 400")
    @WithMockUser(username = USER)
    void batchApprove_empty_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/flashcards/batch-approve")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flashcardIds\":[]}"))
                .andExpect(status().isBadRequest());
    }
}
