package uk.gegc.flashcards.features.study.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.flashcards.features.flashcard.api.dto.FlashcardDto;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardSource;
import uk.gegc.flashcards.features.flashcard.domain.model.FlashcardStatus;
import uk.gegc.flashcards.features.study.api.dto.StudySessionDto;
import uk.gegc.flashcards.features.study.api.dto.StudySessionInfo;
import uk.gegc.flashcards.features.study.application.StudySessionService;
import uk.gegc.flashcards.shared.exception.InvalidFlashcardStateException;
import uk.gegc.flashcards.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StudySessionController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("StudySessionController Tests")
class StudySessionControllerTest {

    private static final String USER = "10000000-0000-0000-0000-000000000001";
    private static final UUID USER_ID = UUID.fromString(USER);
    private static final UUID CARD_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");
    private static final Instant NEXT_REVIEW = Instant.parse("2025-03-07T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StudySessionService studySessionService;

    private static FlashcardDto activeCard(int intervalDays, double ease) {
        return new FlashcardDto(CARD_ID, null, "Q", "A", FlashcardSource.MANUAL, FlashcardStatus.ACTIVE,
                intervalDays, ease, NEXT_REVIEW, null, null);
    }

    @Test
    @DisplayName("GET /api/v1/study-sessions/current: defaults limit to 20")
    @WithMockUser(username = USER)
    void currentSession_defaultLimit() throws Exception {
        when(studySessionService.getCurrentSession(USER_ID, 20))
                .thenReturn(new StudySessionDto(new StudySessionInfo(42, 1), List.of(activeCard(0, 2.5))));

        mockMvc.perform(get("/api/v1/study-sessions/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session.flashcardsDue").value(42))
                .andExpect(jsonPath("$.session.flashcardsInSession").value(1))
                .andExpect(jsonPath("$.flashcards[0].id").value(CARD_ID.toString()));
    }

    @Test
    @DisplayName("GET /api/v1/study-sessions/current: limit above 50 returns 400")
    @WithMockUser(username = USER)
    void currentSession_limitTooHigh() throws Exception {
        mockMvc.perform(get("/api/v1/study-sessions/current").param("limit", "51"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(studySessionService);
    }

    @Test
    @DisplayName("POST /api/v1/study-sessions/review: returns the rescheduled card")
    @WithMockUser(username = USER)
    void review_returns200() throws Exception {
        when(studySessionService.submitReview(USER_ID, CARD_ID, 5)).thenReturn(activeCard(6, 2.6));

        mockMvc.perform(post("/api/v1/study-sessions/review")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flashcardId\":\"" + CARD_ID + "\",\"quality\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intervalDays").value(6))
                .andExpect(jsonPath("$.easeFactor").value(2.6));
    }

    @Test
    @DisplayName("POST /api/v1/study-sessions/review: quality 6 returns 400")
    @WithMockUser(username = USER)
    void review_qualityOutOfRange() throws Exception {
        mockMvc.perform(post("/api/v1/study-sessions/review")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flashcardId\":\"" + CARD_ID + "\",\"quality\":6}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(studySessionService);
    }

    @Test
    @DisplayName("POST /api/v1/study-sessions/review: pending card returns 409")
    @WithMockUser(username = USER)
    void review_pendingCard_returns409() throws Exception {
        when(studySessionService.submitReview(any(), any(), anyInt()))
                .thenThrow(new InvalidFlashcardStateException("Flashcard is not in active status", FlashcardStatus.PENDING_REVIEW));

        mockMvc.perform(post("/api/v1/study-sessions/review")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flashcardId\":\"" + CARD_ID + "\",\"quality\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("pending_review"));
    }
}
