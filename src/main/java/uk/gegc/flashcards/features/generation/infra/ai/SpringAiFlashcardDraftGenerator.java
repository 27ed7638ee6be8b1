package uk.gegc.flashcards.features.generation.infra.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;
import uk.gegc.flashcards.features.flashcard.domain.model.Flashcard;
import uk.gegc.flashcards.features.generation.application.FlashcardDraft;
import uk.gegc.flashcards.features.generation.application.FlashcardDraftGenerator;
import uk.gegc.flashcards.features.generation.application.GenerationMetricsService;
import uk.gegc.flashcards.features.generation.config.FlashcardGenerationProperties;
import uk.gegc.flashcards.shared.config.AiRateLimitConfig;
import uk.gegc.flashcards.shared.exception.AiServiceException;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat-model backed draft source. Asks for structured JSON, retries with exponential backoff
 * and keeps only drafts that fit the flashcard limits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiFlashcardDraftGenerator implements FlashcardDraftGenerator {

    private final ChatModel chatModel;
    private final AiRateLimitConfig rateLimitConfig;
    private final FlashcardGenerationProperties generationProperties;
    private final GenerationMetricsService metricsService;

    @Override
    public List<FlashcardDraft> generate(String sourceText) {
        log.info("Generating flashcards via AI for {} characters using model: {}",
                sourceText.length(), generationProperties.getModel());

        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (retryCount < maxRetries) {
            try {
                BeanOutputConverter<FlashcardDraftsResponse> outputConverter =
                        new BeanOutputConverter<>(FlashcardDraftsResponse.class);

                Prompt prompt = new Prompt(
                        List.of(
                                new SystemMessage(buildSystemMessage()),
                                new UserMessage(buildUserMessage(sourceText) + "\n\n" + outputConverter.getFormat())
                        ),
                        ChatOptions.builder()
                                .model(generationProperties.getModel())
                                .temperature(generationProperties.getTemperature())
                                .build()
                );

                ChatResponse chatResponse = chatModel.call(prompt);
                if (chatResponse == null || chatResponse.getResult() == null) {
                    throw new AiServiceException("No response received from AI service");
                }
                String aiResponseText = chatResponse.getResult().getOutput().getText();
                log.debug("AI response received ({} characters)", aiResponseText != null ? aiResponseText.length() : 0);

                FlashcardDraftsResponse response = outputConverter.convert(aiResponseText);
                if (response == null || response.flashcards() == null) {
                    throw new AiServiceException("No structured response received from AI service");
                }

                List<FlashcardDraft> drafts = usableDrafts(response.flashcards());
                log.info("Successfully generated {} flashcards", drafts.size());
                return drafts;

            } catch (Exception e) {
                retryCount++;
                if (retryCount >= maxRetries) {
                    metricsService.incrementAiFailure();
                    if (e instanceof AiServiceException aiServiceException) {
                        throw aiServiceException;
                    }
                    throw new AiServiceException("Failed to generate flashcards after " + maxRetries + " attempts", e);
                }

                log.warn("Flashcard generation attempt {} failed, retrying: {}", retryCount, e.getMessage());

                try {
                    sleepBeforeRetry(calculateBackoffDelay(retryCount));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new AiServiceException("Flashcard generation interrupted", ie);
                }
            }
        }

        throw new AiServiceException("Unexpected error: exceeded retry loop");
    }

    private List<FlashcardDraft> usableDrafts(List<FlashcardDraft> candidates) {
        List<FlashcardDraft> drafts = new ArrayList<>();
        int discarded = 0;
        for (FlashcardDraft candidate : candidates) {
            if (candidate == null || !fits(candidate.front(), Flashcard.FRONT_MAX_LENGTH)
                    || !fits(candidate.back(), Flashcard.BACK_MAX_LENGTH)) {
                discarded++;
                continue;
            }
            if (drafts.size() < generationProperties.getMaxFlashcards()) {
                drafts.add(new FlashcardDraft(candidate.front().trim(), candidate.back().trim()));
            } else {
                discarded++;
            }
        }

        if (discarded > 0) {
            log.warn("Discarded {} of {} AI drafts", discarded, candidates.size());
            metricsService.incrementDraftsDiscarded(discarded);
        }
        if (drafts.isEmpty()) {
            throw new AiServiceException("AI service returned no usable flashcards");
        }
        if (drafts.size() < generationProperties.getMinFlashcards()) {
            log.warn("AI returned only {} usable flashcards (expected at least {})",
                    drafts.size(), generationProperties.getMinFlashcards());
        }
        return drafts;
    }

    private static boolean fits(String value, int maxLength) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return !trimmed.isEmpty() && trimmed.length() <= maxLength;
    }

    protected void sleepBeforeRetry(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    private long calculateBackoffDelay(int retryCount) {
        long baseDelay = rateLimitConfig.getBaseDelayMs();
        long maxDelay = rateLimitConfig.getMaxDelayMs();
        double jitterFactor = rateLimitConfig.getJitterFactor();

        // Exponential backoff with jitter
        long delay = Math.min(baseDelay * (1L << retryCount), maxDelay);
        double jitter = 1.0 + (Math.random() * 2 - 1) * jitterFactor;
        return Math.round(delay * jitter);
    }

    private String buildSystemMessage() {
        return """
                You are an expert educational assistant specializing in creating high-quality flashcards for spaced repetition learning.

                Your task is to:
                - Extract key concepts from the provided text
                - Create clear, focused questions for the front of each card
                - Provide concise, accurate answers for the back
                - Generate between %d and %d flashcards depending on content richness
                """.formatted(generationProperties.getMinFlashcards(), generationProperties.getMaxFlashcards());
    }

    private String buildUserMessage(String sourceText) {
        return """
                Generate educational flashcards from the following text. Each flashcard should focus on a single concept.
                Keep the front under %d characters and the back under %d characters.

                Text to analyze:
                ---
                %s
                ---
                """.formatted(Flashcard.FRONT_MAX_LENGTH, Flashcard.BACK_MAX_LENGTH, sourceText);
    }

    record FlashcardDraftsResponse(List<FlashcardDraft> flashcards) {
    }
}
