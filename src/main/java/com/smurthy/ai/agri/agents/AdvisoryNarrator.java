package com.smurthy.ai.agri.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Turns a specialist's structured findings into a short farmer-facing advisory using the
 * configured chat model.
 *
 * Only created when {@code advisor.llm.enabled=true}. Narration is best effort: any model
 * failure is logged and the specialist answers with its structured data alone.
 */
@Component
@ConditionalOnProperty(name = "advisor.llm.enabled", havingValue = "true")
public class AdvisoryNarrator {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryNarrator.class);

    private static final String SYSTEM_PROMPT = """
            You are an agricultural extension officer advising Indian farmers.

            RULES:
            - Use only the facts provided, never invent numbers
            - At most 4 short sentences
            - Plain words a smallholder farmer understands
            - Answer in the requested language
            """;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public AdvisoryNarrator(ChatClient.Builder chatClientBuilder, ObjectMapper objectMapper) {
        this.chatClient = chatClientBuilder
                .defaultSystem(SYSTEM_PROMPT)
                .build();
        this.objectMapper = objectMapper;
        log.info("AdvisoryNarrator initialized");
    }

    public Optional<String> narrate(Category category, Language language, String question,
                                    Map<String, Object> facts) {
        long startTime = System.currentTimeMillis();
        try {
            String prompt = """
                    Topic: %s
                    Language: %s
                    Farmer's question: %s
                    Facts (JSON): %s
                    """.formatted(category.key(), language.displayName(), question,
                    objectMapper.writeValueAsString(facts));

            String content = chatClient.prompt()
                    .user(prompt)
                    .call()
                    .content();

            log.debug("[AdvisoryNarrator] {} advisory in {}ms", category.key(),
                    System.currentTimeMillis() - startTime);
            return Optional.ofNullable(content).filter(text -> !text.isBlank());

        } catch (JsonProcessingException e) {
            log.warn("[AdvisoryNarrator] Could not serialize {} facts: {}", category.key(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[AdvisoryNarrator] Narration failed for {} after {}ms: {}", category.key(),
                    System.currentTimeMillis() - startTime, e.getMessage());
            return Optional.empty();
        }
    }
}
