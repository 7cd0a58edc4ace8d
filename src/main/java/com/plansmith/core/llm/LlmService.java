package com.plansmith.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link GenerationProvider} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Returns the raw reply text. Decoding it is left to the callers, which treat an
 * undecodable reply as a recoverable parse failure rather than an error.
 */
@Service
public class LlmService implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI-compatible base-url: {}", baseUrl);
    }

    @Override
    public String invoke(String systemInstruction, String userInstruction) {
        log.info("LLM call started ({} chars of user instruction)", userInstruction.length());
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemInstruction)
                .user(userInstruction)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            log.warn("LLM returned empty content");
            return "";
        }
        log.debug("Raw LLM response: {}", response);
        return response.strip();
    }
}
