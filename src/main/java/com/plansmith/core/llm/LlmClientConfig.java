package com.plansmith.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Applies request-level timeouts to the {@code RestClient} that Spring AI uses
 * for chat completion calls.
 */
@Configuration
public class LlmClientConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmClientConfig.class);

    @Bean
    RestClientCustomizer llmTimeoutCustomizer(LlmProperties properties) {
        log.info("LLM HTTP timeouts: connect={}, read={}",
                properties.getConnectTimeout(), properties.getReadTimeout());
        return builder -> {
            var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(properties.getConnectTimeout());
            requestFactory.setReadTimeout(properties.getReadTimeout());
            builder.requestFactory(requestFactory);
        };
    }
}
