package com.plansmith.research;

import com.plansmith.core.llm.GenerationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Condenses one search result into a short factual summary for the research synthesis prompt.
 * <p>
 * When the LLM call fails or returns nothing, the provider snippet (or the page text when
 * there is no snippet) cut to {@link ResearchProperties#getFallbackChars()} stands in.
 */
@Component
public class SourceSummarizer {

    private static final Logger log = LoggerFactory.getLogger(SourceSummarizer.class);

    static final String SYSTEM_PROMPT = """
            You are the Source Summarizer Agent. Summarize the source text in 4-6 factual sentences.
            Do NOT add info not present in the text.
            """;

    private final GenerationProvider generationProvider;
    private final ResearchProperties properties;

    public SourceSummarizer(GenerationProvider generationProvider, ResearchProperties properties) {
        this.generationProvider = generationProvider;
        this.properties = properties;
    }

    public String summarize(SearchResult source) {
        String summary;
        try {
            summary = generationProvider.invoke(SYSTEM_PROMPT, buildUserPrompt(source));
        } catch (RuntimeException e) {
            log.warn("Summary of {} failed, using snippet instead: {}", source.url(), e.getMessage());
            return fallback(source);
        }
        if (summary == null || summary.isBlank()) {
            log.warn("Summary of {} was empty, using snippet instead", source.url());
            return fallback(source);
        }
        return summary.strip();
    }

    String buildUserPrompt(SearchResult source) {
        return "TITLE: " + source.title() + "\n"
                + "URL: " + source.url() + "\n"
                + "TEXT:\n" + truncate(nullToEmpty(source.text()), properties.getSummaryInputChars());
    }

    String fallback(SearchResult source) {
        String snippet = nullToEmpty(source.snippet());
        String basis = snippet.isBlank() ? nullToEmpty(source.text()) : snippet;
        return truncate(basis, properties.getFallbackChars());
    }

    private static String truncate(String value, int maxChars) {
        return value.length() > maxChars ? value.substring(0, maxChars) : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
