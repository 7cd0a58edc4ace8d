package com.plansmith.research;

import java.io.Serializable;

/**
 * One ranked web search hit with the readable text extracted from its page.
 *
 * @param title   page title reported by the search provider
 * @param url     page URL
 * @param snippet provider-supplied summary
 * @param text    extracted page text, empty when the page could not be fetched
 * @param score   provider relevance score
 */
public record SearchResult(
    String title,
    String url,
    String snippet,
    String text,
    double score
) implements Serializable {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
