package com.plansmith.research;

import java.util.List;

/**
 * Capability for web search with page text extraction.
 */
@FunctionalInterface
public interface SearchProvider {

    /**
     * @param query free-text query
     * @param count maximum number of results wanted
     * @return results ordered best first; may hold fewer than {@code count} entries
     *         and entries without extracted text
     * @throws SearchProviderException when the provider cannot be reached or rejects the request
     */
    List<SearchResult> search(String query, int count);
}
