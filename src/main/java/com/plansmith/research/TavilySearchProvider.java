package com.plansmith.research;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link SearchProvider} backed by the Tavily search API.
 *
 * <p>Asks Tavily for twice the wanted number of hits, fetches each page's text
 * with {@link PageTextExtractor} (pausing between fetches), then keeps the best
 * {@code count} results ranked by score and extracted text length.
 */
@Component
public class TavilySearchProvider implements SearchProvider {

    private static final Logger log = LoggerFactory.getLogger(TavilySearchProvider.class);

    private final SearchProperties properties;
    private final PageTextExtractor extractor;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TavilySearchProvider(SearchProperties properties, PageTextExtractor extractor) {
        this.properties = properties;
        this.extractor = extractor;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getRequestTimeout())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<SearchResult> search(String query, int count) {
        List<SearchResult> hits = queryTavily(query, count * 2);
        log.info("Tavily returned {} hit(s) for '{}'", hits.size(), query);

        List<SearchResult> enriched = new ArrayList<>();
        for (int i = 0; i < hits.size(); i++) {
            if (i > 0) {
                pause();
            }
            SearchResult hit = hits.get(i);
            String text = extractor.fetchText(hit.url(), properties.getFetchTimeout(), properties.getMaxTextChars());
            enriched.add(new SearchResult(hit.title(), hit.url(), hit.snippet(), text, hit.score()));
        }

        return rerank(enriched, count);
    }

    /**
     * Orders by provider score, then by extracted text length, both descending.
     */
    static List<SearchResult> rerank(List<SearchResult> results, int topK) {
        return results.stream()
                .sorted(Comparator.comparingDouble(SearchResult::score)
                        .thenComparingInt(r -> r.text() == null ? 0 : r.text().length())
                        .reversed())
                .limit(Math.max(0, topK))
                .toList();
    }

    private List<SearchResult> queryTavily(String query, int maxResults) {
        if (!properties.hasApiKey()) {
            throw new SearchProviderException("Tavily API key is not set (plansmith.search.api-key / TAVILY_API_KEY)");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("api_key", properties.getApiKey());
        body.put("query", query);
        body.put("search_depth", "advanced");
        body.put("max_results", maxResults);
        body.put("include_answer", false);
        body.put("include_images", false);
        body.put("include_raw_content", false);

        var request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + "/search"))
                .header("Content-Type", "application/json")
                .timeout(properties.getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                throw new SearchProviderException("Tavily search failed: HTTP " + response.statusCode()
                        + " - " + response.body());
            }
            return parseResults(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new SearchProviderException("Tavily search request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchProviderException("Interrupted during Tavily search", e);
        }
    }

    private List<SearchResult> parseResults(JsonNode root) {
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode r : root.path("results")) {
            results.add(new SearchResult(
                    r.path("title").asText(""),
                    r.path("url").asText(""),
                    r.path("content").asText(""),
                    "",
                    r.path("score").asDouble(0)));
        }
        return results;
    }

    private void pause() {
        if (properties.getPause().isZero() || properties.getPause().isNegative()) {
            return;
        }
        try {
            Thread.sleep(properties.getPause().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchProviderException("Interrupted between page fetches", e);
        }
    }
}
