package com.plansmith.research;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Fetches a page and reduces it to readable body text.
 * <p>
 * Pages that cannot be fetched yield an empty string; the research stage drops
 * results without text.
 */
@Component
public class PageTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PageTextExtractor.class);

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; Plansmith/0.1)";

    public String fetchText(String url, Duration timeout, int maxChars) {
        try {
            Document doc = Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .timeout((int) timeout.toMillis())
                    .get();
            return extract(doc, maxChars);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Could not fetch {}: {}", url, e.getMessage());
            return "";
        }
    }

    /**
     * Body text without scripts and styles, whitespace collapsed, cut to {@code maxChars}.
     */
    public String extract(Document doc, int maxChars) {
        doc.select("script, style, noscript").remove();
        String text = doc.body() != null ? doc.body().text() : doc.text();
        text = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
