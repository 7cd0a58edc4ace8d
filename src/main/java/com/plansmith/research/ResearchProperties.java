package com.plansmith.research;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Controls the research stage that runs after the plan is finalized.
 */
@Component
@ConfigurationProperties(prefix = "plansmith.research")
public class ResearchProperties {

    private boolean enabled = true;
    private int maxQueries = 5;
    private int resultsPerQuery = 3;
    private int maxSources = 8;
    private int summaryInputChars = 4000;
    private int fallbackChars = 500;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxQueries() {
        return maxQueries;
    }

    public void setMaxQueries(int maxQueries) {
        this.maxQueries = maxQueries;
    }

    public int getResultsPerQuery() {
        return resultsPerQuery;
    }

    public void setResultsPerQuery(int resultsPerQuery) {
        this.resultsPerQuery = resultsPerQuery;
    }

    public int getMaxSources() {
        return maxSources;
    }

    public void setMaxSources(int maxSources) {
        this.maxSources = maxSources;
    }

    public int getSummaryInputChars() {
        return summaryInputChars;
    }

    public void setSummaryInputChars(int summaryInputChars) {
        this.summaryInputChars = summaryInputChars;
    }

    public int getFallbackChars() {
        return fallbackChars;
    }

    public void setFallbackChars(int fallbackChars) {
        this.fallbackChars = fallbackChars;
    }
}
