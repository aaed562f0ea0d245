package io.buildqueue4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildqueue4j.BuildQueue;
import io.buildqueue4j.report.BuildSummary;

import java.util.Map;

/**
 * Renders the queue's current results for web or CLI consumers.
 */
public class BuildSummaryPublisher {

    private final BuildQueue buildQueue;
    private final ObjectMapper objectMapper;

    public BuildSummaryPublisher(BuildQueue buildQueue, ObjectMapper objectMapper) {
        this.buildQueue = buildQueue;
        this.objectMapper = objectMapper;
    }

    public BuildSummary summary() {
        return BuildSummary.of(buildQueue.getResults());
    }

    public Map<String, Object> summaryAsMap() {
        return summary().toMap(objectMapper);
    }

    public String summaryAsJson() {
        return summary().toJson(objectMapper);
    }
}
