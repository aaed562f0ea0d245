package io.buildqueue4j.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildqueue4j.core.JobResult;
import io.buildqueue4j.core.JobStatus;
import io.buildqueue4j.utils.Durations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated view of a batch of settled jobs, in settlement order.
 */
public record BuildSummary(
        int total,
        int fulfilled,
        int rejected,
        long totalDurationMillis,
        List<Entry> entries
) {

    public static final int DEFAULT_LOG_TAIL = 10;

    public BuildSummary {
        entries = (entries == null) ? List.of() : List.copyOf(entries);
    }

    /**
     * One line per job.
     *
     * <p>logTail holds the last log lines of a failed job; empty for fulfilled jobs.
     */
    public record Entry(
            String name,
            JobStatus status,
            long durationMillis,
            String line,
            String error,
            List<String> logTail
    ) {
        public Entry {
            logTail = (logTail == null) ? List.of() : List.copyOf(logTail);
        }
    }

    public static BuildSummary of(List<JobResult> results) {
        return of(results, DEFAULT_LOG_TAIL);
    }

    public static BuildSummary of(List<JobResult> results, int logTail) {
        Objects.requireNonNull(results, "results must not be null");
        if (logTail < 0) {
            throw new IllegalArgumentException("logTail must not be negative");
        }

        int fulfilled = 0;
        int rejected = 0;
        long totalMillis = 0;
        List<Entry> entries = new ArrayList<>(results.size());

        for (JobResult r : results) {
            Duration duration = r.duration();
            totalMillis += Durations.toMillis(duration);
            String seconds = Durations.toSeconds(duration == null ? Duration.ZERO : duration);

            if (r.isFulfilled()) {
                fulfilled++;
                entries.add(new Entry(r.name(), JobStatus.FULFILLED, Durations.toMillis(duration),
                        r.name() + " built in " + seconds + ".", null, List.of()));
            } else {
                rejected++;
                List<String> logs = r.logs();
                List<String> tail = logs.subList(Math.max(0, logs.size() - logTail), logs.size());
                String error = (r.error() == null) ? null : r.error().getMessage();
                entries.add(new Entry(r.name(), JobStatus.REJECTED, Durations.toMillis(duration),
                        r.name() + " build failed after " + seconds + ".", error, tail));
            }
        }

        return new BuildSummary(results.size(), fulfilled, rejected, totalMillis, entries);
    }

    public boolean allFulfilled() {
        return rejected == 0;
    }

    public List<Entry> failures() {
        return entries.stream()
                .filter(e -> e.status() == JobStatus.REJECTED)
                .toList();
    }

    public Map<String, Object> toMap(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        return objectMapper.convertValue(this, new TypeReference<>() {
        });
    }

    public String toJson(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize build summary", e);
        }
    }
}
