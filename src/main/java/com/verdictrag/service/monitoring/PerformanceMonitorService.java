package com.verdictrag.service.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.springframework.stereotype.Service;

import com.verdictrag.config.LegalRagProperties;

import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rolling record of recent query timings, bounded by {@code legal-rag.monitoring.max-query-history}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    public static final String ANSWERED = "answered";
    public static final String UNSUPPORTED = "unsupported";

    private static final int QUERY_PREVIEW = 100;

    private final LegalRagProperties properties;

    @Getter
    private final Deque<QueryRecord> queryHistory = new ConcurrentLinkedDeque<>();

    public void addQuery(String query, QueryTimer timer, String outcome) {
        if (!Boolean.TRUE.equals(properties.getMonitoring().getEnabled())) {
            return;
        }

        QueryRecord record = QueryRecord.builder()
                .timestamp(Instant.now().toString())
                .query(query.length() > QUERY_PREVIEW ? query.substring(0, QUERY_PREVIEW) + "..." : query)
                .outcome(outcome)
                .totalTime(timer.getTotalTime())
                .stepDurations(timer.getStepDurations())
                .build();

        queryHistory.addLast(record);
        int limit = properties.getMonitoring().getMaxQueryHistory();
        while (queryHistory.size() > limit) {
            queryHistory.pollFirst();
        }
        log.debug("Recorded query | outcome={} | total={}s", outcome, record.totalTime());
    }

    /**
     * Aggregate timings over the retained history. Outcomes are {@code answered},
     * {@code unsupported} or a {@link com.verdictrag.dto.response.QueryFailure.Type} name.
     */
    public Map<String, Object> getStatistics() {
        List<QueryRecord> records = new ArrayList<>(queryHistory);
        if (records.isEmpty()) {
            return Map.of("message", "No queries recorded yet");
        }

        Map<String, List<Double>> timingsByStep = new LinkedHashMap<>();
        Map<String, Integer> outcomes = new TreeMap<>();
        List<Double> totals = new ArrayList<>(records.size());
        for (QueryRecord record : records) {
            totals.add(record.totalTime());
            outcomes.merge(record.outcome(), 1, Integer::sum);
            record.stepDurations().forEach((step, seconds) ->
                    timingsByStep.computeIfAbsent(step, k -> new ArrayList<>()).add(seconds));
        }

        int answered = outcomes.getOrDefault(ANSWERED, 0);
        int unsupported = outcomes.getOrDefault(UNSUPPORTED, 0);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalQueries", records.size());
        stats.put("answeredRate", ratio(answered, records.size()));
        stats.put("unsupportedRate", ratio(unsupported, records.size()));
        stats.put("failureRate", ratio(records.size() - answered - unsupported, records.size()));
        stats.put("outcomes", outcomes);
        stats.put("totalTime", summarize(totals));

        Map<String, Map<String, Double>> steps = new LinkedHashMap<>();
        timingsByStep.forEach((step, seconds) -> steps.put(step, summarize(seconds)));
        stats.put("stepStatistics", steps);

        return stats;
    }

    private static Map<String, Double> summarize(List<Double> seconds) {
        List<Double> sorted = new ArrayList<>(seconds);
        Collections.sort(sorted);
        int n = sorted.size();
        double median = n % 2 == 0
                ? (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0
                : sorted.get(n / 2);

        Map<String, Double> summary = new LinkedHashMap<>();
        summary.put("avg", sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        summary.put("median", median);
        summary.put("min", sorted.get(0));
        summary.put("max", sorted.get(n - 1));
        return summary;
    }

    private static double ratio(int part, int whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }

    @Builder
    public record QueryRecord(
            String timestamp,
            String query,
            String outcome,
            Double totalTime,
            Map<String, Double> stepDurations
    ) {
    }
}
