package com.verdictrag.service.monitoring;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-query stopwatch. Each {@link #mark(String)} closes a named step; not thread-safe,
 * one instance per query.
 */
public class QueryTimer {

    private long startTime;
    private Long endTime;

    private final Map<String, Long> timings = new LinkedHashMap<>();

    public static QueryTimer started() {
        QueryTimer timer = new QueryTimer();
        timer.start();
        return timer;
    }

    public void start() {
        this.startTime = System.nanoTime();
        this.timings.clear();
        this.endTime = null;
    }

    public void mark(String stepName) {
        timings.put(stepName, System.nanoTime() - startTime);
    }

    public void end() {
        this.endTime = System.nanoTime();
    }

    /**
     * Seconds from start to end, or to now while still running.
     */
    public double getTotalTime() {
        long end = endTime != null ? endTime : System.nanoTime();
        return (end - startTime) / 1_000_000_000.0;
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long prevTime = 0L;
        for (Map.Entry<String, Long> entry : timings.entrySet()) {
            long cumulativeTime = entry.getValue();
            durations.put(entry.getKey(), (cumulativeTime - prevTime) / 1_000_000_000.0);
            prevTime = cumulativeTime;
        }

        return durations;
    }

    public String formatDisplay() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("total=%.3fs", getTotalTime()));
        for (Map.Entry<String, Double> entry : getStepDurations().entrySet()) {
            sb.append(String.format(" | %s=%.3fs", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }
}
