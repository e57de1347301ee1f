package com.judgmentrag.service.monitoring;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Per-query stopwatch. One instance per workflow execution; not thread-safe.
 */
public class QueryTimer {

    @Getter
    private Long startTime;

    @Getter
    private Long endTime;

    private final Map<String, Long> marks = new LinkedHashMap<>();

    public static QueryTimer started() {
        QueryTimer timer = new QueryTimer();
        timer.start();
        return timer;
    }

    public void start() {
        this.startTime = System.currentTimeMillis();
        this.marks.clear();
        this.endTime = null;
    }

    /**
     * Records the elapsed time since start under {@code stepName}
     */
    public void mark(String stepName) {
        if (startTime == null) {
            start();
        }
        marks.put(stepName, System.currentTimeMillis() - startTime);
    }

    public void end() {
        if (endTime == null) {
            this.endTime = System.currentTimeMillis();
        }
    }

    public double getTotalTime() {
        if (startTime == null) {
            return 0.0;
        }
        long end = endTime != null ? endTime : System.currentTimeMillis();
        return (end - startTime) / 1000.0;
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long prev = 0L;
        for (Map.Entry<String, Long> entry : marks.entrySet()) {
            long cumulative = entry.getValue();
            durations.put(entry.getKey(), (cumulative - prev) / 1000.0);
            prev = cumulative;
        }

        return durations;
    }

    public String formatDisplay() {
        StringBuilder sb = new StringBuilder();
        sb.append("Processing time: ").append(String.format("%.2fs", getTotalTime()));

        for (Map.Entry<String, Double> entry : getStepDurations().entrySet()) {
            sb.append(String.format("%n  - %s: %.2fs", entry.getKey(), entry.getValue()));
        }

        return sb.toString();
    }
}
