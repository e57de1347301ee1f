package com.judgmentrag.service.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.TimingInfo;

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recent query timings, bounded by {@code legal-rag.monitoring.max-query-history}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private final ModelConfig modelConfig;

    private final Deque<QueryRecord> queryHistory = new ConcurrentLinkedDeque<>();

    @Builder
    public record QueryRecord(
            String timestamp,
            String query,
            String mode,
            String outcome,
            double totalTime,
            Map<String, Double> stepDurations
    ) {
    }

    public void addQuery(String query, TimingInfo timing, String mode, String outcome) {
        if (!modelConfig.isMonitoringEnabled()) {
            return;
        }

        log.debug("Recording {} query ({})", mode, outcome);
        queryHistory.addLast(QueryRecord.builder()
                .timestamp(Instant.now().toString())
                .query(query.length() > 100 ? query.substring(0, 100) + "..." : query)
                .mode(mode)
                .outcome(outcome)
                .totalTime(timing.getTotalTime() != null ? timing.getTotalTime() : 0.0)
                .stepDurations(new LinkedHashMap<>(timing.getStepDurations()))
                .build());

        while (queryHistory.size() > modelConfig.getMaxQueryHistory()) {
            queryHistory.pollFirst();
        }
    }

    public List<QueryRecord> getQueryHistory() {
        return new ArrayList<>(queryHistory);
    }

    public Map<String, Object> getStatistics() {
        List<QueryRecord> records = getQueryHistory();
        if (records.isEmpty()) {
            return Map.of("totalQueries", 0, "message", "No queries recorded yet");
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalQueries", records.size());
        stats.putAll(summarize(records));

        Map<String, Long> outcomes = records.stream()
                .collect(Collectors.groupingBy(QueryRecord::outcome, TreeMap::new, Collectors.counting()));
        stats.put("outcomes", outcomes);

        Map<String, Object> byMode = new TreeMap<>();
        records.stream()
                .collect(Collectors.groupingBy(QueryRecord::mode))
                .forEach((mode, modeRecords) -> {
                    Map<String, Object> modeStats = new LinkedHashMap<>();
                    modeStats.put("queries", modeRecords.size());
                    modeStats.putAll(summarize(modeRecords));
                    byMode.put(mode, modeStats);
                });
        stats.put("modes", byMode);

        return stats;
    }

    public void clear() {
        queryHistory.clear();
    }

    private Map<String, Object> summarize(List<QueryRecord> records) {
        List<Double> totalTimes = records.stream().map(QueryRecord::totalTime).toList();

        Map<String, List<Double>> allSteps = new LinkedHashMap<>();
        for (QueryRecord record : records) {
            record.stepDurations().forEach((step, seconds) ->
                    allSteps.computeIfAbsent(step, k -> new ArrayList<>()).add(seconds));
        }

        Map<String, Map<String, Double>> stepStats = new LinkedHashMap<>();
        allSteps.forEach((step, times) -> stepStats.put(step, describe(times)));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalTime", describe(totalTimes));
        summary.put("stepStatistics", stepStats);
        return summary;
    }

    private Map<String, Double> describe(List<Double> times) {
        Map<String, Double> stat = new LinkedHashMap<>();
        stat.put("avg", times.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        stat.put("median", median(times));
        stat.put("min", Collections.min(times));
        stat.put("max", Collections.max(times));
        return stat;
    }

    private double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        return size % 2 == 0
                ? (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0
                : sorted.get(size / 2);
    }
}
