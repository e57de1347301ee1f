package com.judgmentrag.service.monitoring;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.TimingInfo;

class PerformanceMonitorServiceTest {

    private ModelConfig modelConfig;
    private PerformanceMonitorService monitor;

    @BeforeEach
    void setUp() {
        modelConfig = new ModelConfig();
        ModelConfig.Monitoring monitoring = new ModelConfig.Monitoring();
        monitoring.setMaxQueryHistory(3);
        modelConfig.setMonitoring(monitoring);
        monitor = new PerformanceMonitorService(modelConfig);
    }

    private static TimingInfo timing(double total, double retrieval) {
        Map<String, Double> steps = new LinkedHashMap<>();
        steps.put("Retrieval", retrieval);
        return TimingInfo.builder().totalTime(total).stepDurations(steps).build();
    }

    @Test
    @DisplayName("history keeps only the most recent queries")
    void boundedHistory() {
        for (int i = 1; i <= 5; i++) {
            monitor.addQuery("query " + i, timing(i, 0.1), "direct", "ok");
        }

        assertThat(monitor.getQueryHistory())
                .extracting(PerformanceMonitorService.QueryRecord::query)
                .containsExactly("query 3", "query 4", "query 5");
    }

    @Test
    @DisplayName("statistics break down by outcome and mode")
    @SuppressWarnings("unchecked")
    void statistics() {
        monitor.addQuery("a", timing(1.0, 0.2), "agentic", "ok");
        monitor.addQuery("b", timing(3.0, 0.4), "agentic", "degraded");
        monitor.addQuery("c", timing(2.0, 0.3), "direct", "ok");

        Map<String, Object> stats = monitor.getStatistics();

        assertThat(stats).containsEntry("totalQueries", 3);
        assertThat((Map<String, Double>) stats.get("totalTime"))
                .containsEntry("median", 2.0)
                .containsEntry("min", 1.0)
                .containsEntry("max", 3.0);
        assertThat((Map<String, Long>) stats.get("outcomes"))
                .containsEntry("ok", 2L)
                .containsEntry("degraded", 1L);
        assertThat((Map<String, Object>) stats.get("modes")).containsOnlyKeys("agentic", "direct");
    }

    @Test
    @DisplayName("nothing is recorded when monitoring is disabled")
    void disabled() {
        modelConfig.getMonitoring().setEnabled(false);

        monitor.addQuery("a", timing(1.0, 0.2), "direct", "ok");

        assertThat(monitor.getQueryHistory()).isEmpty();
        assertThat(monitor.getStatistics()).containsEntry("totalQueries", 0);
    }

    @Test
    @DisplayName("long queries are shortened in the history")
    void truncatedQuery() {
        monitor.addQuery("x".repeat(150), timing(1.0, 0.1), "direct", "ok");

        assertThat(monitor.getQueryHistory().get(0).query()).hasSize(103).endsWith("...");
    }
}
