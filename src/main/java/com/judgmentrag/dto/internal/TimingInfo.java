package com.judgmentrag.dto.internal;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.judgmentrag.service.monitoring.QueryTimer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wall-clock seconds spent per workflow step of one query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimingInfo {
    
    private Double totalTime;
    
    @Builder.Default
    private Map<String, Double> stepDurations = new LinkedHashMap<>();
    
    private String timestamp;

    public static TimingInfo from(QueryTimer timer) {
        return TimingInfo.builder()
                .totalTime(timer.getTotalTime())
                .stepDurations(timer.getStepDurations())
                .timestamp(Instant.now().toString())
                .build();
    }
}
