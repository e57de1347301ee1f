package com.judgmentrag.service.llm;

/**
 * Generation calls with separate time budgets. The name selects the Resilience4j time limiter.
 */
public enum GenerationStage {

    ANALYSIS("analysis"),
    SUMMARIZATION("summarization"),
    SYNTHESIS("synthesis");

    private final String timeLimiterName;

    GenerationStage(String timeLimiterName) {
        this.timeLimiterName = timeLimiterName;
    }

    public String timeLimiterName() {
        return timeLimiterName;
    }
}
