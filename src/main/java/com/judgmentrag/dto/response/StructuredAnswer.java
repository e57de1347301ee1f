package com.judgmentrag.dto.response;

import java.util.ArrayList;
import java.util.List;

import com.judgmentrag.dto.internal.TimingInfo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuredAnswer {

    // ================= CORE RESPONSE =================
    private String query;

    private String answer;

    @Builder.Default
    private List<RelatedCase> relatedCases = new ArrayList<>();

    // ================= REASONING DETAILS =================
    @Builder.Default
    private List<String> legalIssues = new ArrayList<>();

    @Builder.Default
    private List<String> followUpQuestions = new ArrayList<>();

    /**
     * Human-readable trace of the stages that ran
     */
    @Builder.Default
    private List<String> reasoningSteps = new ArrayList<>();

    private ProcessingInfo processingInfo;

    // ================= EXECUTION MODE =================
    /**
     * - agentic
     * - direct
     */
    private String mode;

    private boolean evidenceFound;

    private boolean degraded;

    // ================= TIMING =================
    private TimingInfo timing;

    private String timingDisplay;
}
