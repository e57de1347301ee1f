package com.judgmentrag.dto.response;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingInfo {

    private int casesRetrieved;

    private int casesAnalyzed;

    /**
     * Cases whose summary could not be generated
     */
    @Builder.Default
    private List<String> summaryFailures = new ArrayList<>();

    /**
     * Stages that fell back, with the reason
     */
    @Builder.Default
    private List<String> degradations = new ArrayList<>();
}
