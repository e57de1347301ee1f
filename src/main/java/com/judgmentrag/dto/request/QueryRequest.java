package com.judgmentrag.dto.request;

import java.time.LocalDate;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryRequest {

    @NotBlank
    @Size(max = 2000)
    private String query;

    /**
     * Four-stage reasoning when true (default), single-call answer otherwise
     */
    private Boolean useAgentic;

    @Min(1)
    @Max(50)
    private Integer topKCases;

    @Min(1)
    @Max(20)
    private Integer casesAnalyzed;

    // ================= FILTERS =================
    private String court;

    private LocalDate decidedFrom;

    private LocalDate decidedTo;
}
