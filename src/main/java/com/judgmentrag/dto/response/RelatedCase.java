package com.judgmentrag.dto.response;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedCase {

    private String caseId;

    private String title;

    private String citation;

    private String court;

    private LocalDate decisionDate;

    /**
     * Best segment similarity of the case
     */
    private Double score;
}
