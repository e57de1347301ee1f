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
public class IndexingReport {

    private int segmentsIndexed;

    private int casesIndexed;

    /**
     * One line per rejected record or failed batch, prefixed with the case id when known
     */
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private Double durationSeconds;
}
