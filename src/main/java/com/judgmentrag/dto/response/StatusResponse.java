package com.judgmentrag.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private int indexedSegmentCount;

    private int indexedCaseCount;

    /**
     * True once at least one segment is indexed and the providers answer
     */
    private boolean ready;

    private boolean providersReachable;

    private String chatModel;

    private String embeddingProvider;
}
