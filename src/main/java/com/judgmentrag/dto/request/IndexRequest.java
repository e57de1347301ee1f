package com.judgmentrag.dto.request;

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Indexing run. Without {@code records} the configured corpus file is indexed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndexRequest {

    private List<Map<String, Object>> records;

    private Integer chunkSize;

    private Integer overlap;

    private Integer batchSize;
}
