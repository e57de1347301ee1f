package com.judgmentrag.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.request.IndexRequest;
import com.judgmentrag.dto.response.IndexingReport;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.service.index.IndexingService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AdminController {

    private final IndexingService indexingService;
    private final ModelConfig modelConfig;

    @PostMapping("/index")
    public ResponseEntity<?> index(@RequestBody(required = false) IndexRequest request) {
        IndexRequest req = request != null ? request : new IndexRequest();

        int chunkSize = req.getChunkSize() != null ? req.getChunkSize() : modelConfig.getChunkSize();
        int overlap = req.getOverlap() != null ? req.getOverlap() : modelConfig.getOverlap();
        int batchSize = req.getBatchSize() != null ? req.getBatchSize() : modelConfig.getBatchSize();

        try {
            IndexingReport report = req.getRecords() != null
                    ? indexingService.indexRaw(req.getRecords(), chunkSize, overlap, batchSize)
                    : indexingService.indexFromSource(chunkSize, overlap, batchSize);
            return ResponseEntity.ok(report);

        } catch (ConfigurationException e) {
            log.error("Indexing rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/cases/{caseId}")
    public ResponseEntity<?> removeCase(@PathVariable String caseId) {
        log.info("Removing case: {}", caseId);
        if (!indexingService.removeCase(caseId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "caseId", caseId));
    }
}
