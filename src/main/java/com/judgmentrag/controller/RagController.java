package com.judgmentrag.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.dto.request.QueryRequest;
import com.judgmentrag.dto.response.StatusResponse;
import com.judgmentrag.dto.response.StructuredAnswer;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.WorkflowFailedException;
import com.judgmentrag.service.monitoring.PerformanceMonitorService;
import com.judgmentrag.service.monitoring.SystemStatusService;
import com.judgmentrag.service.rag.LegalQueryService;
import com.judgmentrag.service.rag.SuggestionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RagController {

    private final LegalQueryService queryService;
    private final SuggestionService suggestionService;
    private final SystemStatusService statusService;
    private final PerformanceMonitorService performanceMonitor;

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        log.debug("Status requested");
        return ResponseEntity.ok(statusService.getStatus());
    }

    @PostMapping("/query")
    public ResponseEntity<?> query(@Valid @RequestBody QueryRequest request) {
        boolean agentic = !Boolean.FALSE.equals(request.getUseAgentic());
        log.info("Query received (agentic={}): {}", agentic, request.getQuery());

        SearchFilters filters = SearchFilters.builder()
                .court(request.getCourt())
                .decidedFrom(request.getDecidedFrom())
                .decidedTo(request.getDecidedTo())
                .build();

        try {
            StructuredAnswer answer = queryService.answerQuery(
                    request.getQuery(),
                    agentic,
                    request.getTopKCases(),
                    request.getCasesAnalyzed(),
                    filters
            );
            return ResponseEntity.ok(answer);

        } catch (WorkflowFailedException e) {
            log.error("Query failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", e.getMessage(), "query", request.getQuery()));

        } catch (ConfigurationException e) {
            log.error("Query rejected by configuration: {}", e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", e.getMessage(), "query", request.getQuery()));
        }
    }

    @GetMapping("/suggestions")
    public ResponseEntity<Map<String, List<String>>> suggestions(
            @RequestParam(name = "query", defaultValue = "") String query) {
        return ResponseEntity.ok(Map.of("suggestions", suggestionService.suggest(query)));
    }

    @GetMapping("/cases/{caseId}")
    public ResponseEntity<?> getCase(@PathVariable String caseId) {
        return queryService.getCase(caseId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<?> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<?> performanceHistory() {
        var history = performanceMonitor.getQueryHistory();
        return ResponseEntity.ok(Map.of("totalQueries", history.size(), "history", history));
    }
}
