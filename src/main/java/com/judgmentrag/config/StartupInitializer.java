package com.judgmentrag.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.judgmentrag.dto.response.IndexingReport;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.RagException;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.service.index.IndexingService;
import com.judgmentrag.service.index.VectorIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports what the journals restored and, when {@code legal-rag.indexing.index-on-startup} is set,
 * indexes the configured corpus before the service takes queries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final VectorIndex vectorIndex;
    private final CaseStore caseStore;
    private final IndexingService indexingService;
    private final ModelConfig modelConfig;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING JUDGMENT RAG");
        log.info("{}\n", "=".repeat(70));

        log.info("Restored {} segments of {} cases", vectorIndex.count(), caseStore.count());

        if (modelConfig.isIndexOnStartup()) {
            indexCorpus();
        } else if (vectorIndex.count() == 0) {
            log.warn("Index is empty: POST /api/index or set legal-rag.indexing.index-on-startup=true");
        }

        log.info("\n{}", "=".repeat(70));
        log.info("SYSTEM READY");
        log.info("{}\n", "=".repeat(70));
    }

    private void indexCorpus() {
        try {
            IndexingReport report = indexingService.indexFromSource();
            log.info("Startup indexing: {} cases, {} segments, {} errors",
                    report.getCasesIndexed(), report.getSegmentsIndexed(), report.getErrors().size());

        } catch (ConfigurationException e) {
            throw e;

        } catch (RagException e) {
            log.error("\n{}", "=".repeat(70));
            log.error("STARTUP INDEXING FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started but the index may be incomplete");
        }
    }
}
