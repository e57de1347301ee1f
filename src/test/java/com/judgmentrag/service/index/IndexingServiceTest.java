package com.judgmentrag.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentrag.TestSupport;
import com.judgmentrag.config.DatasetConfig;
import com.judgmentrag.config.EmbeddingConfig;
import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.dto.internal.ScoredEntry;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.dto.response.IndexingReport;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.model.CaseRecord;
import com.judgmentrag.model.IndexEntry;
import com.judgmentrag.service.data.CaseRecordValidator;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.service.data.CorpusLoaderService;
import com.judgmentrag.service.embedding.CaseEmbeddingService;
import com.judgmentrag.service.embedding.HashingEmbeddingModel;
import com.judgmentrag.util.LegalTextTokenizer;
import com.judgmentrag.util.TextSegmenter;

class IndexingServiceTest {

    @TempDir
    Path indexDir;

    private JournaledVectorIndex vectorIndex;
    private CaseStore caseStore;
    private IndexingService indexingService;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = TestSupport.objectMapper();
        DatasetConfig datasetConfig = TestSupport.datasetConfig(indexDir);
        EmbeddingConfig embeddingConfig = TestSupport.embeddingConfig(EmbeddingConfig.PROVIDER_HASHING, 64, 4);
        CaseRecordValidator validator = new CaseRecordValidator();

        vectorIndex = new JournaledVectorIndex(datasetConfig, mapper);
        vectorIndex.load();
        caseStore = new CaseStore(datasetConfig, mapper);
        caseStore.load();

        CaseEmbeddingService embeddingService = new CaseEmbeddingService(
                embeddingConfig,
                new HashingEmbeddingModel(new LegalTextTokenizer(), 64),
                TestSupport.callGuard());

        indexingService = new IndexingService(
                vectorIndex, caseStore, embeddingService, new TextSegmenter(), validator,
                new CorpusLoaderService(datasetConfig, mapper, validator), new ModelConfig());
    }

    private Map<String, IndexEntry> snapshot() {
        return vectorIndex.entries().stream().collect(Collectors.toMap(IndexEntry::segmentId, Function.identity()));
    }

    @Test
    @DisplayName("indexing the same corpus twice leaves the index unchanged")
    void idempotentReindex() {
        List<CaseRecord> corpus = List.of(TestSupport.privacyCase(), TestSupport.contractCase());

        IndexingReport first = indexingService.indexCorpus(corpus, 120, 20, 1);
        Map<String, IndexEntry> before = snapshot();
        IndexingReport second = indexingService.indexCorpus(corpus, 120, 20, 1);
        Map<String, IndexEntry> after = snapshot();

        assertThat(first.getCasesIndexed()).isEqualTo(2);
        assertThat(first.getErrors()).isEmpty();
        assertThat(second.getSegmentsIndexed()).isEqualTo(first.getSegmentsIndexed());
        assertThat(vectorIndex.count()).isEqualTo(first.getSegmentsIndexed());
        assertThat(after.keySet()).isEqualTo(before.keySet());
        after.forEach((id, entry) -> {
            assertThat(entry.text()).isEqualTo(before.get(id).text());
            assertThat(entry.vector()).containsExactly(before.get(id).vector());
        });
    }

    @Test
    @DisplayName("searches during an indexing run only see whole, committed entries")
    void concurrentReadsSeeWholeEntries() throws Exception {
        List<CaseRecord> corpus = new ArrayList<>();
        Map<String, String> texts = new HashMap<>();
        for (int i = 0; i < 40; i++) {
            String caseId = "C" + i;
            String text = ("Privacy ruling number " + i + " on personal data. ").repeat(12);
            corpus.add(TestSupport.privacyCase().toBuilder().caseId(caseId).fullText(text).build());
            texts.put(caseId, text);
        }
        float[] query = new HashingEmbeddingModel(new LegalTextTokenizer(), 64).embed("privacy personal data");

        ExecutorService indexer = Executors.newSingleThreadExecutor();
        try {
            Future<IndexingReport> run = indexer.submit(() -> indexingService.indexCorpus(corpus, 120, 20, 2));

            int lastCount = 0;
            while (!run.isDone()) {
                for (ScoredEntry hit : vectorIndex.search(query, 50, SearchFilters.none())) {
                    IndexEntry entry = hit.entry();
                    assertThat(entry.vector()).hasSize(64);
                    assertThat(entry.metadata()).isNotNull();
                    assertThat(entry.text())
                            .isEqualTo(texts.get(entry.caseId()).substring(entry.startOffset(), entry.endOffset()));
                }
                int count = vectorIndex.count();
                assertThat(count).isGreaterThanOrEqualTo(lastCount);
                lastCount = count;
            }

            IndexingReport report = run.get(30, TimeUnit.SECONDS);
            assertThat(report.getCasesIndexed()).isEqualTo(40);
            assertThat(report.getErrors()).isEmpty();
            assertThat(vectorIndex.count()).isEqualTo(report.getSegmentsIndexed());
        } finally {
            indexer.shutdownNow();
        }
    }

    @Test
    @DisplayName("a shorter re-indexed text prunes the case's stale segments")
    void prunesStaleSegments() {
        CaseRecord longer = TestSupport.privacyCase();
        indexingService.indexCorpus(List.of(longer), 100, 10, 10);
        int segmentsBefore = vectorIndex.count();

        CaseRecord shorter = longer.toBuilder().fullText("Privacy is a fundamental right.").build();
        indexingService.indexCorpus(List.of(shorter), 100, 10, 10);

        assertThat(segmentsBefore).isGreaterThan(1);
        assertThat(vectorIndex.count()).isEqualTo(1);
        assertThat(caseStore.find("A")).get()
                .satisfies(c -> assertThat(c.fullText()).isEqualTo("Privacy is a fundamental right."));
    }

    @Test
    @DisplayName("malformed and duplicate records are reported while the batch continues")
    void rejectsBadRecords() {
        CaseRecord blank = CaseRecord.builder().caseId("E").title("Empty").fullText("  ").build();

        IndexingReport report = indexingService.indexCorpus(
                List.of(TestSupport.privacyCase(), blank, TestSupport.privacyCase(), TestSupport.contractCase()),
                200, 20, 2);

        assertThat(report.getCasesIndexed()).isEqualTo(2);
        assertThat(report.getErrors()).hasSize(2)
                .anySatisfy(e -> assertThat(e).startsWith("E:"))
                .anySatisfy(e -> assertThat(e).contains("duplicate"));
        assertThat(caseStore.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("invalid window settings are a configuration error")
    void invalidSettings() {
        assertThatThrownBy(() -> indexingService.indexCorpus(List.of(TestSupport.privacyCase()), 50, 50, 10))
                .isInstanceOf(ConfigurationException.class);
        assertThat(vectorIndex.count()).isZero();
    }

    @Test
    @DisplayName("removeCase drops the case from the index and the case store")
    void removeCase() {
        indexingService.indexCorpus(List.of(TestSupport.privacyCase(), TestSupport.contractCase()), 200, 20, 10);

        assertThat(indexingService.removeCase("B")).isTrue();
        assertThat(indexingService.removeCase("B")).isFalse();
        assertThat(caseStore.find("B")).isEmpty();
        assertThat(vectorIndex.entries()).extracting(IndexEntry::caseId).containsOnly("A");
    }
}
