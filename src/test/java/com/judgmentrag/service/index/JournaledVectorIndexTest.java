package com.judgmentrag.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.judgmentrag.TestSupport;
import com.judgmentrag.dto.internal.ScoredEntry;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.exception.DimensionMismatchException;
import com.judgmentrag.model.CaseMetadata;
import com.judgmentrag.model.IndexEntry;

class JournaledVectorIndexTest {

    @TempDir
    Path indexDir;

    private JournaledVectorIndex index;

    @BeforeEach
    void setUp() {
        index = newIndex();
    }

    private JournaledVectorIndex newIndex() {
        JournaledVectorIndex fresh = new JournaledVectorIndex(
                TestSupport.datasetConfig(indexDir), TestSupport.objectMapper());
        fresh.load();
        return fresh;
    }

    private static IndexEntry entry(String caseId, int seq, String court, LocalDate date, float... vector) {
        CaseMetadata meta = new CaseMetadata(caseId, "Title " + caseId, "Cit " + caseId, court, date, null, null);
        String id = String.format("%s::%05d", caseId, seq);
        return new IndexEntry(id, caseId, seq, 0, 10, "text of " + id, vector, meta);
    }

    // =========================================================================
    //  upsert / count
    // =========================================================================

    @Nested
    @DisplayName("upsert")
    class Upsert {

        @Test
        @DisplayName("is idempotent by segment id")
        void idempotent() {
            List<IndexEntry> entries = List.of(
                    entry("X", 0, "SC", null, 1f, 0f),
                    entry("X", 1, "SC", null, 0f, 1f));

            index.upsert(entries);
            index.upsert(entries);

            assertThat(index.count()).isEqualTo(2);
            assertThat(index.caseCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("replaces the entry stored under the same id")
        void replaces() {
            index.upsert(List.of(entry("X", 0, "SC", null, 1f, 0f)));
            index.upsert(List.of(entry("X", 0, "HC", null, 0f, 1f)));

            assertThat(index.count()).isEqualTo(1);
            assertThat(index.get("X::00000")).get()
                    .satisfies(e -> assertThat(e.metadata().court()).isEqualTo("HC"));
        }

        @Test
        @DisplayName("rejects a vector of another dimension")
        void dimensionMismatch() {
            index.upsert(List.of(entry("X", 0, "SC", null, 1f, 0f)));

            assertThatThrownBy(() -> index.upsert(List.of(entry("Y", 0, "SC", null, 1f, 0f, 0f))))
                    .isInstanceOf(DimensionMismatchException.class);
            assertThat(index.count()).isEqualTo(1);
        }
    }

    // =========================================================================
    //  search
    // =========================================================================

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("on an empty index returns nothing")
        void emptyIndex() {
            assertThat(index.search(new float[] {1f, 0f}, 5, SearchFilters.none())).isEmpty();
        }

        @Test
        @DisplayName("ranks by cosine similarity and breaks ties by segment id")
        void rankingAndTies() {
            index.upsert(List.of(
                    entry("B", 0, "SC", null, 1f, 0f),
                    entry("A", 0, "SC", null, 2f, 0f),
                    entry("C", 0, "SC", null, 0f, 1f)));

            List<ScoredEntry> results = index.search(new float[] {1f, 0f}, 3, SearchFilters.none());

            assertThat(results).extracting(ScoredEntry::segmentId)
                    .containsExactly("A::00000", "B::00000", "C::00000");
            assertThat(results.get(0).score()).isCloseTo(1.0, offset(1e-9));
            assertThat(results.get(2).score()).isCloseTo(0.0, offset(1e-9));
        }

        @Test
        @DisplayName("applies filters before the top-k cut")
        void filtersBeforeRanking() {
            index.upsert(List.of(
                    entry("A", 0, "High Court", LocalDate.of(2010, 1, 1), 1f, 0f),
                    entry("B", 0, "Supreme Court", LocalDate.of(2018, 1, 1), 0.5f, 0.5f),
                    entry("C", 0, "Supreme Court", null, 0.9f, 0.1f)));

            SearchFilters court = SearchFilters.builder().court("supreme court").build();
            assertThat(index.search(new float[] {1f, 0f}, 1, court))
                    .extracting(ScoredEntry::caseId).containsExactly("C");

            SearchFilters dated = SearchFilters.builder().decidedFrom(LocalDate.of(2015, 1, 1)).build();
            assertThat(index.search(new float[] {1f, 0f}, 5, dated))
                    .extracting(ScoredEntry::caseId).containsExactly("B");
        }

        @Test
        @DisplayName("rejects a query vector of another dimension")
        void queryDimensionMismatch() {
            index.upsert(List.of(entry("A", 0, "SC", null, 1f, 0f)));

            assertThatThrownBy(() -> index.search(new float[] {1f, 0f, 0f}, 5, SearchFilters.none()))
                    .isInstanceOf(DimensionMismatchException.class);
        }
    }

    // =========================================================================
    //  removal and persistence
    // =========================================================================

    @Test
    @DisplayName("pruneCase keeps only the listed segments of that case")
    void prune() {
        index.upsert(List.of(
                entry("A", 0, "SC", null, 1f, 0f),
                entry("A", 1, "SC", null, 1f, 0f),
                entry("B", 0, "SC", null, 1f, 0f)));

        assertThat(index.pruneCase("A", List.of("A::00000"))).isEqualTo(1);
        assertThat(index.entries()).extracting(IndexEntry::segmentId).containsExactly("A::00000", "B::00000");
    }

    @Test
    @DisplayName("journal replay restores the live entries after a restart")
    void replay() {
        index.upsert(List.of(
                entry("A", 0, "SC", LocalDate.of(2017, 8, 24), 1f, 0f),
                entry("B", 0, "SC", null, 0f, 1f)));
        index.upsert(List.of(entry("A", 0, "HC", LocalDate.of(2017, 8, 24), 0.6f, 0.8f)));
        index.removeCase("B");

        JournaledVectorIndex restarted = newIndex();

        assertThat(restarted.count()).isEqualTo(1);
        IndexEntry a = restarted.get("A::00000").orElseThrow();
        assertThat(a.metadata().court()).isEqualTo("HC");
        assertThat(a.metadata().decisionDate()).isEqualTo(LocalDate.of(2017, 8, 24));
        assertThat(a.vector()).containsExactly(0.6f, 0.8f);
    }

    @Test
    @DisplayName("a torn trailing line is skipped on replay")
    void tornLine() throws IOException {
        index.upsert(List.of(entry("A", 0, "SC", null, 1f, 0f)));
        Files.writeString(indexDir.resolve(JournaledVectorIndex.JOURNAL_FILE),
                "{\"key\":\"B::00000\",\"version\":99,\"value\":{\"segm",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        JournaledVectorIndex restarted = newIndex();

        assertThat(restarted.count()).isEqualTo(1);
        assertThat(restarted.get("A::00000")).isPresent();
    }

    @Test
    @DisplayName("a complete last line missing only its newline survives the next restart")
    void unterminatedCompleteLine() throws IOException {
        index.upsert(List.of(entry("A", 0, "SC", null, 1f, 0f)));
        Path journal = indexDir.resolve(JournaledVectorIndex.JOURNAL_FILE);
        Files.writeString(journal, Files.readString(journal).stripTrailing(), StandardCharsets.UTF_8);

        JournaledVectorIndex restarted = newIndex();
        assertThat(restarted.get("A::00000")).isPresent();
        restarted.upsert(List.of(entry("B", 0, "SC", null, 0f, 1f)));

        JournaledVectorIndex again = newIndex();
        assertThat(again.entries()).extracting(IndexEntry::segmentId).containsExactly("A::00000", "B::00000");
    }

    @Test
    @DisplayName("appends after a torn line was cut off replay cleanly")
    void appendAfterTornLine() throws IOException {
        index.upsert(List.of(entry("A", 0, "SC", null, 1f, 0f)));
        Files.writeString(indexDir.resolve(JournaledVectorIndex.JOURNAL_FILE),
                "{\"key\":\"B::00000\",\"vers",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        newIndex().upsert(List.of(entry("C", 0, "SC", null, 0f, 1f)));

        assertThat(newIndex().entries()).extracting(IndexEntry::segmentId).containsExactly("A::00000", "C::00000");
    }

    @Test
    @DisplayName("compact rewrites the journal to the live entries only")
    void compact() throws IOException {
        index.upsert(List.of(entry("A", 0, "SC", null, 1f, 0f), entry("B", 0, "SC", null, 0f, 1f)));
        index.upsert(List.of(entry("A", 0, "SC", null, 1f, 1f)));
        index.removeCase("B");

        index.compact();

        Path journal = indexDir.resolve(JournaledVectorIndex.JOURNAL_FILE);
        assertThat(Files.readAllLines(journal)).hasSize(1);
        assertThat(newIndex().get("A::00000")).get()
                .satisfies(e -> assertThat(e.vector()).containsExactly(1f, 1f));
    }
}
