package com.judgmentrag.service.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.judgmentrag.TestSupport;
import com.judgmentrag.config.DatasetConfig;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.model.CaseRecord;

class CorpusLoaderServiceTest {

    @TempDir
    Path dir;

    private DatasetConfig datasetConfig;
    private CorpusLoaderService loader;

    @BeforeEach
    void setUp() {
        datasetConfig = TestSupport.datasetConfig(dir.resolve("index"));
        loader = new CorpusLoaderService(datasetConfig, TestSupport.objectMapper(), new CaseRecordValidator());
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    // =========================================================================
    // File formats
    // =========================================================================

    @Nested
    @DisplayName("file formats")
    class Formats {

        @Test
        @DisplayName("reads a JSON array")
        void jsonArray() throws IOException {
            Path file = write("cases.json", """
                    [
                      {"case_id": "A", "title": "Privacy", "full_text": "privacy is a right"},
                      {"case_id": "B", "title": "Contract", "full_text": "offer and acceptance"}
                    ]
                    """);

            CorpusLoadResult result = loader.load(file);

            assertThat(result.records()).extracting(CaseRecord::caseId).containsExactly("A", "B");
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("reads JSON lines and reports a malformed line without dropping the rest")
        void jsonLines() throws IOException {
            Path file = write("cases.jsonl", """
                    {"case_id": "A", "full_text": "privacy is a right"}
                    {not json
                    
                    {"case_id": "B", "full_text": "offer and acceptance"}
                    """);

            CorpusLoadResult result = loader.load(file);

            assertThat(result.records()).extracting(CaseRecord::caseId).containsExactly("A", "B");
            assertThat(result.errors()).singleElement().asString().startsWith("line 2");
        }

        @Test
        @DisplayName("a non-object element in a JSON array is rejected on its own")
        void nonObjectElement() throws IOException {
            Path file = write("cases.json", """
                    ["oops", null, 42, {"case_id": "A", "full_text": "privacy is a right"}]
                    """);

            CorpusLoadResult result = loader.load(file);

            assertThat(result.records()).extracting(CaseRecord::caseId).containsExactly("A");
            assertThat(result.errors()).containsExactly(
                    "#0: record is not a JSON object",
                    "#1: record is not a JSON object",
                    "#2: record is not a JSON object");
        }

        @Test
        @DisplayName("a JSON line holding null is rejected without dropping the other lines")
        void nullLine() throws IOException {
            Path file = write("cases.jsonl", """
                    null
                    {"case_id": "A", "full_text": "privacy is a right"}
                    """);

            CorpusLoadResult result = loader.load(file);

            assertThat(result.records()).extracting(CaseRecord::caseId).containsExactly("A");
            assertThat(result.errors()).containsExactly("#0: record is not a JSON object");
        }

        @Test
        @DisplayName("a missing corpus file is a configuration error")
        void missingFile() {
            assertThatThrownBy(() -> loader.load(dir.resolve("absent.json")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("an unset corpus path is a configuration error")
        void unsetCorpus() {
            assertThatThrownBy(() -> loader.loadConfiguredCorpus())
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("loads the configured corpus")
        void configuredCorpus() throws IOException {
            Path file = write("configured.json", "[{\"id\": \"X\", \"text\": \"some text\"}]");
            datasetConfig.setCorpus(file.toString());

            assertThat(loader.loadConfiguredCorpus().records()).extracting(CaseRecord::caseId).containsExactly("X");
        }
    }

    // =========================================================================
    // Normalization
    // =========================================================================

    @Nested
    @DisplayName("normalization")
    class Normalization {

        @Test
        @DisplayName("accepts field aliases and fills defaults")
        void aliasesAndDefaults() throws IOException {
            Path file = write("cases.json", """
                    [{"caseId": " C-1 ", "fullText": "text", "judge": "Sharma; Rao , ", "decisionDate": "24/08/2017"}]
                    """);

            CaseRecord record = loader.load(file).records().get(0);

            assertThat(record.caseId()).isEqualTo("C-1");
            assertThat(record.title()).isEqualTo(CaseRecordValidator.DEFAULT_TITLE);
            assertThat(record.citation()).isEqualTo(CaseRecordValidator.DEFAULT_CITATION);
            assertThat(record.court()).isEqualTo(CaseRecordValidator.DEFAULT_COURT);
            assertThat(record.judges()).containsExactly("Sharma", "Rao");
            assertThat(record.decisionDate()).isEqualTo(LocalDate.of(2017, 8, 24));
        }

        @Test
        @DisplayName("parses ISO dates, dashed dates and timestamps; anything else becomes unknown")
        void dates() throws IOException {
            Path file = write("cases.json", """
                    [
                      {"case_id": "1", "full_text": "t", "decision_date": "2017-08-24"},
                      {"case_id": "2", "full_text": "t", "decision_date": "24-08-2017"},
                      {"case_id": "3", "full_text": "t", "decision_date": "2017-08-24T10:15:00Z"},
                      {"case_id": "4", "full_text": "t", "decision_date": "August 2017"}
                    ]
                    """);

            CorpusLoadResult result = loader.load(file);

            assertThat(result.records()).extracting(CaseRecord::decisionDate).containsExactly(
                    LocalDate.of(2017, 8, 24), LocalDate.of(2017, 8, 24), LocalDate.of(2017, 8, 24), null);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("a null entry among caller-supplied records is rejected, the rest are kept")
        void nullSuppliedRecord() {
            List<Map<String, Object>> raw = new ArrayList<>();
            raw.add(null);
            raw.add(Map.of("case_id", "A", "full_text", "privacy is a right"));
            List<String> errors = new ArrayList<>();

            CorpusLoadResult result = loader.toRecords(raw, errors);

            assertThat(result.records()).extracting(CaseRecord::caseId).containsExactly("A");
            assertThat(result.errors()).containsExactly("#0: record is not a JSON object");
        }

        @Test
        @DisplayName("rejects records without an id, with blank text, or with a repeated id")
        void rejections() throws IOException {
            Path file = write("cases.json", """
                    [
                      {"title": "no id", "full_text": "t"},
                      {"case_id": "A", "full_text": "   "},
                      {"case_id": "B", "full_text": "first"},
                      {"case_id": "B", "full_text": "second"}
                    ]
                    """);

            CorpusLoadResult result = loader.load(file);

            assertThat(result.records()).extracting(CaseRecord::fullText).containsExactly("first");
            assertThat(result.errors()).hasSize(3);
            assertThat(result.errors()).anyMatch(e -> e.startsWith("#0"));
            assertThat(result.errors()).anyMatch(e -> e.startsWith("A:"));
            assertThat(result.errors()).anyMatch(e -> e.startsWith("B:") && e.contains("duplicate"));
        }
    }
}
