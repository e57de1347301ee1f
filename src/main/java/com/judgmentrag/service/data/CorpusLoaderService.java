package com.judgmentrag.service.data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentrag.config.DatasetConfig;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.DataValidationException;
import com.judgmentrag.exception.RagException;
import com.judgmentrag.model.CaseRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the configured corpus file (JSON array or JSON lines) into validated case records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusLoaderService {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final DatasetConfig datasetConfig;
    private final ObjectMapper objectMapper;
    private final CaseRecordValidator validator;

    public CorpusLoadResult loadConfiguredCorpus() {
        Path path = datasetConfig.getCorpusPath();
        if (path == null) {
            throw new ConfigurationException("legal-rag.dataset.corpus is not set");
        }
        return load(path);
    }

    public CorpusLoadResult load(Path path) {
        log.info("Loading corpus from: {}", path);

        if (!Files.exists(path)) {
            throw new ConfigurationException("Corpus file not found: " + path);
        }

        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new RagException("Failed to read corpus " + path, e);
        }

        List<String> errors = new ArrayList<>();
        List<Map<String, Object>> raw = content.stripLeading().startsWith("[")
                ? readArray(path, content)
                : readLines(content, errors);

        CorpusLoadResult result = toRecords(raw, errors);
        log.info("Loaded {} cases ({} rejected)", result.records().size(), result.errors().size());
        return result;
    }

    public CorpusLoadResult toRecords(List<Map<String, Object>> raw, List<String> errors) {
        List<CaseRecord> records = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < raw.size(); i++) {
            try {
                CaseRecord record = validator.normalize(raw.get(i), i);
                if (!seen.add(record.caseId())) {
                    throw new DataValidationException(record.caseId(), "duplicate case_id");
                }
                records.add(record);
            } catch (DataValidationException e) {
                log.warn("Rejected case {}: {}", e.getCaseId(), e.getMessage());
                errors.add(e.getCaseId() + ": " + e.getMessage());
            }
        }
        return new CorpusLoadResult(records, errors);
    }

    /**
     * Elements that are not JSON objects keep their slot as {@code null}; the validator
     * rejects them under their own position.
     */
    private List<Map<String, Object>> readArray(Path path, String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new RagException("Corpus " + path + " is not a valid JSON array", e);
        }
        if (!root.isArray()) {
            throw new RagException("Corpus " + path + " is not a valid JSON array");
        }

        List<Map<String, Object>> raw = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            if (element.isObject()) {
                raw.add(objectMapper.convertValue(element, RECORD_TYPE));
            } else {
                log.warn("Corpus element {} is {}, not an object", raw.size(), element.getNodeType());
                raw.add(null);
            }
        }
        return raw;
    }

    private List<Map<String, Object>> readLines(String content, List<String> errors) {
        List<Map<String, Object>> raw = new ArrayList<>();
        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            try {
                raw.add(objectMapper.readValue(line, RECORD_TYPE));
            } catch (JsonProcessingException e) {
                log.warn("Failed to parse corpus line {}: {}", i + 1, e.getOriginalMessage());
                errors.add("line " + (i + 1) + ": not a JSON object");
            }
        }
        return raw;
    }
}
