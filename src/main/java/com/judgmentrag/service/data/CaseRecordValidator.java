package com.judgmentrag.service.data;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.judgmentrag.exception.DataValidationException;
import com.judgmentrag.model.CaseRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw corpus maps and caller-supplied records into normalized {@link CaseRecord}s.
 * Anything that cannot be indexed is rejected with a {@link DataValidationException}.
 */
@Slf4j
@Component
public class CaseRecordValidator {

    public static final String DEFAULT_TITLE = "Untitled Case";
    public static final String DEFAULT_CITATION = "No Citation";
    public static final String DEFAULT_COURT = "Unknown";

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    private static final Pattern LEADING_ISO_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})[T ].*");

    /**
     * Normalizes one raw corpus object. {@code position} only labels errors of records without an id.
     */
    public CaseRecord normalize(Map<String, Object> raw, int position) {
        if (raw == null) {
            throw new DataValidationException("#" + position, "record is not a JSON object");
        }
        String caseId = firstString(raw, "case_id", "caseId", "id");
        if (caseId == null || caseId.isBlank()) {
            throw new DataValidationException("#" + position, "record has no case_id");
        }

        CaseRecord record = CaseRecord.builder()
                .caseId(caseId.trim())
                .title(firstString(raw, "title"))
                .citation(firstString(raw, "citation"))
                .court(firstString(raw, "court"))
                .decisionDate(parseDate(caseId, firstString(raw, "decision_date", "decisionDate", "date")))
                .fullText(firstString(raw, "full_text", "fullText", "text"))
                .judges(stringList(raw.containsKey("judges") ? raw.get("judges") : raw.get("judge")))
                .tags(stringList(raw.get("tags")))
                .build();

        return validate(record);
    }

    /**
     * Checks the required fields and fills defaults for the optional ones.
     */
    public CaseRecord validate(CaseRecord record) {
        if (record == null) {
            throw new DataValidationException(null, "record is null");
        }
        if (record.caseId() == null || record.caseId().isBlank()) {
            throw new DataValidationException(null, "record has no case_id");
        }
        String caseId = record.caseId().trim();
        if (record.fullText() == null || record.fullText().isBlank()) {
            throw new DataValidationException(caseId, "full_text is empty");
        }

        return record.toBuilder()
                .caseId(caseId)
                .title(orDefault(record.title(), DEFAULT_TITLE))
                .citation(orDefault(record.citation(), DEFAULT_CITATION))
                .court(orDefault(record.court(), DEFAULT_COURT))
                .judges(clean(record.judges()))
                .tags(clean(record.tags()))
                .build();
    }

    LocalDate parseDate(String caseId, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        Matcher m = LEADING_ISO_DATE.matcher(candidate);
        if (m.matches()) {
            candidate = m.group(1);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(candidate, format);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        log.warn("Case {}: unparseable decision_date '{}', treated as unknown", caseId, value);
        return null;
    }

    private String firstString(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            List<String> out = new ArrayList<>();
            items.forEach(item -> {
                if (item != null) {
                    out.add(String.valueOf(item));
                }
            });
            return out;
        }
        return Arrays.asList(String.valueOf(value).split("[,;]"));
    }

    private List<String> clean(List<String> values) {
        return values.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
