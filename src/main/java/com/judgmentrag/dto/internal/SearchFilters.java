package com.judgmentrag.dto.internal;

import java.time.LocalDate;

import com.judgmentrag.model.CaseMetadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata restrictions applied before ranking. Null fields do not restrict.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {

    private String court;

    private LocalDate decidedFrom;

    private LocalDate decidedTo;

    public static SearchFilters none() {
        return new SearchFilters();
    }

    public boolean matches(CaseMetadata metadata) {
        if (court != null && !court.isBlank()
                && (metadata.court() == null || !court.trim().equalsIgnoreCase(metadata.court().trim()))) {
            return false;
        }
        LocalDate date = metadata.decisionDate();
        if (decidedFrom != null && (date == null || date.isBefore(decidedFrom))) {
            return false;
        }
        if (decidedTo != null && (date == null || date.isAfter(decidedTo))) {
            return false;
        }
        return true;
    }

    public boolean isEmpty() {
        return (court == null || court.isBlank()) && decidedFrom == null && decidedTo == null;
    }
}
