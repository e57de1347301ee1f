package com.judgmentrag.service.rag;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.model.CaseRecord;
import com.judgmentrag.service.data.CaseStore;
import com.judgmentrag.util.LegalTextTokenizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Type-ahead suggestions from indexed case titles and the legal terms that occur in indexed text.
 * Never calls a model.
 * <p>
 * Candidates rank by how they match: title prefix, then word prefix, then substring.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionService {

    private final CaseStore caseStore;
    private final LegalTextTokenizer tokenizer;
    private final ModelConfig modelConfig;

    private volatile Vocabulary vocabulary = new Vocabulary(-1, List.of(), List.of());

    private record Vocabulary(long revision, List<String> recentTitles, List<String> candidates) {
    }

    private record Match(String text, int rank) {
    }

    public List<String> suggest(String partialQuery) {
        Vocabulary vocab = vocabulary();
        int max = modelConfig.getMaxSuggestions();

        String needle = partialQuery == null ? "" : partialQuery.trim().toLowerCase(Locale.ROOT);
        if (needle.length() < modelConfig.getMinSuggestQueryLength()) {
            return limit(vocab.recentTitles(), max);
        }

        List<Match> matches = new ArrayList<>();
        for (String candidate : vocab.candidates()) {
            int rank = rank(candidate.toLowerCase(Locale.ROOT), needle);
            if (rank >= 0) {
                matches.add(new Match(candidate, rank));
            }
        }

        return matches.stream()
                .sorted(Comparator.comparingInt(Match::rank).thenComparing(Match::text))
                .map(Match::text)
                .limit(max)
                .toList();
    }

    static int rank(String candidate, String needle) {
        if (candidate.startsWith(needle)) {
            return 0;
        }
        for (String word : candidate.split("[^\\p{L}\\p{N}]+")) {
            if (!word.isEmpty() && word.startsWith(needle)) {
                return 1;
            }
        }
        return candidate.contains(needle) ? 2 : -1;
    }

    private Vocabulary vocabulary() {
        Vocabulary current = vocabulary;
        long revision = caseStore.revision();
        if (current.revision() == revision) {
            return current;
        }

        List<CaseRecord> cases = caseStore.all();

        List<String> recent = cases.stream()
                .sorted(Comparator.comparing(CaseRecord::decisionDate,
                                Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
                        .thenComparing(CaseRecord::caseId))
                .map(CaseRecord::title)
                .distinct()
                .toList();

        Set<String> candidates = new LinkedHashSet<>();
        cases.forEach(c -> candidates.add(c.title()));
        cases.forEach(c -> candidates.addAll(tokenizer.findLegalTerms(c.fullText())));

        Vocabulary rebuilt = new Vocabulary(revision, recent, List.copyOf(candidates));
        vocabulary = rebuilt;
        log.debug("Suggestion vocabulary rebuilt: {} candidates", rebuilt.candidates().size());
        return rebuilt;
    }

    private List<String> limit(List<String> values, int max) {
        return values.size() > max ? values.subList(0, max) : values;
    }
}
