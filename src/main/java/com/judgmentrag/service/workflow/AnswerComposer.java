package com.judgmentrag.service.workflow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.judgmentrag.dto.internal.CaseSummary;
import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.util.PromptBuilder;
import com.judgmentrag.util.TextSegmenter;

import lombok.RequiredArgsConstructor;

/**
 * Text rules for the final answer: reply parsing, follow-up bounds, attribution and the
 * answers produced without a model call.
 */
@Component
@RequiredArgsConstructor
public class AnswerComposer {

    public static final String INSUFFICIENT_EVIDENCE = "Insufficient evidence:";

    static final int MIN_FOLLOW_UPS = 2;
    static final int MAX_FOLLOW_UPS = 4;

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s*(.+)$");

    private static final List<String> GENERIC_FOLLOW_UPS = List.of(
            "Which later judgments have followed or distinguished these cases?",
            "What remedies did the courts grant in these cases?",
            "Are there dissenting opinions on this question?",
            "How would these holdings apply to a different set of facts?"
    );

    private final TextSegmenter segmenter;

    public record Reply(String answer, List<String> followUps) {
    }

    /**
     * Splits a model reply into the answer body and the follow-up questions listed after
     * {@link PromptBuilder#FOLLOW_UP_HEADER}.
     */
    public Reply parse(String response) {
        String text = response == null ? "" : response.trim();
        String upper = text.toUpperCase(Locale.ROOT);

        String answer = text;
        List<String> followUps = new ArrayList<>();

        int followIdx = upper.indexOf(PromptBuilder.FOLLOW_UP_HEADER);
        if (followIdx >= 0) {
            answer = text.substring(0, followIdx);
            for (String line : text.substring(followIdx + PromptBuilder.FOLLOW_UP_HEADER.length()).split("\\R")) {
                Matcher item = LIST_ITEM.matcher(line);
                String question = item.matches() ? item.group(1).trim() : line.trim();
                if (!question.isEmpty()) {
                    followUps.add(question);
                }
            }
        }

        answer = answer.trim();
        if (answer.toUpperCase(Locale.ROOT).startsWith(PromptBuilder.ANSWER_HEADER)) {
            answer = answer.substring(PromptBuilder.ANSWER_HEADER.length()).trim();
        }
        return new Reply(answer, followUps);
    }

    /**
     * Between two and four follow-ups: extra ones are dropped, missing ones are derived from the issues.
     */
    public List<String> boundFollowUps(List<String> proposed, List<String> issues) {
        Set<String> result = new LinkedHashSet<>();
        for (String question : proposed) {
            if (result.size() == MAX_FOLLOW_UPS) {
                break;
            }
            if (!question.isBlank()) {
                result.add(question.trim());
            }
        }

        for (String issue : issues) {
            if (result.size() >= MIN_FOLLOW_UPS) {
                break;
            }
            result.add("How have courts applied the principle of " + segmenter.truncate(issue.trim(), 120) + "?");
        }
        for (String generic : GENERIC_FOLLOW_UPS) {
            if (result.size() >= MIN_FOLLOW_UPS) {
                break;
            }
            result.add(generic);
        }
        return new ArrayList<>(result);
    }

    /**
     * Appends a source list when the answer names none of the analysed cases.
     */
    public String attribute(String answer, List<RetrievedCase> cases) {
        if (cases.isEmpty() || mentionsAny(answer, cases)) {
            return answer;
        }
        StringBuilder sb = new StringBuilder(answer.trim());
        sb.append("\n\nSources:");
        for (RetrievedCase c : cases) {
            sb.append("\n- ").append(c.title()).append(" (").append(c.citation()).append(")");
        }
        return sb.toString();
    }

    public String insufficientEvidence(String query, boolean retrievalUnavailable) {
        if (retrievalUnavailable) {
            return INSUFFICIENT_EVIDENCE + " the case law index could not be searched for \""
                    + segmenter.truncate(query, 200) + "\", so no answer grounded in prior judgments can be given.";
        }
        return INSUFFICIENT_EVIDENCE + " no indexed judgment is relevant to \""
                + segmenter.truncate(query, 200) + "\". Try rephrasing the question or widening the filters.";
    }

    /**
     * Answer assembled from retrieval output alone, used when synthesis is unavailable.
     */
    public String extractive(List<RetrievedCase> cases, List<CaseSummary> summaries) {
        StringBuilder sb = new StringBuilder();
        sb.append("An analysed answer could not be generated. The most relevant judgments found are:\n");

        for (int i = 0; i < cases.size(); i++) {
            RetrievedCase c = cases.get(i);
            sb.append("\n").append(i + 1).append(". ").append(c.title())
              .append(" (").append(c.citation()).append(", ").append(c.metadata().court()).append(")");

            String gist = summaries.stream()
                    .filter(s -> s.caseId().equals(c.caseId()))
                    .map(CaseSummary::summary)
                    .findFirst()
                    .orElseGet(() -> c.supportingSegments().isEmpty() ? "" : c.supportingSegments().get(0).text());
            if (!gist.isBlank()) {
                sb.append("\n   ").append(segmenter.truncate(gist.replaceAll("\\s+", " ").trim(), 300));
            }
        }
        return sb.toString();
    }

    private boolean mentionsAny(String answer, List<RetrievedCase> cases) {
        String lower = answer.toLowerCase(Locale.ROOT);
        for (RetrievedCase c : cases) {
            if (contains(lower, c.title()) || contains(lower, c.citation())) {
                return true;
            }
        }
        return false;
    }

    private boolean contains(String haystack, String needle) {
        return needle != null && !needle.isBlank() && haystack.contains(needle.toLowerCase(Locale.ROOT));
    }
}
