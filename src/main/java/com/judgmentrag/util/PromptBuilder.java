package com.judgmentrag.util;

import java.time.format.DateTimeFormatter;
import java.util.List;

import org.springframework.stereotype.Component;

import com.judgmentrag.dto.internal.CaseSummary;
import com.judgmentrag.dto.internal.RetrievedCase;
import com.judgmentrag.dto.internal.ScoredEntry;
import com.judgmentrag.model.CaseMetadata;

@Component
public class PromptBuilder {

    public static final String ANSWER_HEADER = "ANSWER:";
    public static final String FOLLOW_UP_HEADER = "FOLLOW-UP QUESTIONS:";

    /* =========================================================
     * SYSTEM PROMPTS
     * ========================================================= */
    public String buildSystemPrompt() {
        return """
                You are an expert legal research assistant answering questions from prior judgments.

                Answering rules:
                1. GROUNDED: Base every statement on the case material provided
                2. ATTRIBUTED: Name the case (title and citation) behind each legal proposition
                3. BALANCED: Present competing holdings where the cases disagree
                4. PRECISE: Use proper legal terminology and explain doctrines briefly
                5. CAUTIOUS: Say plainly when the material does not settle the question
                """;
    }

    public String buildAnalysisSystemPrompt() {
        return """
                You are a legal query analyzer. Extract the main legal issues and the search keywords
                from the user's question. Reply with valid JSON only, no other text.
                """;
    }

    public String buildSummarySystemPrompt() {
        return """
                You are a legal case summarizer. Extract the key legal arguments, holdings and reasoning
                from the excerpts of one judgment. Be concise but complete, and use only the excerpts given.
                """;
    }

    /* =========================================================
     * QUERY ANALYSIS
     * ========================================================= */
    public String buildAnalysisPrompt(String query) {
        return """
                Analyze this legal question and extract its issues and keywords.

                Question: "%s"

                Return JSON in exactly this shape:
                {"legal_issues": ["issue 1", "issue 2"], "keywords": ["keyword 1", "keyword 2"]}
                """.formatted(query);
    }

    /* =========================================================
     * PER-CASE SUMMARY
     * ========================================================= */
    public String buildSummaryPrompt(RetrievedCase retrievedCase, String excerpts) {
        CaseMetadata meta = retrievedCase.metadata();

        StringBuilder prompt = new StringBuilder();
        prompt.append("Case: ").append(meta.title()).append("\n");
        prompt.append("Citation: ").append(meta.citation()).append("\n");
        prompt.append("Court: ").append(meta.court()).append("\n\n");
        prompt.append("Excerpts:\n");
        prompt.append(excerpts).append("\n\n");
        prompt.append("Provide a brief summary of the key legal points.");
        return prompt.toString();
    }

    /* =========================================================
     * SYNTHESIS (AGENTIC PATH)
     * ========================================================= */
    public String buildSynthesisPrompt(
            String query,
            List<String> legalIssues,
            List<RetrievedCase> relatedCases,
            String evidence) {

        StringBuilder prompt = new StringBuilder();

        prompt.append("### QUERY\n");
        prompt.append(query).append("\n\n");

        prompt.append("### LEGAL ISSUES IDENTIFIED\n");
        legalIssues.forEach(issue -> prompt.append("- ").append(issue).append("\n"));
        prompt.append("\n");

        prompt.append("### RELATED CASES\n");
        relatedCases.forEach(c -> prompt.append("- ").append(describe(c.metadata())).append("\n"));
        prompt.append("\n");

        prompt.append("### CASE ANALYSIS\n");
        prompt.append(evidence).append("\n\n");

        appendAnswerFormat(prompt);

        return prompt.toString();
    }

    /* =========================================================
     * DIRECT RAG
     * ========================================================= */
    public String buildDirectPrompt(String query, String context) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("### TASK\n");
        prompt.append("Answer the legal question using the judgment excerpts provided.\n\n");

        prompt.append("### CASE LAW CONTEXT\n");
        prompt.append(context).append("\n\n");

        prompt.append("### QUERY\n");
        prompt.append(query).append("\n\n");

        appendAnswerFormat(prompt);

        return prompt.toString();
    }

    /* =========================================================
     * CONTEXT FORMAT
     * ========================================================= */

    /**
     * Numbered case blocks, each carrying at most {@code perCaseChars} of excerpt text.
     */
    public String formatCaseContext(List<RetrievedCase> cases, int perCaseChars) {
        StringBuilder context = new StringBuilder();

        for (int i = 0; i < cases.size(); i++) {
            RetrievedCase c = cases.get(i);
            CaseMetadata meta = c.metadata();

            context.append("[Case ").append(i + 1).append("]\n");
            context.append("Title: ").append(meta.title()).append("\n");
            context.append("Citation: ").append(meta.citation()).append("\n");
            context.append("Court: ").append(meta.court()).append("\n");
            context.append("Decision Date: ").append(formatDate(meta)).append("\n\n");
            context.append("Relevant Text:\n");
            context.append(joinExcerpts(c.supportingSegments(), perCaseChars)).append("\n");
            context.append("-".repeat(60)).append("\n");
        }

        return context.toString();
    }

    /**
     * Case summaries as {@code [title (citation)]: summary} paragraphs
     */
    public String formatSummaries(List<CaseSummary> summaries) {
        StringBuilder sb = new StringBuilder();
        for (CaseSummary s : summaries) {
            sb.append("[").append(s.title()).append(" (").append(s.citation()).append(")]: ")
              .append(s.summary().trim()).append("\n\n");
        }
        return sb.toString().trim();
    }

    public String joinExcerpts(List<ScoredEntry> segments, int maxChars) {
        StringBuilder sb = new StringBuilder();
        for (ScoredEntry segment : segments) {
            String text = segment.text().trim();
            int remaining = maxChars - sb.length();
            if (remaining <= 0) {
                break;
            }
            if (sb.length() > 0) {
                sb.append("\n...\n");
            }
            sb.append(text.length() > remaining ? text.substring(0, remaining) : text);
        }
        return sb.toString();
    }

    public String describe(CaseMetadata meta) {
        return meta.title() + " (" + meta.citation() + ", " + meta.court() + ", " + formatDate(meta) + ")";
    }

    private void appendAnswerFormat(StringBuilder prompt) {
        prompt.append("### RESPONSE FORMAT\n");
        prompt.append(ANSWER_HEADER).append("\n");
        prompt.append("<your analysis, citing each case by title and citation>\n\n");
        prompt.append(FOLLOW_UP_HEADER).append("\n");
        prompt.append("- <2 to 4 follow-up questions the user could ask next>\n");
    }

    private String formatDate(CaseMetadata meta) {
        return meta.decisionDate() != null
                ? meta.decisionDate().format(DateTimeFormatter.ISO_LOCAL_DATE)
                : "Unknown";
    }
}
