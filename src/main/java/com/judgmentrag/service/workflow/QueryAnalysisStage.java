package com.judgmentrag.service.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.ProviderTransientException;
import com.judgmentrag.service.llm.GenerationStage;
import com.judgmentrag.service.llm.LegalLlmService;
import com.judgmentrag.util.LegalTextTokenizer;
import com.judgmentrag.util.PromptBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * ANALYZING: asks the model for the legal issues and search keywords of the query.
 * <p>
 * The reply is read as JSON, then as the first JSON block inside free text, then as bullet
 * lists under "issues" and "keywords" headings. When nothing usable comes back the query
 * itself becomes the single issue and keywords come from the tokenizer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryAnalysisStage implements WorkflowStage {

    private static final int MAX_ISSUES = 5;
    private static final int MAX_KEYWORDS = 8;

    private static final Pattern JSON_BLOCK = Pattern.compile("\\{[^{}]*(?:\\{[^{}]*\\}[^{}]*)*\\}", Pattern.DOTALL);
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+(.+)$");

    private final LegalLlmService llmService;
    private final PromptBuilder promptBuilder;
    private final LegalTextTokenizer tokenizer;
    private final ModelConfig modelConfig;
    private final ObjectMapper objectMapper;

    record Analysis(List<String> issues, List<String> keywords) {

        boolean isUsable() {
            return issues != null && !issues.isEmpty();
        }
    }

    @Override
    public StageOutcome<WorkflowState> apply(WorkflowState state) {
        String query = state.getQuery();

        String response;
        try {
            response = llmService.generate(
                    GenerationStage.ANALYSIS,
                    promptBuilder.buildAnalysisSystemPrompt(),
                    promptBuilder.buildAnalysisPrompt(query),
                    modelConfig.getAnalysisMaxTokens());
        } catch (ConfigurationException e) {
            return StageOutcome.fatal(state, e.getMessage());
        } catch (ProviderTransientException e) {
            log.warn("Query analysis unavailable, using the query as the only issue: {}", e.getMessage());
            return StageOutcome.degraded(fallback(state), "analysis: " + e.getMessage());
        }

        Analysis analysis = parse(response);
        if (!analysis.isUsable()) {
            log.warn("Query analysis reply could not be parsed, using the query as the only issue");
            log.debug("Unparseable analysis reply: {}", response);
            return StageOutcome.degraded(fallback(state), "analysis: unparseable model output");
        }

        List<String> keywords = analysis.keywords().isEmpty()
                ? tokenizer.extractKeywords(query, MAX_KEYWORDS)
                : limit(analysis.keywords(), MAX_KEYWORDS);
        List<String> issues = limit(analysis.issues(), MAX_ISSUES);

        log.info("Analysis: {} issues, keywords {}", issues.size(), keywords);

        return StageOutcome.ok(state.toBuilder()
                .clearExtractedIssues().extractedIssues(issues)
                .clearKeywords().keywords(keywords)
                .reasoningStep(String.format("Analyzed query: %d legal issue(s), keywords %s", issues.size(), keywords))
                .build());
    }

    private WorkflowState fallback(WorkflowState state) {
        List<String> keywords = tokenizer.extractKeywords(state.getQuery(), MAX_KEYWORDS);
        return state.toBuilder()
                .analysisDegraded(true)
                .clearExtractedIssues().extractedIssue(state.getQuery())
                .clearKeywords().keywords(keywords)
                .reasoningStep("Query analysis unavailable: treated the whole question as the legal issue")
                .build();
    }

    Analysis parse(String response) {
        if (response == null || response.isBlank()) {
            return new Analysis(List.of(), List.of());
        }

        Analysis direct = readJson(response.trim());
        if (direct != null && direct.isUsable()) {
            return direct;
        }

        Matcher matcher = JSON_BLOCK.matcher(response);
        while (matcher.find()) {
            Analysis block = readJson(matcher.group());
            if (block != null && block.isUsable()) {
                return block;
            }
        }

        return readBulletSections(response);
    }

    private Analysis readJson(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                return null;
            }
            return new Analysis(
                    strings(node.path("legal_issues").isMissingNode() ? node.path("issues") : node.path("legal_issues")),
                    strings(node.path("keywords")));
        } catch (Exception e) {
            log.debug("Not a JSON analysis: {}", e.getMessage());
            return null;
        }
    }

    private Analysis readBulletSections(String response) {
        List<String> issues = new ArrayList<>();
        List<String> keywords = new ArrayList<>();
        List<String> current = null;

        for (String line : response.split("\\R")) {
            String lower = line.toLowerCase(Locale.ROOT);
            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                if (current != null) {
                    current.add(clean(bullet.group(1)));
                }
            } else if (lower.contains("issue")) {
                current = issues;
            } else if (lower.contains("keyword")) {
                current = keywords;
            }
        }
        return new Analysis(issues, keywords);
    }

    private List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> {
                String text = clean(item.asText(""));
                if (!text.isEmpty()) {
                    values.add(text);
                }
            });
        }
        return values;
    }

    private String clean(String text) {
        return text.replaceAll("^[\"'`]+|[\"'`,]+$", "").trim();
    }

    private List<String> limit(List<String> values, int max) {
        List<String> distinct = values.stream().distinct().toList();
        return distinct.size() > max ? distinct.subList(0, max) : distinct;
    }
}
