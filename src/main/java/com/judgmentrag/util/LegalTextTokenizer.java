package com.judgmentrag.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class LegalTextTokenizer {
    
    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "of", "to", "in", "on", "for", "with",
        "by", "at", "from", "as", "is", "are", "was", "were", "be", "been",
        "this", "that", "these", "those", "it", "its", "what", "which", "who",
        "whom", "how", "when", "where", "why", "do", "does", "did", "can",
        "could", "should", "would", "will", "shall", "may", "might", "under",
        "about", "into", "than", "then", "there", "their", "them", "any", "all"
    );

    /**
     * Doctrinal vocabulary recognised in case text and offered as suggestions.
     */
    public static final List<String> LEGAL_TERMS = List.of(
        "article", "section", "constitution", "supreme court", "high court",
        "judgment", "petition", "appellant", "respondent", "ratio decidendi",
        "obiter dicta", "precedent", "doctrine", "fundamental rights",
        "directive principles", "writ", "habeas corpus", "mandamus",
        "certiorari", "prohibition", "quo warranto", "basic structure",
        "right to privacy", "freedom of speech", "due process", "contract",
        "sedition", "bail", "arbitration", "negligence"
    );

    private static final String SPLIT_PATTERN = "[^\\p{L}\\p{N}]+";

    /**
     * Lower-cased word tokens with stop words and single characters removed
     */
    public List<String> tokenizeUnigram(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split(SPLIT_PATTERN))
            .filter(word -> word.length() > 1)
            .filter(word -> !STOP_WORDS.contains(word))
            .collect(Collectors.toList());
    }
    
    public List<String> tokenizeBigram(String text) {
        List<String> tokens = tokenizeUnigram(text);
        List<String> bigrams = new ArrayList<>();
        
        for (int i = 0; i < tokens.size() - 1; i++) {
            bigrams.add(tokens.get(i) + "_" + tokens.get(i + 1));
        }
        
        return bigrams;
    }
    
    public List<String> extractKeywords(String text, int maxKeywords) {
        return tokenizeUnigram(text).stream()
            .filter(word -> word.length() >= 3)
            .distinct()
            .limit(maxKeywords)
            .collect(Collectors.toList());
    }

    /**
     * Legal terms from {@link #LEGAL_TERMS} that occur in the text, in list order
     */
    public List<String> findLegalTerms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return LEGAL_TERMS.stream()
            .filter(lower::contains)
            .collect(Collectors.toList());
    }
}
