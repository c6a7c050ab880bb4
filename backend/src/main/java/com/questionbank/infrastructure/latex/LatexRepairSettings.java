package com.questionbank.infrastructure.latex;

import java.util.List;

/**
 * Tunables of the repair heuristics.
 *
 * @param maxMergePasses  upper bound on adjacent-span merge passes
 * @param sentenceOpeners words that mark a line as prose for the whole-line comparison rule
 * @param clauseKeywords  words that end the right-hand side of a bare equation
 */
public record LatexRepairSettings(
        int maxMergePasses,
        List<String> sentenceOpeners,
        List<String> clauseKeywords
) {
    public static final int DEFAULT_MAX_MERGE_PASSES = 15;

    public static final List<String> DEFAULT_SENTENCE_OPENERS = List.of(
            "Hence", "Therefore", "Since", "Thus", "Then", "Also", "According");

    public static final List<String> DEFAULT_CLAUSE_KEYWORDS = List.of(
            "where", "with", "when", "and", "exactly", "for");

    public LatexRepairSettings {
        if (maxMergePasses < 1) {
            throw new IllegalArgumentException("maxMergePasses must be at least 1, got " + maxMergePasses);
        }
        sentenceOpeners = clean(sentenceOpeners);
        clauseKeywords = clean(clauseKeywords);
        if (clauseKeywords.isEmpty()) {
            throw new IllegalArgumentException("At least one clause keyword is required");
        }
    }

    public static LatexRepairSettings defaults() {
        return new LatexRepairSettings(DEFAULT_MAX_MERGE_PASSES, DEFAULT_SENTENCE_OPENERS, DEFAULT_CLAUSE_KEYWORDS);
    }

    private static List<String> clean(List<String> words) {
        if (words == null) {
            return List.of();
        }
        return words.stream()
                .map(String::strip)
                .filter(w -> !w.isEmpty())
                .toList();
    }
}
