package com.questionbank.domain.latex.model;

/**
 * Output of one repair call plus instrumentation.
 *
 * @param text               the repaired text
 * @param mergePasses        passes the adjacent-span merger ran before reaching a fixed point or its cap
 * @param protectedSpanCount spans masked during the call (existing, wrapped and literal)
 */
public record RepairResult(
        String text,
        int mergePasses,
        int protectedSpanCount
) {}
