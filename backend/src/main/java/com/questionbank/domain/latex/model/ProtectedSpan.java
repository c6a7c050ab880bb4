package com.questionbank.domain.latex.model;

/**
 * A region of the document hidden behind a placeholder for the rest of a repair call.
 *
 * @param id          position in the per-call span table
 * @param kind        what the span holds
 * @param text        verbatim text restored in place of the placeholder
 * @param body        content between the inline delimiters (equals {@code text} for non-inline kinds)
 * @param placeholder the sentinel string standing in for the span
 */
public record ProtectedSpan(
        int id,
        ProtectedSpanKind kind,
        String text,
        String body,
        String placeholder
) {}
