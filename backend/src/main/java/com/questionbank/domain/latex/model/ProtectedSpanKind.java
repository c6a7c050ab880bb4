package com.questionbank.domain.latex.model;

/**
 * Kinds of spans that are masked while the document is rewritten.
 * Each kind has its own pair of private-use sentinel characters.
 */
public enum ProtectedSpanKind {
    INLINE_MATH('\uE000', '\uE001'),
    DISPLAY_MATH('\uE002', '\uE003'),
    LITERAL('\uE004', '\uE005');

    private final char open;
    private final char close;

    ProtectedSpanKind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    public static ProtectedSpanKind fromOpen(char c) {
        for (ProtectedSpanKind kind : values()) {
            if (kind.open == c) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Not a placeholder sentinel: U+" + Integer.toHexString(c));
    }
}
