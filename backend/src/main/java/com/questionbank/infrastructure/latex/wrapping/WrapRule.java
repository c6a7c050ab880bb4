package com.questionbank.infrastructure.latex.wrapping;

import com.questionbank.infrastructure.latex.preprocessing.SpanTable;

/**
 * One detector of undelimited math. A rule wraps what it recognises in inline
 * delimiters, protects the result immediately and returns the rewritten text.
 * Rules never throw; no match means the text comes back unchanged.
 */
public interface WrapRule {

    String name();

    String apply(String text, SpanTable spans);
}
