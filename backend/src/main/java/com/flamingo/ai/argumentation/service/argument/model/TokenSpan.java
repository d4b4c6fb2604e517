package com.flamingo.ai.argumentation.service.argument.model;

/**
 * Resolved {@code [start, end)} character range of a token in the source text.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record TokenSpan(int start, int end) {}
