package com.flamingo.ai.argumentation.service.argument.model;

/**
 * A paragraph located in the source text.
 *
 * @param text stripped paragraph text
 * @param startPos offset of the paragraph in the source text
 * @param endPos exclusive end offset
 */
public record ParagraphSegment(String text, int startPos, int endPos) {}
