package com.phillippitts.phiredaction.service.detect.slow;

/**
 * Raw span annotation produced by a {@link ContextModel}.
 *
 * <p>The label is free text in the model's own vocabulary ("PER", "GPE", "FAC" ...); it is mapped
 * onto the closed PHI label set by {@link LabelMapper}.
 *
 * @param label model label
 * @param start inclusive offset into the annotated text
 * @param end   exclusive offset into the annotated text
 * @param score model score; clamped to [0,1] when converted to a detection
 */
public record ModelAnnotation(String label, int start, int end, double score) {}
