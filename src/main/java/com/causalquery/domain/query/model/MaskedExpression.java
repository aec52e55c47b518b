package com.causalquery.domain.query.model;

import com.causalquery.domain.query.exception.ArityMismatchException;

import java.util.List;

/**
 * An expression with its spans cut out.
 * {@code segments} holds the literal text around the spans, so it always has
 * {@code spans.size() + 1} entries: segment 0, span 0, segment 1, span 1, ... segment n.
 *
 * @param segments literal text between spans
 * @param spans    the masked spans, sorted by start offset and non-overlapping
 */
public record MaskedExpression(
        List<String> segments,
        List<BoundaryMatch> spans
) {
    public MaskedExpression {
        segments = List.copyOf(segments);
        spans = List.copyOf(spans);
        if (segments.size() != spans.size() + 1) {
            throw new IllegalArgumentException(
                    String.format("Expected %d segments for %d spans, got %d",
                            spans.size() + 1, spans.size(), segments.size()));
        }
    }

    /**
     * Rebuild the expression with each span slot filled by the matching entry of {@code fills}.
     *
     * @throws ArityMismatchException if fills and spans differ in count
     */
    public String restore(List<String> fills) {
        if (fills.size() != spans.size()) {
            throw new ArityMismatchException(String.format(
                    "Expected %d span fills, got %d", spans.size(), fills.size()));
        }
        StringBuilder sb = new StringBuilder(segments.get(0));
        for (int i = 0; i < fills.size(); i++) {
            sb.append(fills.get(i));
            sb.append(segments.get(i + 1));
        }
        return sb.toString();
    }

    /**
     * Rebuild the original expression.
     */
    public String original() {
        return restore(spans.stream().map(BoundaryMatch::text).toList());
    }

    /**
     * Skeleton with numbered slot markers, e.g. {@code "({{SPAN_1}}) > ({{SPAN_2}})"}. For logging only.
     */
    public String skeleton() {
        StringBuilder sb = new StringBuilder(segments.get(0));
        for (int i = 0; i < spans.size(); i++) {
            sb.append("{{SPAN_").append(i + 1).append("}}");
            sb.append(segments.get(i + 1));
        }
        return sb.toString();
    }
}
