package com.causalquery.infrastructure.expression.text;

import com.causalquery.domain.query.model.BoundaryMatch;
import com.causalquery.domain.query.model.MaskedExpression;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cuts spans out of an expression so they can be rewritten and put back.
 * Span slots are tracked by index, no marker text is written into the expression.
 */
@Slf4j
@Component
public class SpanMasker {

    /**
     * Mask the given spans.
     * Spans are sorted by start position; a span overlapping an earlier kept span is skipped.
     *
     * @param text  the original text
     * @param spans spans found in the text
     * @return the literal segments and the spans that were masked
     */
    public MaskedExpression mask(String text, List<BoundaryMatch> spans) {
        if (spans == null || spans.isEmpty()) {
            return new MaskedExpression(List.of(text), List.of());
        }

        List<BoundaryMatch> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(BoundaryMatch::start).thenComparingInt(BoundaryMatch::end));

        List<String> segments = new ArrayList<>();
        List<BoundaryMatch> kept = new ArrayList<>();
        int lastEnd = 0;

        for (BoundaryMatch span : sorted) {
            if (!kept.isEmpty() && span.start() < lastEnd) {
                log.debug("Span [{}, {}) overlaps an earlier span, not masked", span.start(), span.end());
                continue;
            }
            // Text before this span
            segments.add(text.substring(lastEnd, span.start()));
            kept.add(span);
            lastEnd = span.end();
        }

        // Remaining text
        segments.add(text.substring(lastEnd));

        return new MaskedExpression(segments, kept);
    }
}
