package com.causalquery.infrastructure.expression.text;

import com.causalquery.domain.query.model.BoundaryMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds substrings bounded by a left boundary pattern and a right boundary pattern.
 *
 * Pairing is a shallow heuristic, not a bracket matcher: every right boundary is paired
 * with the closest left boundary that starts before it. A right boundary that directly
 * follows another one (e.g. the second bracket of {@code "[["}) is ignored, and a right
 * boundary with no preceding left boundary produces no span.
 */
@Slf4j
@Component
public class SpanExtractor {

    /**
     * Default left boundary: any punctuation except underscore, or a word boundary.
     */
    public static final Pattern NAME_START = Pattern.compile("[\\p{Punct}&&[^_]]|\\b");

    /**
     * Default right boundary: an opening square bracket.
     */
    public static final Pattern INDEX_OPEN = Pattern.compile("\\[");

    /**
     * Names being indexed by square brackets, e.g. {@code "XX"} twice for
     * {@code "(XX[Y=0] == 1) > (XX[Y=1] == 0)"}.
     *
     * @param text the expression
     * @return indexed names in order of appearance
     */
    public List<String> indexedNames(String text) {
        return extract(text, NAME_START, INDEX_OPEN, 0, 0).stream()
                .map(BoundaryMatch::text)
                .toList();
    }

    /**
     * Extract bounded spans.
     * Each span runs from the start of its left boundary plus {@code trimLeft} characters
     * up to the start of its right boundary minus {@code trimRight} characters.
     *
     * @param text      the input text
     * @param left      left boundary pattern
     * @param right     right boundary pattern
     * @param trimLeft  characters dropped after the left boundary start (e.g. 1 to skip an opening parenthesis)
     * @param trimRight characters dropped before the right boundary start
     * @return spans ordered by their right boundary; empty when no valid span exists
     */
    public List<BoundaryMatch> extract(String text, Pattern left, Pattern right, int trimLeft, int trimRight) {
        if (text == null) {
            throw new IllegalArgumentException("`text` must be a string.");
        }

        List<RawMatch> stops = dropConsecutive(findAll(right, text));
        List<RawMatch> starts = findAll(left, text);

        List<BoundaryMatch> spans = new ArrayList<>();
        for (RawMatch stop : stops) {
            RawMatch start = closestPreceding(starts, stop.start);
            if (start == null) {
                log.debug("No left boundary before right boundary at {}, dropping", stop.start);
                continue;
            }
            int spanStart = start.start + trimLeft;
            int spanEnd = stop.start - trimRight;
            if (spanStart > spanEnd) {
                log.debug("Trimmed span bounds cross (start={}, end={}), dropping", spanStart, spanEnd);
                continue;
            }
            spans.add(new BoundaryMatch(spanStart, spanEnd, text.substring(spanStart, spanEnd)));
        }

        return spans;
    }

    private List<RawMatch> findAll(Pattern pattern, String text) {
        List<RawMatch> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(new RawMatch(matcher.start(), matcher.end()));
        }
        return matches;
    }

    // Only the first of a run of back-to-back boundaries counts.
    private List<RawMatch> dropConsecutive(List<RawMatch> matches) {
        List<RawMatch> result = new ArrayList<>();
        for (int i = 0; i < matches.size(); i++) {
            if (i > 0 && matches.get(i).start == matches.get(i - 1).end) {
                continue;
            }
            result.add(matches.get(i));
        }
        return result;
    }

    private RawMatch closestPreceding(List<RawMatch> candidates, int position) {
        RawMatch closest = null;
        for (RawMatch candidate : candidates) {
            if (candidate.start >= position) {
                break;
            }
            closest = candidate;
        }
        return closest;
    }

    private record RawMatch(int start, int end) {}
}
