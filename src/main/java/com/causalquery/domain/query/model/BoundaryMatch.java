package com.causalquery.domain.query.model;

/**
 * Value object for one bounded span found inside a source string.
 *
 * @param start start offset (inclusive) in the source string
 * @param end   end offset (exclusive) in the source string
 * @param text  the substring between start and end
 */
public record BoundaryMatch(
        int start,
        int end,
        String text
) {
    public BoundaryMatch {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    String.format("Invalid span bounds: start=%d, end=%d", start, end));
        }
    }

    public boolean overlaps(BoundaryMatch other) {
        return start < other.end && other.start < end;
    }
}
