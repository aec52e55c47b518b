package com.causalquery.domain.query.exception;

public class ArityMismatchException extends CausalQueryException {

    public ArityMismatchException(int patternCount, int replacementCount) {
        super(String.format("Pattern and replacement lists must be the same length (patterns=%d, replacements=%d).",
                patternCount, replacementCount));
    }

    public ArityMismatchException(String message) {
        super(message);
    }
}
