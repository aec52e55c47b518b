package com.causalquery.domain.query.model;

import java.util.Objects;

public record PatternReplacement(String pattern, String replacement) {

    public PatternReplacement {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
    }
}
