package com.causalquery.domain.query.model;

import com.causalquery.domain.query.exception.ArityMismatchException;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of pattern/replacement pairs.
 * Pairs are applied in declaration order; each pair sees the text produced by the previous ones.
 *
 * @param pairs the pairs in application order
 * @param mode  how every pattern in the plan is matched
 */
public record SubstitutionPlan(
        List<PatternReplacement> pairs,
        MatchMode mode
) {
    public SubstitutionPlan {
        pairs = List.copyOf(pairs);
        if (mode == null) {
            mode = MatchMode.LITERAL;
        }
    }

    /**
     * Zip two parallel lists into a plan.
     *
     * @throws ArityMismatchException if the lists differ in length
     */
    public static SubstitutionPlan of(List<String> patterns, List<String> replacements, MatchMode mode) {
        if (patterns.size() != replacements.size()) {
            throw new ArityMismatchException(patterns.size(), replacements.size());
        }
        List<PatternReplacement> pairs = new ArrayList<>(patterns.size());
        for (int i = 0; i < patterns.size(); i++) {
            pairs.add(new PatternReplacement(patterns.get(i), replacements.get(i)));
        }
        return new SubstitutionPlan(pairs, mode);
    }

    public static SubstitutionPlan literal(List<String> patterns, List<String> replacements) {
        return of(patterns, replacements, MatchMode.LITERAL);
    }

    public static SubstitutionPlan regex(List<String> patterns, List<String> replacements) {
        return of(patterns, replacements, MatchMode.REGEX);
    }

    public int size() {
        return pairs.size();
    }
}
