package com.causalquery.infrastructure.expression.text;

import com.causalquery.domain.query.model.MatchMode;
import com.causalquery.domain.query.model.PatternReplacement;
import com.causalquery.domain.query.model.SubstitutionPlan;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Applies a {@link SubstitutionPlan} to a string or a list of strings.
 * Pairs run one after another over the whole input, every occurrence replaced,
 * so a later pattern can match text written by an earlier replacement.
 */
@Component
public class SubstitutionEngine {

    /**
     * @throws com.causalquery.domain.query.exception.ArityMismatchException if the lists differ in length
     */
    public String substitute(String text, List<String> patterns, List<String> replacements, MatchMode mode) {
        return apply(text, SubstitutionPlan.of(patterns, replacements, mode));
    }

    /**
     * @throws com.causalquery.domain.query.exception.ArityMismatchException if the lists differ in length
     */
    public List<String> substitute(List<String> texts, List<String> patterns, List<String> replacements, MatchMode mode) {
        return apply(texts, SubstitutionPlan.of(patterns, replacements, mode));
    }

    public String apply(String text, SubstitutionPlan plan) {
        return apply(List.of(text), plan).get(0);
    }

    public List<String> apply(List<String> texts, SubstitutionPlan plan) {
        String[] result = texts.toArray(new String[0]);
        for (PatternReplacement pair : plan.pairs()) {
            if (plan.mode() == MatchMode.REGEX) {
                Pattern pattern = Pattern.compile(pair.pattern());
                for (int i = 0; i < result.length; i++) {
                    result[i] = pattern.matcher(result[i]).replaceAll(pair.replacement());
                }
            } else {
                for (int i = 0; i < result.length; i++) {
                    result[i] = result[i].replace(pair.pattern(), pair.replacement());
                }
            }
        }
        return List.of(result);
    }
}
