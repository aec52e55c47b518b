package com.causalquery.infrastructure.expression.wildcard;

import com.causalquery.domain.query.model.BoundaryMatch;
import com.causalquery.domain.query.model.DigitGrid;
import com.causalquery.domain.query.model.MaskedExpression;
import com.causalquery.domain.query.model.SubstitutionPlan;
import com.causalquery.infrastructure.expression.grid.DigitPermutationGenerator;
import com.causalquery.infrastructure.expression.text.SpanExtractor;
import com.causalquery.infrastructure.expression.text.SpanMasker;
import com.causalquery.infrastructure.expression.text.SubstitutionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands the wildcard {@code .} in causal queries, e.g. {@code M=.} into {@code M=0} and {@code M=1}.
 *
 * Parentheses decide the scope of an expansion:
 * <ul>
 *   <li>{@code (Y[X=1, M=.] > Y[X=1, M=.])} expands the whole statement (global expansion)</li>
 *   <li>{@code (Y[X=1, M=.]) > (Y[X=1, M=.])} expands each group separately (local expansion)</li>
 *   <li>without parentheses the whole expression is one group</li>
 * </ul>
 * Inside a group every distinct wildcard variable doubles the number of variants.
 * Variants are then either joined inside the group with the join operator, or, with no
 * join operator, combined across groups into one expression per combination.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WildcardExpander {

    private static final Pattern OPEN_PAREN = Pattern.compile("\\(");
    private static final Pattern CLOSE_PAREN = Pattern.compile("\\)");

    // group 1: the variable being assigned the wildcard
    private static final Pattern WILDCARD_ASSIGNMENT = Pattern.compile("(\\w+)\\s*=\\s*\\.");

    private final SpanExtractor spanExtractor;
    private final SpanMasker spanMasker;
    private final SubstitutionEngine substitutionEngine;
    private final DigitPermutationGenerator permutationGenerator;

    /**
     * Expand and join the variants of each group with {@code " <joinOperator> "}.
     */
    public String expandJoined(String expression, String joinOperator, boolean verbose) {
        if (joinOperator == null) {
            throw new IllegalArgumentException("joinOperator must not be null for joined expansion");
        }
        return expand(expression, joinOperator, verbose).get(0);
    }

    /**
     * Expand into one expression per combination of group variants.
     */
    public List<String> expandCombinations(String expression, boolean verbose) {
        return expand(expression, null, verbose);
    }

    /**
     * @param expression   the query, possibly holding wildcards
     * @param joinOperator operator joining variants inside each group; {@code null} selects
     *                     one output per combination of group variants
     * @param verbose      log the generated expressions at INFO
     * @return one expression in joined mode, all combinations otherwise
     */
    public List<String> expand(String expression, String joinOperator, boolean verbose) {
        List<BoundaryMatch> groups = spanExtractor.extract(expression, OPEN_PAREN, CLOSE_PAREN, 1, 0);
        if (groups.isEmpty()) {
            if (verbose) {
                log.info("No parentheses indicated. Global expansion assumed.");
            }
            groups = List.of(new BoundaryMatch(0, expression.length(), expression));
        }

        MaskedExpression masked = spanMasker.mask(expression, groups);
        log.debug("Expanding {} group(s) of skeleton {}", masked.spans().size(), masked.skeleton());

        List<List<String>> variants = masked.spans().stream()
                .map(span -> variantsOf(span.text()))
                .toList();

        List<String> expanded = joinOperator != null
                ? List.of(joinVariants(masked, variants, joinOperator))
                : combineVariants(masked, variants);

        if (verbose) {
            log.info("Generated expanded expression:\n{}", String.join("\n", expanded));
        }
        return expanded;
    }

    /**
     * All concrete versions of one group, in digit-grid order over its wildcard variables.
     * A group without wildcards has itself as its only variant.
     */
    List<String> variantsOf(String group) {
        if (group.indexOf('.') < 0) {
            return List.of(group);
        }

        // Cut the group right after each "<var>=" that precedes a wildcard, dropping the dot
        List<String> pieces = new ArrayList<>();
        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = WILDCARD_ASSIGNMENT.matcher(group);
        int last = 0;
        while (matcher.find()) {
            pieces.add(group.substring(last, matcher.end() - 1));
            variables.add(matcher.group(1));
            last = matcher.end();
        }
        if (variables.isEmpty()) {
            return List.of(group);
        }
        pieces.add(group.substring(last));

        List<String> names = List.copyOf(variables);
        List<String> patterns = names.stream()
                .map(name -> "(?<!\\w)" + Pattern.quote(name) + "\\s*=\\s*$")
                .toList();

        DigitGrid values = permutationGenerator.binary(names.size());
        List<String> variants = new ArrayList<>(values.rowCount());
        for (int r = 0; r < values.rowCount(); r++) {
            List<String> replacements = new ArrayList<>(names.size());
            for (int c = 0; c < names.size(); c++) {
                replacements.add(Matcher.quoteReplacement(names.get(c) + "=" + values.value(r, c)));
            }
            List<String> substituted = substitutionEngine.apply(pieces, SubstitutionPlan.regex(patterns, replacements));
            variants.add(String.join("", substituted));
        }
        return variants;
    }

    private String joinVariants(MaskedExpression masked, List<List<String>> variants, String joinOperator) {
        String separator = " " + joinOperator + " ";
        List<String> fills = variants.stream()
                .map(v -> String.join(separator, v))
                .toList();
        return masked.restore(fills);
    }

    // First group varies fastest, same order as the digit grid
    private List<String> combineVariants(MaskedExpression masked, List<List<String>> variants) {
        int[] maxima = variants.stream().mapToInt(v -> v.size() - 1).toArray();
        DigitGrid choices = permutationGenerator.generate(maxima);

        List<String> combinations = new ArrayList<>(choices.rowCount());
        for (int r = 0; r < choices.rowCount(); r++) {
            List<String> fills = new ArrayList<>(variants.size());
            for (int g = 0; g < variants.size(); g++) {
                fills.add(variants.get(g).get(choices.value(r, g)));
            }
            combinations.add(masked.restore(fills));
        }
        return combinations;
    }
}
