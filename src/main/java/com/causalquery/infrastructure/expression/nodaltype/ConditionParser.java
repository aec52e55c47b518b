package com.causalquery.infrastructure.expression.nodaltype;

import com.causalquery.domain.query.exception.InvalidQueryException;
import com.causalquery.domain.query.model.ConditionQuery;
import com.causalquery.domain.query.model.ParentAssignment;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses conditions of the form {@code "X | Z=0 & R=1"}. Whitespace is ignored everywhere.
 */
@Component
public class ConditionParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern OPERATOR = Pattern.compile("([|&=])");

    /**
     * Canonical spacing: no whitespace except one space around each {@code |}, {@code &} and {@code =}.
     * {@code "X|Z=0&R =1"} becomes {@code "X | Z = 0 & R = 1"}.
     */
    public String clean(String condition) {
        String stripped = WHITESPACE.matcher(condition).replaceAll("");
        return OPERATOR.matcher(stripped).replaceAll(" $1 ");
    }

    /**
     * @throws InvalidQueryException if the node is missing or a constraint is not {@code parent=integer}
     */
    public ConditionQuery parse(String condition) {
        if (condition == null) {
            throw new InvalidQueryException("Condition must not be null");
        }
        String stripped = WHITESPACE.matcher(condition).replaceAll("");

        int bar = stripped.indexOf('|');
        String node = bar < 0 ? stripped : stripped.substring(0, bar);
        String given = bar < 0 ? "" : stripped.substring(bar + 1);
        if (node.isEmpty()) {
            throw new InvalidQueryException("Condition has no node before '|': " + condition);
        }

        Set<ParentAssignment> constraints = new LinkedHashSet<>();
        if (!given.isEmpty()) {
            for (String term : given.split("&", -1)) {
                constraints.add(parseAssignment(term, condition));
            }
        }

        return new ConditionQuery(condition, node, constraints);
    }

    private ParentAssignment parseAssignment(String term, String condition) {
        String[] sides = term.split("=", -1);
        if (sides.length != 2 || sides[0].isEmpty() || sides[1].isEmpty()) {
            throw new InvalidQueryException(
                    String.format("Expected 'parent=value' but found '%s' in condition: %s", term, condition));
        }
        try {
            return new ParentAssignment(sides[0], Integer.parseInt(sides[1]));
        } catch (NumberFormatException e) {
            throw new InvalidQueryException(
                    String.format("Value of '%s' is not an integer in condition: %s", sides[0], condition), e);
        }
    }
}
