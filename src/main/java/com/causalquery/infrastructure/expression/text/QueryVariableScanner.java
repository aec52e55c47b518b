package com.causalquery.infrastructure.expression.text;

import com.causalquery.domain.query.model.NodeParents;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds which model nodes a query mentions as whole words.
 */
@Component
public class QueryVariableScanner {

    public boolean includesVariable(String variable, String query) {
        return Pattern.compile("\\b" + Pattern.quote(variable) + "\\b").matcher(query).find();
    }

    /**
     * @return the model's nodes that appear in the query, in model order
     */
    public List<String> variablesIn(NodeParents model, String query) {
        return model.nodes().stream()
                .filter(node -> includesVariable(node, query))
                .toList();
    }
}
