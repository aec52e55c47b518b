package com.causalquery.domain.query.model;

import com.causalquery.domain.query.exception.UnknownNodeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a causal model's node to parents mapping.
 * Node order and each node's parent order are preserved from the source map.
 *
 * @param parentsByNode ordered parent names for every node in the model
 */
public record NodeParents(Map<String, List<String>> parentsByNode) {

    public NodeParents {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        parentsByNode.forEach((node, parents) -> copy.put(node, List.copyOf(parents)));
        parentsByNode = Collections.unmodifiableMap(copy);
    }

    public static NodeParents of(Map<String, List<String>> parentsByNode) {
        return new NodeParents(parentsByNode);
    }

    public List<String> nodes() {
        return List.copyOf(parentsByNode.keySet());
    }

    public boolean contains(String node) {
        return parentsByNode.containsKey(node);
    }

    /**
     * @throws UnknownNodeException if the node is not part of the model
     */
    public List<String> parentsOf(String node) {
        List<String> parents = parentsByNode.get(node);
        if (parents == null) {
            throw new UnknownNodeException(List.of(node));
        }
        return parents;
    }
}
