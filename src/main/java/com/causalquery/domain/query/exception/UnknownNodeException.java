package com.causalquery.domain.query.exception;

import java.util.Collection;
import java.util.List;

public class UnknownNodeException extends CausalQueryException {

    private final List<String> unknownNodes;

    public UnknownNodeException(Collection<String> unknownNodes) {
        super("One or more names in `position` not found in model: " + unknownNodes);
        this.unknownNodes = List.copyOf(unknownNodes);
    }

    public List<String> getUnknownNodes() {
        return unknownNodes;
    }
}
