package com.causalquery.domain.query.exception;

/**
 * A condition string that cannot be parsed, or a digit position outside the node's nodal type.
 */
public class InvalidQueryException extends CausalQueryException {
    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
