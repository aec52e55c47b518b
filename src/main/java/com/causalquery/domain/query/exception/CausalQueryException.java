package com.causalquery.domain.query.exception;

public class CausalQueryException extends RuntimeException {

    public CausalQueryException(String message) {
        super(message);
    }

    public CausalQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
