package com.causalquery.domain.query.exception;

public class ConflictingArgumentsException extends CausalQueryException {
    public ConflictingArgumentsException() {
        super("Must specify either `condition` or `position`, but not both.");
    }
}
