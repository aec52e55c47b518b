package com.causalquery.domain.query.model;

/**
 * How substitution patterns are interpreted.
 */
public enum MatchMode {
    /** Pattern is a plain string, replacement inserted verbatim. */
    LITERAL,
    /** Pattern is a java.util.regex expression, replacement may use group references. */
    REGEX
}
