package com.causalquery.domain.query.model;

/**
 * A single {@code parent = value} statement.
 */
public record ParentAssignment(String parent, int value) {

    @Override
    public String toString() {
        return parent + " = " + value;
    }
}
