package com.statute.ledger.registry;

import com.statute.ledger.core.model.ValidationIssue;

import java.util.List;

/**
 * Thrown when a statute with validation issues is offered to the registry.
 */
public class InvalidStatuteException extends RuntimeException {

    private final String statuteId;
    private final List<ValidationIssue> issues;

    public InvalidStatuteException(String statuteId, List<ValidationIssue> issues) {
        super("Statute '" + statuteId + "' is invalid: " + issues);
        this.statuteId = statuteId;
        this.issues = List.copyOf(issues);
    }

    public String getStatuteId() {
        return statuteId;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
