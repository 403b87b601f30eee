package com.partsbin.integration.inventory;

import com.partsbin.core.issue.IssueType;
import com.partsbin.core.issue.StorageIssue;

import java.io.IOException;

/**
 * The inventory system kept failing after every retry.
 */
public class RemoteUnavailableException extends IOException {

    private final String operation;
    private final int attempts;

    public RemoteUnavailableException(String operation, int attempts, Throwable cause) {
        super("Inventory system unavailable for %s after %d attempt(s): %s"
            .formatted(operation, attempts, cause == null ? "unknown error" : cause.getMessage()), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }

    public StorageIssue toIssue() {
        return StorageIssue.of(IssueType.REMOTE_UNAVAILABLE, operation, getMessage());
    }
}
