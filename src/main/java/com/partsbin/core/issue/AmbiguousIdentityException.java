package com.partsbin.core.issue;

/**
 * Raised while resolving a single source record whose identity cannot be decided automatically.
 * The merger catches it per record and turns it into an {@link IssueType#AMBIGUOUS_IDENTITY} issue.
 */
public class AmbiguousIdentityException extends Exception {

    private final String subject;

    public AmbiguousIdentityException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }

    public StorageIssue toIssue() {
        return StorageIssue.of(IssueType.AMBIGUOUS_IDENTITY, subject, getMessage());
    }
}
