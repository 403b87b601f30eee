package com.partsbin.core.issue;

/**
 * A source record is missing a required field or carries an invalid one.
 */
public class MalformedRecordException extends Exception {

    private final String subject;

    public MalformedRecordException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }

    public StorageIssue toIssue() {
        return StorageIssue.of(IssueType.MALFORMED_RECORD, subject, getMessage());
    }
}
