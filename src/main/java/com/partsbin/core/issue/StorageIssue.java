package com.partsbin.core.issue;

import java.util.Objects;

/**
 * One item a run could not handle automatically.
 *
 * @param type    issue kind
 * @param subject what the issue is about (identity key, category, record description, BOM name)
 * @param detail  human readable explanation
 */
public record StorageIssue(IssueType type, String subject, String detail) {

    public StorageIssue {
        Objects.requireNonNull(type, "type");
        subject = subject == null ? "" : subject;
        detail = detail == null ? "" : detail;
    }

    public static StorageIssue of(IssueType type, String subject, String detail) {
        return new StorageIssue(type, subject, detail);
    }

    @Override
    public String toString() {
        return "%s [%s] %s".formatted(type, subject, detail);
    }
}
