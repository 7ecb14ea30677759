package me.baddcamden.runnersheet.validation;

import java.util.Objects;

/**
 * One finding reported by the validator.
 *
 * @param code     machine-readable code
 * @param severity severity, fixed per code
 * @param category display grouping, fixed per code
 * @param message  short human-readable summary
 * @param details  current and allowed values, may be empty
 * @param itemId   id of the offending item when the issue concerns one, otherwise {@code null}
 */
public record ValidationIssue(IssueCode code,
                              IssueSeverity severity,
                              String category,
                              String message,
                              String details,
                              String itemId) {

    public ValidationIssue {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        category = category == null ? code.category() : category;
        details = details == null ? "" : details;
    }

    public static ValidationIssue of(IssueCode code, String message, String details) {
        return new ValidationIssue(code, code.severity(), code.category(), message, details, null);
    }

    public static ValidationIssue forItem(IssueCode code, String message, String details, String itemId) {
        return new ValidationIssue(code, code.severity(), code.category(), message, details, itemId);
    }
}
