package me.baddcamden.runnersheet.validation;

import java.util.List;

/**
 * Outcome of a full validation pass. A character is valid when no issue has
 * {@link IssueSeverity#ERROR} severity; warnings and info never block.
 */
public record ValidationResult(boolean valid,
                               List<ValidationIssue> issues,
                               int errorCount,
                               int warningCount,
                               int infoCount) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ValidationResult of(List<ValidationIssue> issues) {
        int errors = count(issues, IssueSeverity.ERROR);
        return new ValidationResult(
                errors == 0,
                issues,
                errors,
                count(issues, IssueSeverity.WARNING),
                count(issues, IssueSeverity.INFO));
    }

    public List<ValidationIssue> errors() {
        return filter(IssueSeverity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return filter(IssueSeverity.WARNING);
    }

    public boolean has(IssueCode code) {
        return issues.stream().anyMatch(issue -> issue.code() == code);
    }

    private List<ValidationIssue> filter(IssueSeverity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).toList();
    }

    private static int count(List<ValidationIssue> issues, IssueSeverity severity) {
        return (int) issues.stream().filter(issue -> issue.severity() == severity).count();
    }
}
