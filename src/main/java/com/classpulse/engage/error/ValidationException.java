package com.classpulse.engage.error;

import java.util.List;

public class ValidationException extends EngageException {
    private final List<ValidationIssue> issues;

    public ValidationException(String code, String message) {
        this(List.of(new ValidationIssue(code, message, null)));
    }

    public ValidationException(List<ValidationIssue> issues) {
        super(issues.size() == 1 ? issues.get(0).code() : "VALIDATION_ERROR", summarize(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String summarize(List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return "Invalid input";
        }
        if (issues.size() == 1) {
            return issues.get(0).message();
        }
        return issues.size() + " validation problems, first: " + issues.get(0).message();
    }
}
