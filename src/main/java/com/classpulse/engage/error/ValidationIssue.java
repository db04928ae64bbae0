package com.classpulse.engage.error;

public record ValidationIssue(String code, String message, String ref) {
}
