package com.classpulse.engage.survey;

import com.classpulse.engage.domain.DomainModels.SurveyOption;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.classpulse.engage.error.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class SurveyDefinitionValidator {
    public static final int MAX_OPTION_SCORE = 1000;

    public List<ValidationIssue> validate(String title, String creatorName, List<SurveyQuestion> questions) {
        List<ValidationIssue> issues = new ArrayList<>();

        if (title == null || title.isBlank()) {
            issues.add(new ValidationIssue("MISSING_TITLE", "Survey title is required", "title"));
        }
        if (creatorName == null || creatorName.isBlank()) {
            issues.add(new ValidationIssue("MISSING_CREATOR", "Survey creator name is required", "creatorName"));
        }
        if (questions == null || questions.isEmpty()) {
            issues.add(new ValidationIssue("NO_QUESTIONS", "Survey needs at least one question", "questions"));
            return issues;
        }

        duplicate(questions.stream().map(q -> new Row(q.id(), "question")).toList(), "DUPLICATE_QUESTION", issues);

        for (int i = 0; i < questions.size(); i++) {
            SurveyQuestion q = questions.get(i);
            String ref = q.id() == null || q.id().isBlank() ? "questions[" + i + "]" : q.id();
            if (q.id() == null || q.id().isBlank()) {
                issues.add(new ValidationIssue("MISSING_QUESTION_ID", "Question at position " + i + " has no id", ref));
            }
            if (q.options() == null || q.options().isEmpty()) {
                issues.add(new ValidationIssue("NO_OPTIONS", "Question has no options: " + ref, ref));
                continue;
            }
            duplicate(q.options().stream().map(o -> new Row(o.label(), "option label in " + ref)).toList(), "DUPLICATE_OPTION", issues);
            q.options().forEach(o -> validateOption(o, ref, issues));
        }

        return issues;
    }

    private void validateOption(SurveyOption option, String questionRef, List<ValidationIssue> issues) {
        if (option.label() == null || option.label().isBlank()) {
            issues.add(new ValidationIssue("MISSING_OPTION_LABEL", "Option without label in question " + questionRef, questionRef));
        }
        if (option.scores() == null) return;
        option.scores().forEach((category, score) -> {
            if (category == null || category.isBlank()) {
                issues.add(new ValidationIssue("MISSING_CATEGORY", "Blank score category in question " + questionRef, questionRef));
            } else if (score == null || score < 0) {
                issues.add(new ValidationIssue("NEGATIVE_SCORE", "Score for " + category + " must be a non-negative number in question " + questionRef, questionRef));
            } else if (score > MAX_OPTION_SCORE) {
                issues.add(new ValidationIssue("SCORE_TOO_LARGE", "Score for " + category + " exceeds " + MAX_OPTION_SCORE + " in question " + questionRef, questionRef));
            }
        });
    }

    private void duplicate(List<Row> rows, String code, List<ValidationIssue> issues) {
        Map<String, Long> counts = rows.stream().filter(r -> r.id() != null)
                .collect(Collectors.groupingBy(Row::id, Collectors.counting()));
        Set<String> reported = new HashSet<>();
        rows.forEach(r -> {
            if (r.id() != null && counts.getOrDefault(r.id(), 0L) > 1 && reported.add(r.id())) {
                issues.add(new ValidationIssue(code, "Duplicate " + r.block() + ": " + r.id(), r.id()));
            }
        });
    }

    private record Row(String id, String block) {}
}
