package com.classpulse.engage;

import com.classpulse.engage.domain.DomainModels.SurveyOption;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.classpulse.engage.error.ValidationIssue;
import com.classpulse.engage.survey.SurveyDefinitionValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.classpulse.engage.TestFixtures.scores;
import static org.junit.jupiter.api.Assertions.*;

class SurveyDefinitionValidatorTest {
    private final SurveyDefinitionValidator validator = new SurveyDefinitionValidator();

    private static List<String> codes(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::code).toList();
    }

    @Test
    void acceptsWellFormedSurvey() {
        assertTrue(validator.validate("Styles", "Ms. Rivera", TestFixtures.learningStyleQuestions()).isEmpty());
    }

    @Test
    void requiresTitleCreatorAndQuestions() {
        List<String> codes = codes(validator.validate(" ", null, List.of()));

        assertEquals(List.of("MISSING_TITLE", "MISSING_CREATOR", "NO_QUESTIONS"), codes);
    }

    @Test
    void reportsEveryStructuralProblem() {
        List<SurveyQuestion> questions = List.of(
                new SurveyQuestion("q1", "First", List.of(
                        new SurveyOption(null, "Same", scores("Visual", 1)),
                        new SurveyOption(null, "Same", scores("Visual", -1)))),
                new SurveyQuestion("q1", "Duplicate id", List.of(new SurveyOption(null, "", scores("Auditory", 1)))),
                new SurveyQuestion(null, "No id", List.of()));

        List<String> codes = codes(validator.validate("Styles", "Ms. Rivera", questions));

        assertTrue(codes.contains("DUPLICATE_QUESTION"));
        assertTrue(codes.contains("DUPLICATE_OPTION"));
        assertTrue(codes.contains("NEGATIVE_SCORE"));
        assertTrue(codes.contains("MISSING_OPTION_LABEL"));
        assertTrue(codes.contains("MISSING_QUESTION_ID"));
        assertTrue(codes.contains("NO_OPTIONS"));
    }

    @Test
    void capsOptionScores() {
        List<SurveyQuestion> questions = List.of(new SurveyQuestion("q1", "Pick", List.of(
                new SurveyOption(null, "At cap", scores("Visual", SurveyDefinitionValidator.MAX_OPTION_SCORE)),
                new SurveyOption(null, "Too much", scores("Visual", Integer.MAX_VALUE)))));

        assertEquals(List.of("SCORE_TOO_LARGE"), codes(validator.validate("Styles", "Ms. Rivera", questions)));
    }
}
