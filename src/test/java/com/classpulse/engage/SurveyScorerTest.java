package com.classpulse.engage;

import com.classpulse.engage.domain.DomainModels.*;
import com.classpulse.engage.survey.SurveyModels.ScoreResult;
import com.classpulse.engage.survey.SurveyScorer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.classpulse.engage.TestFixtures.scores;
import static org.junit.jupiter.api.Assertions.*;

class SurveyScorerTest {
    private final SurveyScorer scorer = new SurveyScorer();

    private static SurveySnapshot snapshot(List<SurveyQuestion> questions) {
        return new SurveySnapshot("survey-1", "Styles", questions);
    }

    @Test
    void selectedOptionDecidesDominantCategory() {
        SurveySnapshot snapshot = snapshot(List.of(new SurveyQuestion("q1", "Pick one", List.of(
                new SurveyOption(null, "Pictures", scores("A", 2)),
                new SurveyOption(null, "Sounds", scores("B", 3))))));

        ScoreResult result = scorer.score(snapshot, Map.of("q1", "Sounds"));

        assertEquals(scores("A", 0, "B", 3), result.totals());
        assertEquals(List.of("A", "B"), List.copyOf(result.totals().keySet()));
        assertEquals("B", result.dominantCategory());
    }

    @Test
    void tieGoesToFirstEncounteredCategory() {
        SurveySnapshot snapshot = snapshot(List.of(new SurveyQuestion("q1", "Pick one", List.of(
                new SurveyOption(null, "Both", scores("Visual", 2, "Auditory", 2))))));

        ScoreResult result = scorer.score(snapshot, Map.of("q1", "Both"));

        assertEquals("Visual", result.dominantCategory());
    }

    @Test
    void noAnswersMeansNoDominantCategory() {
        SurveySnapshot snapshot = snapshot(TestFixtures.learningStyleQuestions());

        ScoreResult result = scorer.score(snapshot, Map.of());

        assertNull(result.dominantCategory());
        assertEquals("none", result.dominantLabel());
        assertTrue(result.totals().values().stream().allMatch(v -> v == 0));
        assertEquals(List.of("Visual", "Auditory", "Kinesthetic"), List.copyOf(result.totals().keySet()));
    }

    @Test
    void emptySnapshotScoresToNothing() {
        ScoreResult result = scorer.score(snapshot(List.of()), Map.of("q1", "anything"));

        assertTrue(result.totals().isEmpty());
        assertNull(result.dominantCategory());
    }

    @Test
    void unmatchedAnswersAndUnknownQuestionsAreIgnored() {
        SurveySnapshot snapshot = snapshot(TestFixtures.learningStyleQuestions());

        ScoreResult result = scorer.score(snapshot, Map.of("q1", "diagrams", "q9", "Diagrams", "q2", "Podcast"));

        assertEquals(0, result.totals().get("Visual"));
        assertEquals(2, result.totals().get("Auditory"));
        assertEquals("Auditory", result.dominantCategory());
    }

    @Test
    void optionCanBeSelectedById() {
        SurveySnapshot snapshot = snapshot(TestFixtures.learningStyleQuestions());

        ScoreResult result = scorer.score(snapshot, Map.of("q1", "Trying it", "q2", "q2_mind_map"));

        assertEquals(scores("Visual", 2, "Auditory", 0, "Kinesthetic", 4), result.totals());
        assertEquals("Kinesthetic", result.dominantCategory());
    }

    @Test
    void dominantCategoryIsAlwaysAKnownCategory() {
        SurveySnapshot snapshot = snapshot(TestFixtures.learningStyleQuestions());
        List<String> categories = scorer.categories(snapshot.questions());
        String[] q1 = {"Diagrams", "Listening", "Trying it", "nothing"};
        String[] q2 = {"Mind map", "Podcast", "q2_podcast", ""};

        for (String a : q1) {
            for (String b : q2) {
                ScoreResult result = scorer.score(snapshot, Map.of("q1", a, "q2", b));
                assertTrue(result.dominantCategory() == null || categories.contains(result.dominantCategory()),
                        "unexpected dominant category " + result.dominantCategory());
            }
        }
    }

    @Test
    void answerDetailsDescribeMatchedAnswersOnly() {
        SurveySnapshot snapshot = snapshot(TestFixtures.learningStyleQuestions());

        Map<String, AnswerDetail> details = scorer.answerDetails(snapshot, Map.of("q1", "Listening", "q2", "Nope"));

        assertEquals(1, details.size());
        AnswerDetail detail = details.get("q1");
        assertEquals("How do you remember a new topic best?", detail.questionText());
        assertEquals("q1_opt_1", detail.selectedOptionId());
        assertEquals("Listening", detail.selectedOptionText());
        assertEquals(3, detail.options().size());
    }

    @Test
    void overflowingTotalsFailInsteadOfWrapping() {
        SurveySnapshot snapshot = snapshot(List.of(
                new SurveyQuestion("q1", "First", List.of(new SurveyOption(null, "Max", scores("A", Integer.MAX_VALUE)))),
                new SurveyQuestion("q2", "Second", List.of(new SurveyOption(null, "Max", scores("A", Integer.MAX_VALUE))))));

        assertThrows(ArithmeticException.class, () -> scorer.score(snapshot, Map.of("q1", "Max", "q2", "Max")));
    }
}
