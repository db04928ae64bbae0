package com.classpulse.engage;

import com.classpulse.engage.activity.ActivityService;
import com.classpulse.engage.course.CourseService;
import com.classpulse.engage.domain.DomainModels.Activity;
import com.classpulse.engage.domain.DomainModels.ClassSession;
import com.classpulse.engage.domain.DomainModels.Course;
import com.classpulse.engage.domain.DomainModels.Survey;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.profile.ProfileStore;
import com.classpulse.engage.recommendation.RecommendationModels.MappingInput;
import com.classpulse.engage.recommendation.RecommendationModels.MatchType;
import com.classpulse.engage.recommendation.RecommendationService;
import com.classpulse.engage.session.SessionService;
import com.classpulse.engage.submission.SubmissionModels.SubmissionCommand;
import com.classpulse.engage.submission.SubmissionModels.SubmissionResult;
import com.classpulse.engage.submission.SubmissionService;
import com.classpulse.engage.survey.SurveyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SubmissionServiceTest {
    private static final Map<String, String> VISUAL_ANSWERS = Map.of("q1", "Diagrams", "q2", "Mind map");

    @Autowired
    private SubmissionService submissionService;
    @Autowired
    private SessionService sessionService;
    @Autowired
    private CourseService courseService;
    @Autowired
    private SurveyService surveyService;
    @Autowired
    private ActivityService activityService;
    @Autowired
    private RecommendationService recommendationService;
    @Autowired
    private ProfileStore profileStore;

    private TestFixtures fixtures;
    private Course course;
    private Activity sketch;
    private Activity walk;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures(surveyService, courseService, activityService);
        course = fixtures.course();
        sketch = fixtures.activity("Sketch notes");
        walk = fixtures.activity("Energy walk");
        recommendationService.patchMappings(course.id(), List.of(
                new MappingInput("Visual", "energized", false, sketch.id()),
                new MappingInput(null, "energized", false, walk.id())));
    }

    private static SubmissionCommand student(String id, String mood, Map<String, String> answers) {
        return new SubmissionCommand(id, null, null, mood, answers);
    }

    @Test
    void baselineSubmissionClearsRebaselineForLaterSessions() {
        ClassSession first = sessionService.createSession(course.id(), false, null);
        assertTrue(first.requireSurvey());
        assertNotNull(first.surveySnapshot());

        SubmissionResult result = submissionService.submit(first.joinToken(), student("s-1", "energized", VISUAL_ANSWERS));

        assertFalse(result.requiresRebaseline());
        assertFalse(courseService.get(course.id()).requiresRebaseline());
        assertEquals("Visual", result.learningStyle());
        assertEquals(5, result.scoreResult().totals().get("Visual"));
        assertEquals(sketch.id(), result.recommendation().activity().activityId());
        assertEquals(MatchType.EXACT_MATCH, result.recommendation().matchType());
        assertEquals(result.submissionId(), result.profile().sourceSubmissionId());

        ClassSession second = sessionService.createSession(course.id(), false, null);
        assertFalse(second.requireSurvey());
        assertNull(second.surveySnapshot());
    }

    @Test
    void moodOnlySessionUsesExistingProfile() {
        ClassSession baseline = sessionService.createSession(course.id(), false, null);
        submissionService.submit(baseline.joinToken(), student("s-2", "calm", VISUAL_ANSWERS));
        ClassSession moodOnly = sessionService.createSession(course.id(), false, null);

        SubmissionResult result = submissionService.submit(moodOnly.joinToken(),
                student("s-2", "energized", Map.of("q1", "Listening")));

        assertNull(result.scoreResult());
        assertEquals("Visual", result.learningStyle());
        assertEquals("Visual", result.profile().learningStyle());
        assertEquals(sketch.id(), result.recommendation().activity().activityId());
        assertEquals(1, profileStore.history(course.id(), result.participant()).size());
    }

    @Test
    void participantWithoutProfileGetsMoodDefault() {
        ClassSession baseline = sessionService.createSession(course.id(), false, null);
        submissionService.submit(baseline.joinToken(), student("s-3", "calm", VISUAL_ANSWERS));
        ClassSession moodOnly = sessionService.createSession(course.id(), false, null);

        SubmissionResult result = submissionService.submit(moodOnly.joinToken(),
                new SubmissionCommand(null, "guest-77", "Sam", "energized", null));

        assertNull(result.learningStyle());
        assertNull(result.profile());
        assertEquals(MatchType.MOOD_DEFAULT, result.recommendation().matchType());
        assertEquals(walk.id(), result.recommendation().activity().activityId());
    }

    @Test
    void resubmissionUpdatesTheSameSubmission() {
        ClassSession session = sessionService.createSession(course.id(), false, null);

        SubmissionResult first = submissionService.submit(session.joinToken(), student("s-4", "tired", VISUAL_ANSWERS));
        SubmissionResult again = submissionService.submit(session.joinToken(), student("s-4", "tired", VISUAL_ANSWERS));
        SubmissionResult changed = submissionService.submit(session.joinToken(),
                student("s-4", "energized", Map.of("q1", "Listening", "q2", "Podcast")));

        assertEquals(first.submissionId(), again.submissionId());
        assertEquals(first.recommendation(), again.recommendation());
        assertEquals(first.submissionId(), changed.submissionId());
        assertEquals("Auditory", changed.learningStyle());
        assertEquals(MatchType.MOOD_DEFAULT, changed.recommendation().matchType());

        var submissions = sessionService.submissions(session.id());
        assertEquals(1, submissions.size());
        assertEquals("energized", submissions.get(0).mood());
        assertEquals("Auditory", submissions.get(0).learningStyle());
        assertEquals(1, profileStore.history(course.id(), changed.participant()).stream().filter(p -> p.current()).count());
    }

    @Test
    void answersToReplacedSurveyKeepRebaselineRequired() {
        ClassSession stale = sessionService.createSession(course.id(), false, null);
        Survey replacement = fixtures.survey();
        courseService.update(course.id(), null, replacement.id());

        SubmissionResult result = submissionService.submit(stale.joinToken(), student("s-10", "energized", VISUAL_ANSWERS));

        assertNotNull(result.scoreResult());
        assertTrue(result.requiresRebaseline());
        assertNull(result.profile());
        assertNull(result.learningStyle());
        assertTrue(courseService.get(course.id()).requiresRebaseline());
        assertTrue(profileStore.getCurrent(course.id(), result.participant()).isEmpty());

        ClassSession next = sessionService.createSession(course.id(), false, null);
        assertTrue(next.requireSurvey());
        assertEquals(replacement.id(), next.surveySnapshot().surveyId());

        SubmissionResult fresh = submissionService.submit(next.joinToken(), student("s-10", "energized", VISUAL_ANSWERS));
        assertFalse(fresh.requiresRebaseline());
        assertEquals("Visual", fresh.profile().learningStyle());
    }

    @Test
    void closedSessionRejectsSubmissions() {
        ClassSession session = sessionService.createSession(course.id(), false, null);
        sessionService.close(session.id());

        ConflictException ex = assertThrows(ConflictException.class,
                () -> submissionService.submit(session.joinToken(), student("s-5", "calm", VISUAL_ANSWERS)));

        assertEquals("SESSION_CLOSED", ex.getCode());
        assertTrue(courseService.get(course.id()).requiresRebaseline());
    }

    @Test
    void rejectsUnknownMoodAndMissingAnswers() {
        ClassSession session = sessionService.createSession(course.id(), false, null);

        ValidationException mood = assertThrows(ValidationException.class,
                () -> submissionService.submit(session.joinToken(), student("s-6", "ecstatic", VISUAL_ANSWERS)));
        ValidationException answers = assertThrows(ValidationException.class,
                () -> submissionService.submit(session.joinToken(), student("s-6", "calm", Map.of())));

        assertEquals("UNKNOWN_MOOD", mood.getCode());
        assertEquals("ANSWERS_REQUIRED", answers.getCode());
        assertTrue(sessionService.submissions(session.id()).isEmpty());
        assertTrue(courseService.get(course.id()).requiresRebaseline());
    }

    @Test
    void participantMustBeStudentOrGuest() {
        ClassSession session = sessionService.createSession(course.id(), false, null);

        ValidationException both = assertThrows(ValidationException.class, () -> submissionService.submit(
                session.joinToken(), new SubmissionCommand("s-7", "g-7", null, "calm", VISUAL_ANSWERS)));
        ValidationException neither = assertThrows(ValidationException.class, () -> submissionService.submit(
                session.joinToken(), new SubmissionCommand(" ", null, null, "calm", VISUAL_ANSWERS)));

        assertEquals("INVALID_PARTICIPANT", both.getCode());
        assertEquals("INVALID_PARTICIPANT", neither.getCode());
    }

    @Test
    void unknownJoinTokenIsNotFound() {
        assertThrows(NotFoundException.class,
                () -> submissionService.submit("no-such-token", student("s-8", "calm", VISUAL_ANSWERS)));
    }
}
