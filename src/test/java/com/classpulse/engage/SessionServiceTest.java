package com.classpulse.engage;

import com.classpulse.engage.activity.ActivityService;
import com.classpulse.engage.course.CourseService;
import com.classpulse.engage.domain.DomainModels.ClassSession;
import com.classpulse.engage.domain.DomainModels.Course;
import com.classpulse.engage.domain.DomainModels.SessionState;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.session.SessionModels.Dashboard;
import com.classpulse.engage.session.SessionModels.JoinView;
import com.classpulse.engage.session.SessionService;
import com.classpulse.engage.submission.SubmissionModels.SubmissionCommand;
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
class SessionServiceTest {
    @Autowired
    private SessionService sessionService;
    @Autowired
    private SubmissionService submissionService;
    @Autowired
    private CourseService courseService;
    @Autowired
    private SurveyService surveyService;
    @Autowired
    private ActivityService activityService;

    private TestFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures(surveyService, courseService, activityService);
    }

    @Test
    void newSessionFreezesSurveyAndMoodCheck() {
        Course course = fixtures.course();

        ClassSession session = sessionService.createSession(course.id(), false, "  Ready?  ");

        assertEquals(SessionState.OPEN, session.state());
        assertEquals("Ready?", session.moodCheck().prompt());
        assertEquals(TestFixtures.MOODS, session.moodCheck().options());
        assertEquals(16, session.joinToken().length());
        assertEquals("http://localhost:5173/join?s=" + session.joinToken(), sessionService.view(session).qrUrl());

        courseService.replaceMoodLabels(course.id(), List.of("other"));
        assertEquals(TestFixtures.MOODS, sessionService.get(session.id()).moodCheck().options());
    }

    @Test
    void defaultPromptAndTeacherRequestedSurvey() {
        Course course = fixtures.course();
        ClassSession baseline = sessionService.createSession(course.id(), false, null);
        submissionService.submit(baseline.joinToken(),
                new SubmissionCommand("s-1", null, null, "calm", Map.of("q1", "Trying it")));

        ClassSession requested = sessionService.createSession(course.id(), true, "");

        assertEquals("How are you feeling today?", requested.moodCheck().prompt());
        assertTrue(requested.requireSurvey());
        assertEquals(course.baselineSurveyId(), requested.surveySnapshot().surveyId());
    }

    @Test
    void courseWithoutBaselineSurvey() {
        Course course = courseService.create(TestFixtures.unique("Art"), null, TestFixtures.MOODS);

        assertFalse(sessionService.createSession(course.id(), false, null).requireSurvey());
        ValidationException ex = assertThrows(ValidationException.class,
                () -> sessionService.createSession(course.id(), true, null));
        assertEquals("COURSE_BASELINE_NOT_SET", ex.getCode());
    }

    @Test
    void joinViewHidesScores() {
        Course course = fixtures.course();
        ClassSession session = sessionService.createSession(course.id(), false, null);

        JoinView view = sessionService.joinByToken(session.joinToken());

        assertEquals(course.title(), view.courseTitle());
        assertTrue(view.requireSurvey());
        assertEquals(2, view.survey().questions().size());
        assertEquals("q2_mind_map", view.survey().questions().get(1).options().get(0).optionId());
    }

    @Test
    void closeIsOneWay() {
        Course course = fixtures.course();
        ClassSession session = sessionService.createSession(course.id(), false, null);

        ClassSession closed = sessionService.close(session.id());

        assertEquals(SessionState.CLOSED, closed.state());
        assertNotNull(closed.closedAt());
        ConflictException again = assertThrows(ConflictException.class, () -> sessionService.close(session.id()));
        assertEquals("SESSION_ALREADY_CLOSED", again.getCode());
        ConflictException join = assertThrows(ConflictException.class, () -> sessionService.joinByToken(session.joinToken()));
        assertEquals("SESSION_CLOSED", join.getCode());
        assertThrows(NotFoundException.class, () -> sessionService.joinByToken("unknown-token"));
    }

    @Test
    void dashboardSummarisesMoodsAndStyles() {
        Course course = fixtures.course();
        ClassSession session = sessionService.createSession(course.id(), false, null);
        submissionService.submit(session.joinToken(),
                new SubmissionCommand("s-1", null, null, "calm", Map.of("q1", "Listening")));
        submissionService.submit(session.joinToken(),
                new SubmissionCommand(null, "g-1", "Guest Kim", "calm", Map.of("q1", "Diagrams")));
        submissionService.submit(session.joinToken(),
                new SubmissionCommand("s-2", null, null, "tired", Map.of("q1", "Trying it")));

        Dashboard dashboard = sessionService.dashboard(session.id());

        assertEquals(Map.of("energized", 0, "calm", 2, "tired", 1), dashboard.moodSummary());
        assertEquals(3, dashboard.participants().size());
        assertEquals("Auditory", dashboard.participants().get(0).learningStyle());
        assertEquals("Guest Kim", dashboard.participants().get(1).guestName());
        assertEquals("Kinesthetic", dashboard.participants().get(2).learningStyle());
        assertEquals(1, sessionService.listForCourse(course.id()).size());
    }
}
