package com.classpulse.engage.session;

import com.classpulse.engage.baseline.BaselineTracker;
import com.classpulse.engage.config.EngageProperties;
import com.classpulse.engage.course.CourseService;
import com.classpulse.engage.domain.DomainModels.*;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.profile.ProfileStore;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendationQuery;
import com.classpulse.engage.recommendation.RecommendationService;
import com.classpulse.engage.repository.SessionJdbcRepository;
import com.classpulse.engage.repository.SubmissionJdbcRepository;
import com.classpulse.engage.session.SessionModels.*;
import com.classpulse.engage.survey.SurveyScorer;
import com.classpulse.engage.survey.SurveyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Service
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final int TOKEN_ATTEMPTS = 5;

    private final SessionJdbcRepository repository;
    private final SubmissionJdbcRepository submissionRepository;
    private final CourseService courseService;
    private final SurveyService surveyService;
    private final SurveyScorer scorer;
    private final BaselineTracker baselineTracker;
    private final ProfileStore profileStore;
    private final RecommendationService recommendationService;
    private final JoinTokenGenerator tokenGenerator;
    private final EngageProperties properties;

    public SessionService(SessionJdbcRepository repository,
                          SubmissionJdbcRepository submissionRepository,
                          CourseService courseService,
                          SurveyService surveyService,
                          SurveyScorer scorer,
                          BaselineTracker baselineTracker,
                          ProfileStore profileStore,
                          RecommendationService recommendationService,
                          JoinTokenGenerator tokenGenerator,
                          EngageProperties properties) {
        this.repository = repository;
        this.submissionRepository = submissionRepository;
        this.courseService = courseService;
        this.surveyService = surveyService;
        this.scorer = scorer;
        this.baselineTracker = baselineTracker;
        this.profileStore = profileStore;
        this.recommendationService = recommendationService;
        this.tokenGenerator = tokenGenerator;
        this.properties = properties;
    }

    @Transactional
    public ClassSession createSession(String courseId, boolean surveyRequested, String moodPrompt) {
        Course course = courseService.get(courseId);
        if (course.moodLabels().isEmpty()) {
            throw new ValidationException("COURSE_MOOD_LABELS_NOT_CONFIGURED",
                    "Course " + courseId + " has no mood labels");
        }

        boolean requireSurvey = baselineTracker.shouldForceBaseline(course) || surveyRequested;
        SurveySnapshot snapshot = null;
        if (requireSurvey) {
            if (course.baselineSurveyId() == null) {
                throw new ValidationException("COURSE_BASELINE_NOT_SET",
                        "Course " + courseId + " has no baseline survey to collect");
            }
            snapshot = surveyService.snapshot(surveyService.get(course.baselineSurveyId()));
        }

        String prompt = moodPrompt == null || moodPrompt.isBlank()
                ? properties.session().defaultMoodPrompt()
                : moodPrompt.trim();
        ClassSession session = new ClassSession(UUID.randomUUID().toString(), courseId,
                course.baselineSurveyId(), requireSurvey,
                new MoodCheckSchema(prompt, course.moodLabels()), snapshot,
                uniqueToken(), Instant.now(), null);
        repository.insert(session);
        log.info("Opened session {} for course {} (survey required: {}, forced by course: {})",
                session.id(), courseId, requireSurvey, course.requiresRebaseline());
        return session;
    }

    public ClassSession get(String sessionId) {
        return repository.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("SESSION_NOT_FOUND", "Session not found: " + sessionId));
    }

    public List<ClassSession> listForCourse(String courseId) {
        courseService.get(courseId);
        return repository.findByCourse(courseId);
    }

    public SessionView view(ClassSession session) {
        return new SessionView(session.id(), session.courseId(), session.state(), session.requireSurvey(),
                session.moodCheck(), session.surveyId(), session.joinToken(),
                qrUrl(session.joinToken()), session.startedAt(), session.closedAt());
    }

    public String qrUrl(String joinToken) {
        String base = properties.publicAppUrl();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base + "/join?s=" + joinToken;
    }

    public ClassSession findOpenByToken(String joinToken) {
        ClassSession session = repository.findByJoinToken(joinToken)
                .orElseThrow(() -> new NotFoundException("SESSION_NOT_FOUND", "No session for this join code"));
        if (!session.isOpen()) {
            throw new ConflictException("SESSION_CLOSED", "Session " + session.id() + " is closed");
        }
        return session;
    }

    public JoinView joinByToken(String joinToken) {
        ClassSession session = findOpenByToken(joinToken);
        Course course = courseService.get(session.courseId());
        return new JoinView(session.id(), course.title(), session.requireSurvey(), session.moodCheck(),
                session.requireSurvey() ? surveyService.publicView(session.surveySnapshot()) : null);
    }

    @Transactional
    public ClassSession close(String sessionId) {
        get(sessionId);
        if (repository.close(sessionId, Instant.now()) == 0) {
            throw new ConflictException("SESSION_ALREADY_CLOSED", "Session " + sessionId + " is already closed");
        }
        log.info("Closed session {}", sessionId);
        return get(sessionId);
    }

    @Transactional(readOnly = true)
    public List<SubmissionItem> submissions(String sessionId) {
        get(sessionId);
        return submissionRepository.findBySession(sessionId).stream()
                .map(s -> new SubmissionItem(s.id(), s.participant(), s.guestName(), s.mood(), s.baselineUpdate(),
                        s.totalScores(), s.totalScores() == null ? null : scorer.dominantCategory(s.totalScores()),
                        s.createdAt(), s.updatedAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public Dashboard dashboard(String sessionId) {
        ClassSession session = get(sessionId);
        List<Submission> submissions = submissionRepository.findBySession(sessionId);

        Map<String, Integer> moodSummary = new LinkedHashMap<>();
        session.moodCheck().options().forEach(label -> moodSummary.put(label, 0));
        Map<String, String> styles = new HashMap<>();
        profileStore.currentForCourse(session.courseId())
                .forEach(p -> styles.put(p.participant().key(), p.learningStyle()));

        List<DashboardEntry> entries = new ArrayList<>();
        for (Submission s : submissions) {
            moodSummary.merge(s.mood(), 1, Integer::sum);
            String style = styles.get(s.participant().key());
            entries.add(new DashboardEntry(s.participant(), s.guestName(), s.mood(), style,
                    recommendationService.recommend(new RecommendationQuery(session.courseId(), style, s.mood(),
                            s.participant().key(), session.sessionDate()))));
        }
        return new Dashboard(view(session), moodSummary, entries);
    }

    private String uniqueToken() {
        for (int i = 0; i < TOKEN_ATTEMPTS; i++) {
            String token = tokenGenerator.next();
            if (!repository.existsByJoinToken(token)) {
                return token;
            }
        }
        throw new IllegalStateException("Could not generate a unique join token after " + TOKEN_ATTEMPTS + " attempts");
    }
}
