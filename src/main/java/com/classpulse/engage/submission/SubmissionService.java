package com.classpulse.engage.submission;

import com.classpulse.engage.baseline.BaselineTracker;
import com.classpulse.engage.course.CourseService;
import com.classpulse.engage.domain.DomainModels.*;
import com.classpulse.engage.domain.ParticipantIdentity;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.profile.ProfileStore;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendationQuery;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendedActivity;
import com.classpulse.engage.recommendation.RecommendationService;
import com.classpulse.engage.repository.SessionJdbcRepository;
import com.classpulse.engage.repository.SubmissionJdbcRepository;
import com.classpulse.engage.submission.SubmissionModels.SubmissionCommand;
import com.classpulse.engage.submission.SubmissionModels.SubmissionResult;
import com.classpulse.engage.survey.SurveyModels.ScoreResult;
import com.classpulse.engage.survey.SurveyScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);
    static final String STATUS_COMPLETED = "completed";

    private final SessionJdbcRepository sessionRepository;
    private final SubmissionJdbcRepository repository;
    private final CourseService courseService;
    private final SurveyScorer scorer;
    private final ProfileStore profileStore;
    private final BaselineTracker baselineTracker;
    private final RecommendationService recommendationService;

    public SubmissionService(SessionJdbcRepository sessionRepository,
                             SubmissionJdbcRepository repository,
                             CourseService courseService,
                             SurveyScorer scorer,
                             ProfileStore profileStore,
                             BaselineTracker baselineTracker,
                             RecommendationService recommendationService) {
        this.sessionRepository = sessionRepository;
        this.repository = repository;
        this.courseService = courseService;
        this.scorer = scorer;
        this.profileStore = profileStore;
        this.baselineTracker = baselineTracker;
        this.recommendationService = recommendationService;
    }

    @Transactional
    public SubmissionResult submit(String joinToken, SubmissionCommand command) {
        ParticipantIdentity participant = new ParticipantIdentity(command.studentId(), command.guestId());
        String sessionId = sessionRepository.findByJoinToken(joinToken)
                .map(ClassSession::id)
                .orElseThrow(() -> new NotFoundException("SESSION_NOT_FOUND", "No session for this join code"));
        ClassSession session = sessionRepository.lockById(sessionId)
                .orElseThrow(() -> new NotFoundException("SESSION_NOT_FOUND", "Session not found: " + sessionId));
        if (!session.isOpen()) {
            log.warn("Rejected submission from {} to closed session {}", participant.key(), sessionId);
            throw new ConflictException("SESSION_CLOSED", "Session " + sessionId + " is closed");
        }

        Course course = courseService.get(session.courseId());
        String mood = command.mood() == null ? null : command.mood().trim();
        if (mood == null || !course.moodLabels().contains(mood)) {
            log.warn("Rejected submission from {} to session {}: unknown mood '{}'", participant.key(), sessionId, mood);
            throw new ValidationException("UNKNOWN_MOOD", "Mood must be one of " + course.moodLabels());
        }

        ScoreResult scoreResult = null;
        AnswersPayload answers = null;
        if (session.requireSurvey()) {
            Map<String, String> raw = requireAnswers(command.answers(), sessionId, participant);
            scoreResult = scorer.score(session.surveySnapshot(), raw);
            answers = new AnswersPayload(raw, scorer.answerDetails(session.surveySnapshot(), raw));
        }

        boolean baselineUpdate = scoreResult != null && baselineTracker.collectsCurrentBaseline(course, session.surveyId());
        if (scoreResult != null && !baselineUpdate) {
            log.info("Answers from {} in session {} belong to survey {}, no longer the baseline of course {}; profile unchanged",
                    participant.key(), sessionId, session.surveyId(), course.id());
        }
        Submission submission = save(session, participant, command.guestName(), mood, answers, scoreResult, baselineUpdate);

        CourseStudentProfile profile;
        String learningStyle;
        if (baselineUpdate) {
            profile = profileStore.upsertProfile(course.id(), participant, scoreResult, submission.id());
            learningStyle = scoreResult.dominantCategory();
        } else {
            profile = profileStore.getCurrent(course.id(), participant).orElse(null);
            learningStyle = profile == null ? null : profile.learningStyle();
        }
        boolean requiresRebaseline = baselineTracker.afterSubmission(course, baselineUpdate ? session.surveyId() : null);

        RecommendedActivity recommendation = recommendationService.recommend(new RecommendationQuery(
                course.id(), learningStyle, mood, participant.key(), session.sessionDate()));
        log.debug("Submission {} in session {}: style={}, mood={}, match={}", submission.id(), sessionId,
                learningStyle, mood, recommendation.matchType().label());
        return new SubmissionResult(submission.id(), sessionId, participant, mood, scoreResult, learningStyle,
                requiresRebaseline, profile, recommendation);
    }

    private Map<String, String> requireAnswers(Map<String, String> answers, String sessionId, ParticipantIdentity participant) {
        if (answers == null || answers.isEmpty()) {
            log.warn("Rejected submission from {} to session {}: survey answers missing", participant.key(), sessionId);
            throw new ValidationException("ANSWERS_REQUIRED", "This session requires the baseline survey answers");
        }
        Map<String, String> raw = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : answers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new ValidationException("MALFORMED_ANSWERS", "Answer for question '" + e.getKey() + "' is empty");
            }
            raw.put(e.getKey(), e.getValue());
        }
        return raw;
    }

    /** Update-or-insert keyed by (session, participant); the id and creation time survive resubmission. */
    private Submission save(ClassSession session, ParticipantIdentity participant, String guestName, String mood,
                            AnswersPayload answers, ScoreResult scoreResult, boolean baselineUpdate) {
        Instant now = Instant.now();
        String name = participant.isGuest() && guestName != null && !guestName.isBlank() ? guestName.trim() : null;
        Map<String, Integer> totals = scoreResult == null ? null : scoreResult.totals();
        Optional<Submission> existing = repository.findBySessionAndParticipant(session.id(), participant);

        if (existing.isPresent()) {
            Submission prev = existing.get();
            Submission updated = new Submission(prev.id(), session.id(), session.courseId(), participant,
                    name != null ? name : prev.guestName(), mood, answers, totals, baselineUpdate,
                    STATUS_COMPLETED, prev.createdAt(), now);
            repository.update(updated);
            log.info("Updated submission {} from {} in session {}", prev.id(), participant.key(), session.id());
            return updated;
        }

        Submission created = new Submission(UUID.randomUUID().toString(), session.id(), session.courseId(), participant,
                name, mood, answers, totals, baselineUpdate, STATUS_COMPLETED, now, now);
        repository.insert(created);
        log.info("Recorded submission {} from {} in session {}", created.id(), participant.key(), session.id());
        return created;
    }
}
