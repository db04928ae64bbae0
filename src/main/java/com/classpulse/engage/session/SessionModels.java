package com.classpulse.engage.session;

import com.classpulse.engage.domain.DomainModels.MoodCheckSchema;
import com.classpulse.engage.domain.DomainModels.SessionState;
import com.classpulse.engage.domain.ParticipantIdentity;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendedActivity;
import com.classpulse.engage.survey.SurveyModels.PublicSurvey;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class SessionModels {

    public record SessionView(String sessionId,
                              String courseId,
                              SessionState state,
                              boolean requireSurvey,
                              MoodCheckSchema moodCheck,
                              String surveyId,
                              String joinToken,
                              String qrUrl,
                              Instant startedAt,
                              Instant closedAt) {}

    public record JoinView(String sessionId,
                           String courseTitle,
                           boolean requireSurvey,
                           MoodCheckSchema moodCheck,
                           PublicSurvey survey) {}

    public record SubmissionItem(String submissionId,
                                 ParticipantIdentity participant,
                                 String guestName,
                                 String mood,
                                 boolean baselineUpdate,
                                 Map<String, Integer> totalScores,
                                 String learningStyle,
                                 Instant createdAt,
                                 Instant updatedAt) {}

    public record DashboardEntry(ParticipantIdentity participant,
                                 String guestName,
                                 String mood,
                                 String learningStyle,
                                 RecommendedActivity recommendation) {}

    public record Dashboard(SessionView session, Map<String, Integer> moodSummary, List<DashboardEntry> participants) {}
}
