package com.classpulse.engage.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

public class DomainModels {
    public record SurveyOption(String id, String label, Map<String, Integer> scores) {}
    public record SurveyQuestion(String id, String text, List<SurveyOption> options) {}

    public record Survey(String id, String title, String creatorName, List<SurveyQuestion> questions, Instant createdAt) {}

    public record SurveySnapshot(String surveyId, String title, List<SurveyQuestion> questions) {}

    public record Course(String id,
                         String title,
                         String baselineSurveyId,
                         List<String> learningStyleCategories,
                         List<String> moodLabels,
                         boolean requiresRebaseline,
                         Instant createdAt,
                         Instant updatedAt) {}

    public record ActivityType(String typeName,
                               String description,
                               List<String> requiredFields,
                               List<String> optionalFields,
                               Map<String, Object> exampleContent,
                               Instant createdAt,
                               Instant updatedAt) {}

    public record Activity(String id,
                           String name,
                           String summary,
                           String type,
                           List<String> tags,
                           Map<String, Object> content,
                           Instant createdAt,
                           Instant updatedAt) {}

    public record MoodCheckSchema(String prompt, List<String> options) {}

    public enum SessionState { OPEN, CLOSED }

    public record ClassSession(String id,
                               String courseId,
                               String surveyId,
                               boolean requireSurvey,
                               MoodCheckSchema moodCheck,
                               SurveySnapshot surveySnapshot,
                               String joinToken,
                               Instant startedAt,
                               Instant closedAt) {
        public SessionState state() {
            return closedAt == null ? SessionState.OPEN : SessionState.CLOSED;
        }

        public boolean isOpen() {
            return state() == SessionState.OPEN;
        }

        /** Calendar day (UTC) the session started on; part of the random-fallback seed. */
        public LocalDate sessionDate() {
            return LocalDate.ofInstant(startedAt, ZoneOffset.UTC);
        }
    }

    public record OptionDetail(String optionId, String text) {}

    public record AnswerDetail(String questionId,
                               String questionText,
                               String selectedOptionId,
                               String selectedOptionText,
                               List<OptionDetail> options) {}

    public record AnswersPayload(Map<String, String> rawAnswers, Map<String, AnswerDetail> details) {}

    public record Submission(String id,
                             String sessionId,
                             String courseId,
                             ParticipantIdentity participant,
                             String guestName,
                             String mood,
                             AnswersPayload answers,
                             Map<String, Integer> totalScores,
                             boolean baselineUpdate,
                             String status,
                             Instant createdAt,
                             Instant updatedAt) {}

    public record CourseStudentProfile(String id,
                                       String courseId,
                                       ParticipantIdentity participant,
                                       String learningStyle,
                                       Map<String, Integer> scores,
                                       String sourceSubmissionId,
                                       boolean current,
                                       Instant capturedAt) {}

    /**
     * Row of a course's recommendation table. A null style with a mood is a mood default;
     * a style with {@code styleDefault} set applies to that style whatever the mood.
     */
    public record CourseRecommendation(String id,
                                       String courseId,
                                       String learningStyle,
                                       String mood,
                                       boolean styleDefault,
                                       String activityId,
                                       boolean auto,
                                       Instant createdAt,
                                       Instant updatedAt) {}
}
