package com.classpulse.engage.submission;

import com.classpulse.engage.domain.DomainModels.CourseStudentProfile;
import com.classpulse.engage.domain.ParticipantIdentity;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendedActivity;
import com.classpulse.engage.survey.SurveyModels.ScoreResult;

import java.util.Map;

public class SubmissionModels {

    public record SubmissionCommand(String studentId,
                                    String guestId,
                                    String guestName,
                                    String mood,
                                    Map<String, String> answers) {}

    /**
     * @param scoreResult        null when the session did not collect the survey
     * @param learningStyle      the just-scored dominant category, else the current profile's, else null
     * @param requiresRebaseline the course flag after this submission
     * @param profile            current profile after the write, null if never baselined
     */
    public record SubmissionResult(String submissionId,
                                   String sessionId,
                                   ParticipantIdentity participant,
                                   String mood,
                                   ScoreResult scoreResult,
                                   String learningStyle,
                                   boolean requiresRebaseline,
                                   CourseStudentProfile profile,
                                   RecommendedActivity recommendation) {}
}
