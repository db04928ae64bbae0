package com.classpulse.engage.survey;

import com.classpulse.engage.domain.DomainModels.OptionDetail;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SurveyModels {
    public static final String NO_DOMINANT_CATEGORY = "none";

    /**
     * Per-category totals in the order categories were first met in the snapshot.
     *
     * @param dominantCategory null when no category scored above zero
     */
    public record ScoreResult(Map<String, Integer> totals, String dominantCategory) {
        public ScoreResult {
            totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        }

        /** Dominant category, or {@value #NO_DOMINANT_CATEGORY}. */
        @JsonIgnore
        public String dominantLabel() {
            return dominantCategory == null ? NO_DOMINANT_CATEGORY : dominantCategory;
        }
    }

    public record CreateSurveyCommand(String title, String creatorName, List<SurveyQuestion> questions) {}

    public record PublicSurvey(String surveyId, String title, List<PublicQuestion> questions) {}

    public record PublicQuestion(String questionId, String text, List<OptionDetail> options) {}
}
