package com.classpulse.engage.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class RecommendationModels {

    public enum MatchType {
        EXACT_MATCH("style+mood"),
        STYLE_DEFAULT("style-default"),
        MOOD_DEFAULT("mood-default"),
        RANDOM_FALLBACK("random-course-activity"),
        SYSTEM_DEFAULT("system-default"),
        NONE("none");

        private final String label;

        MatchType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    public record RecommendationQuery(String courseId,
                                      String learningStyle,
                                      String mood,
                                      String participantKey,
                                      LocalDate sessionDate) {}

    public record Resolution(MatchType matchType, String activityId) {
        public static Resolution none() {
            return new Resolution(MatchType.NONE, null);
        }
    }

    public record ActivityDetails(String activityId, String name, String summary, String type, Map<String, Object> content) {}

    public record RecommendedActivity(MatchType matchType, String learningStyle, String mood, ActivityDetails activity) {}

    /**
     * Teacher-supplied mapping. Blank, {@code *}, {@code any} and {@code default} mean "no value".
     * A style without a mood is treated as that style's default.
     */
    public record MappingInput(String learningStyle, String mood, boolean styleDefault, String activityId) {}

    public record MappingView(String learningStyle, String mood, boolean styleDefault, boolean auto, ActivityDetails activity) {}

    public record CourseMappingsView(String courseId,
                                     List<String> learningStyleCategories,
                                     List<String> moodLabels,
                                     List<MappingView> mappings) {}
}
