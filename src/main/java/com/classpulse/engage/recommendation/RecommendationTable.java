package com.classpulse.engage.recommendation;

import com.classpulse.engage.domain.DomainModels.CourseRecommendation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the resolver reads for one course, loaded up front so the tiers stay pure.
 *
 * @param activityPool            the course's activities, sorted by id
 * @param systemDefaultActivityId configured platform fallback, null when unset or missing
 */
public record RecommendationTable(String courseId,
                                  List<CourseRecommendation> mappings,
                                  List<String> activityPool,
                                  String systemDefaultActivityId) {

    public RecommendationTable {
        mappings = List.copyOf(mappings);
        activityPool = activityPool.stream().distinct().sorted().toList();
    }

    public Optional<CourseRecommendation> find(String learningStyle, String mood, boolean styleDefault) {
        return mappings.stream()
                .filter(r -> Objects.equals(r.learningStyle(), learningStyle))
                .filter(r -> Objects.equals(r.mood(), mood))
                .filter(r -> r.styleDefault() == styleDefault)
                .findFirst();
    }
}
