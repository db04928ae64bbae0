package com.classpulse.engage.recommendation;

import com.classpulse.engage.domain.DomainModels.CourseRecommendation;
import com.classpulse.engage.recommendation.RecommendationModels.MatchType;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendationQuery;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

public final class RecommendationTiers {

    public static final class ExactMatch implements RecommendationTier {
        @Override
        public MatchType matchType() {
            return MatchType.EXACT_MATCH;
        }

        @Override
        public Optional<String> resolve(RecommendationQuery query, RecommendationTable table) {
            if (query.learningStyle() == null) return Optional.empty();
            return table.find(query.learningStyle(), query.mood(), false).map(CourseRecommendation::activityId);
        }
    }

    public static final class StyleDefault implements RecommendationTier {
        @Override
        public MatchType matchType() {
            return MatchType.STYLE_DEFAULT;
        }

        @Override
        public Optional<String> resolve(RecommendationQuery query, RecommendationTable table) {
            if (query.learningStyle() == null) return Optional.empty();
            return table.find(query.learningStyle(), null, true).map(CourseRecommendation::activityId);
        }
    }

    public static final class MoodDefault implements RecommendationTier {
        @Override
        public MatchType matchType() {
            return MatchType.MOOD_DEFAULT;
        }

        @Override
        public Optional<String> resolve(RecommendationQuery query, RecommendationTable table) {
            if (query.mood() == null) return Optional.empty();
            return table.find(null, query.mood(), false).map(CourseRecommendation::activityId);
        }
    }

    /**
     * Seeded pick among the course's activities. Same participant, course and session day give the same pick.
     */
    public static final class RandomFallback implements RecommendationTier {
        @Override
        public MatchType matchType() {
            return MatchType.RANDOM_FALLBACK;
        }

        @Override
        public Optional<String> resolve(RecommendationQuery query, RecommendationTable table) {
            List<String> pool = table.activityPool();
            if (pool.isEmpty()) return Optional.empty();
            Random random = new Random(seed(query));
            return Optional.of(pool.get(random.nextInt(pool.size())));
        }

        static long seed(RecommendationQuery query) {
            return Objects.hash(query.courseId(), query.participantKey(), String.valueOf(query.sessionDate()));
        }
    }

    /** Platform-wide fallback, only reachable when the course has no activities. */
    public static final class SystemDefault implements RecommendationTier {
        @Override
        public MatchType matchType() {
            return MatchType.SYSTEM_DEFAULT;
        }

        @Override
        public Optional<String> resolve(RecommendationQuery query, RecommendationTable table) {
            return Optional.ofNullable(table.systemDefaultActivityId());
        }
    }

    public static List<RecommendationTier> standardChain() {
        return List.of(new ExactMatch(), new StyleDefault(), new MoodDefault(), new RandomFallback(), new SystemDefault());
    }

    private RecommendationTiers() {}
}
