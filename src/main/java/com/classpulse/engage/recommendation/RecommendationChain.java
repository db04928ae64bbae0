package com.classpulse.engage.recommendation;

import com.classpulse.engage.recommendation.RecommendationModels.RecommendationQuery;
import com.classpulse.engage.recommendation.RecommendationModels.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

public class RecommendationChain {
    private static final Logger log = LoggerFactory.getLogger(RecommendationChain.class);

    private final List<RecommendationTier> tiers;

    public RecommendationChain(List<RecommendationTier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    public static RecommendationChain standard() {
        return new RecommendationChain(RecommendationTiers.standardChain());
    }

    public Resolution resolve(RecommendationQuery query, RecommendationTable table) {
        for (RecommendationTier tier : tiers) {
            Optional<String> activityId = tier.resolve(query, table);
            if (activityId.isPresent()) {
                log.debug("Course {} style={} mood={} resolved by {} -> {}",
                        query.courseId(), query.learningStyle(), query.mood(), tier.matchType(), activityId.get());
                return new Resolution(tier.matchType(), activityId.get());
            }
        }
        log.debug("Course {} style={} mood={} has nothing to recommend", query.courseId(), query.learningStyle(), query.mood());
        return Resolution.none();
    }
}
