package com.classpulse.engage.recommendation;

import com.classpulse.engage.recommendation.RecommendationModels.MatchType;
import com.classpulse.engage.recommendation.RecommendationModels.RecommendationQuery;

import java.util.Optional;

/**
 * One step of the fallback chain. Returns an activity id or empty to let the next tier try.
 */
public interface RecommendationTier {

    MatchType matchType();

    Optional<String> resolve(RecommendationQuery query, RecommendationTable table);
}
