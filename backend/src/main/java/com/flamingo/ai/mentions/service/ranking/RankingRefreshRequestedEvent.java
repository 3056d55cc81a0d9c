package com.flamingo.ai.mentions.service.ranking;

import com.flamingo.ai.mentions.domain.model.CollectionType;
import java.time.Instant;

/** Published when the final batch of a job asks for the rankings of a scope to be rebuilt. */
public record RankingRefreshRequestedEvent(
    String sourceScope, CollectionType collectionType, String parentJobId, Instant requestedAt) {}
