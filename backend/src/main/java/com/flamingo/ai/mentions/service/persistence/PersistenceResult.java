package com.flamingo.ai.mentions.service.persistence;

import com.flamingo.ai.mentions.domain.model.EntitySummary;
import java.util.List;
import lombok.Builder;

/** What persistence created or touched for one batch. */
@Builder
public record PersistenceResult(
    int entitiesCreated,
    int connectionsCreated,
    List<String> createdEntityIds,
    List<String> affectedConnectionIds,
    List<EntitySummary> createdEntities,
    List<EntitySummary> reusedEntities) {

  public PersistenceResult {
    createdEntityIds = createdEntityIds == null ? List.of() : List.copyOf(createdEntityIds);
    affectedConnectionIds =
        affectedConnectionIds == null ? List.of() : List.copyOf(affectedConnectionIds);
    createdEntities = createdEntities == null ? List.of() : List.copyOf(createdEntities);
    reusedEntities = reusedEntities == null ? List.of() : List.copyOf(reusedEntities);
  }
}
