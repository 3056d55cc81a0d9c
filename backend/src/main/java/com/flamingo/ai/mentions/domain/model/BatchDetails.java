package com.flamingo.ai.mentions.domain.model;

import java.util.List;
import lombok.Builder;

/** Entity-level details and diagnostics attached to a batch result. */
@Builder
public record BatchDetails(
    List<String> createdEntityIds,
    List<String> updatedConnectionIds,
    List<EntitySummary> createdEntities,
    List<EntitySummary> reusedEntities,
    List<String> warnings,
    List<PostSample> llmPostSample) {

  public BatchDetails {
    createdEntityIds = createdEntityIds == null ? List.of() : List.copyOf(createdEntityIds);
    updatedConnectionIds =
        updatedConnectionIds == null ? List.of() : List.copyOf(updatedConnectionIds);
    createdEntities = createdEntities == null ? List.of() : List.copyOf(createdEntities);
    reusedEntities = reusedEntities == null ? List.of() : List.copyOf(reusedEntities);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    llmPostSample = llmPostSample == null ? List.of() : List.copyOf(llmPostSample);
  }

  public static BatchDetails empty() {
    return BatchDetails.builder().build();
  }
}
