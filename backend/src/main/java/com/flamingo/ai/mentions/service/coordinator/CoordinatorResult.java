package com.flamingo.ai.mentions.service.coordinator;

import com.flamingo.ai.mentions.domain.model.Mention;
import java.util.List;

/** Settled outcome of every chunk in a run, plus run metrics. */
public record CoordinatorResult(
    List<ChunkSuccess> successes, List<ChunkFailure> failures, CoordinatorMetrics metrics) {

  public CoordinatorResult {
    successes = successes == null ? List.of() : List.copyOf(successes);
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  /** Mentions of all successful chunks, in chunk order. */
  public List<Mention> mentions() {
    return successes.stream().flatMap(s -> s.output().mentions().stream()).toList();
  }
}
