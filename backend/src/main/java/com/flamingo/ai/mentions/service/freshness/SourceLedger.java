package com.flamingo.ai.mentions.service.freshness;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/** Read side of the processed-source ledger. */
public interface SourceLedger {

  /**
   * Most recent processed instant per source id.
   *
   * @param pipelines pipeline scopes to consider
   * @param sourceIds post or comment ids
   * @return processed instants keyed by source id; ids never processed are absent
   */
  Map<String, Instant> lastProcessed(Collection<String> pipelines, Collection<String> sourceIds);
}
