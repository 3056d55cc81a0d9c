package com.flamingo.ai.mentions.service.freshness;

import com.flamingo.ai.mentions.domain.repository.ProcessedSourceRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Source ledger backed by the {@code processed_sources} table. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaSourceLedger implements SourceLedger {

  private final ProcessedSourceRepository repository;

  @Override
  public Map<String, Instant> lastProcessed(
      Collection<String> pipelines, Collection<String> sourceIds) {
    Map<String, Instant> result = new HashMap<>();
    if (pipelines.isEmpty() || sourceIds.isEmpty()) {
      return result;
    }
    for (ProcessedSourceRepository.LastProcessed row :
        repository.findLastProcessed(pipelines, sourceIds)) {
      result.put(row.getSourceId(), row.getProcessedAt());
    }
    return result;
  }
}
