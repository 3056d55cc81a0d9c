package com.flamingo.ai.mentions.domain.repository;

import com.flamingo.ai.mentions.domain.entity.ProcessedSource;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ProcessedSource ledger rows. */
@Repository
public interface ProcessedSourceRepository extends JpaRepository<ProcessedSource, UUID> {

  /** Latest processed instant per source id, restricted to the given pipelines. */
  @Query(
      "SELECT p.sourceId AS sourceId, MAX(p.processedAt) AS processedAt FROM ProcessedSource p "
          + "WHERE p.pipeline IN :pipelines AND p.sourceId IN :sourceIds GROUP BY p.sourceId")
  List<LastProcessed> findLastProcessed(
      @Param("pipelines") Collection<String> pipelines,
      @Param("sourceIds") Collection<String> sourceIds);

  /** Projection of {@link #findLastProcessed}. */
  interface LastProcessed {
    String getSourceId();

    Instant getProcessedAt();
  }
}
