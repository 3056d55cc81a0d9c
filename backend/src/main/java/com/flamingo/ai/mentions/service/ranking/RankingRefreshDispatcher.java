package com.flamingo.ai.mentions.service.ranking;

import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.BatchJob;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget trigger for ranking refreshes. Runs on its own executor; a failure is logged and
 * never reaches the batch that asked for it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RankingRefreshDispatcher {

  private final ApplicationEventPublisher eventPublisher;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  /** True when {@code job} is the last batch of a collection type configured for refresh. */
  public boolean shouldRefresh(BatchJob job) {
    PipelineConfig.Ranking ranking = pipelineConfig.getRanking();
    return ranking.isEnabled()
        && job.isFinalBatch()
        && ranking.getRefreshCollectionTypes().contains(job.collectionType());
  }

  @Async("rankingRefreshExecutor")
  public void dispatch(BatchJob job) {
    try {
      log.info(
          "Requesting ranking refresh for {} after job {}", job.sourceScope(), job.parentJobId());
      eventPublisher.publishEvent(
          new RankingRefreshRequestedEvent(
              job.sourceScope(), job.collectionType(), job.parentJobId(), clock.instant()));
    } catch (RuntimeException e) {
      log.warn("Ranking refresh for {} failed: {}", job.sourceScope(), e.getMessage(), e);
    }
  }
}
