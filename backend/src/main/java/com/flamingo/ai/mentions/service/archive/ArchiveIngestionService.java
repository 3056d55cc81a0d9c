package com.flamingo.ai.mentions.service.archive;

import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.BatchJob;
import com.flamingo.ai.mentions.domain.model.BatchOptions;
import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import com.flamingo.ai.mentions.domain.model.CollectionType;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.service.batch.BatchOrchestrator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a scope's archive into batch jobs carrying pre-built posts and runs them one after another.
 * The last batch is marked final so the orchestrator can request a ranking refresh.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveIngestionService {

  private final ArchiveReconstructor reconstructor;
  private final BatchOrchestrator orchestrator;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  /** Reconstructs and processes the archive of {@code scope}. */
  public ArchiveIngestionSummary ingest(String scope) {
    return ingest(reconstructor.reconstruct(scope));
  }

  /** Processes an already reconstructed archive. */
  public ArchiveIngestionSummary ingest(ArchiveReconstruction archive) {
    String scope = archive.sourceScope();
    String parentJobId = "archive-" + scope + "-" + clock.millis();
    List<List<Post>> slices = slice(archive.posts(), pipelineConfig.getArchive().getBatchSize());
    log.info(
        "Ingesting archive {}: {} posts in {} batches (job {})",
        scope,
        archive.posts().size(),
        slices.size(),
        parentJobId);

    List<BatchProcessingResult> results = new ArrayList<>(slices.size());
    for (int i = 0; i < slices.size(); i++) {
      BatchJob job =
          BatchJob.builder()
              .batchId(parentJobId + "-batch-" + (i + 1))
              .parentJobId(parentJobId)
              .collectionType(CollectionType.ARCHIVE)
              .sourceScope(scope)
              .batchNumber(i + 1)
              .totalBatches(slices.size())
              .createdAt(clock.instant())
              .posts(slices.get(i))
              .options(BatchOptions.defaults())
              .build();
      BatchProcessingResult result = orchestrator.processBatch(job);
      if (!result.success()) {
        log.warn("Archive batch {} failed: {}", job.batchId(), result.error());
      }
      results.add(result);
    }

    ArchiveIngestionSummary summary =
        new ArchiveIngestionSummary(
            parentJobId, scope, archive.posts().size(), archive.commentCount(), results);
    log.info(
        "Archive {} done: {}/{} batches succeeded, {} mentions",
        scope,
        summary.successfulBatches(),
        results.size(),
        summary.mentionsExtracted());
    return summary;
  }

  private static List<List<Post>> slice(List<Post> posts, int batchSize) {
    int size = Math.max(1, batchSize);
    List<List<Post>> slices = new ArrayList<>();
    for (int from = 0; from < posts.size(); from += size) {
      slices.add(posts.subList(from, Math.min(posts.size(), from + size)));
    }
    return slices;
  }
}
