package com.flamingo.ai.mentions.service.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.BatchJob;
import com.flamingo.ai.mentions.domain.model.BatchMetrics;
import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import com.flamingo.ai.mentions.domain.model.CollectionType;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.service.batch.BatchOrchestrator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ArchiveIngestionService Tests")
class ArchiveIngestionServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

  @Mock private ArchiveReconstructor reconstructor;
  @Mock private BatchOrchestrator orchestrator;

  private PipelineConfig pipelineConfig;
  private ArchiveIngestionService service;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    pipelineConfig.getArchive().setBatchSize(2);
    service =
        new ArchiveIngestionService(
            reconstructor, orchestrator, pipelineConfig, Clock.fixed(NOW, ZoneOffset.UTC));

    when(orchestrator.processBatch(any(BatchJob.class)))
        .thenAnswer(
            invocation -> {
              BatchJob job = invocation.getArgument(0);
              if (job.batchNumber() == 2) {
                return BatchProcessingResult.failure(job, "model unavailable", NOW);
              }
              return BatchProcessingResult.builder()
                  .batchId(job.batchId())
                  .parentJobId(job.parentJobId())
                  .collectionType(job.collectionType())
                  .success(true)
                  .metrics(BatchMetrics.builder().mentionsExtracted(job.posts().size()).build())
                  .completedAt(NOW)
                  .build();
            });
  }

  private static ArchiveReconstruction archive(int postCount) {
    List<Post> posts = new ArrayList<>();
    for (int i = 0; i < postCount; i++) {
      String postId = "t3_p" + i;
      posts.add(
          new Post(
              postId,
              "Post " + i,
              "Body",
              "austinfood",
              "op",
              "",
              0,
              NOW.minusSeconds(1000 - i),
              List.of(new Comment("t1_c" + i, "Veracruz", "a", 1, NOW, postId, ""))));
    }
    return new ArchiveReconstruction("austinfood", posts, null, null);
  }

  @Test
  @DisplayName("should split the archive into sequential archive batches")
  void shouldRunBatchesInOrder() {
    ArchiveIngestionSummary summary = service.ingest(archive(5));

    ArgumentCaptor<BatchJob> jobs = ArgumentCaptor.forClass(BatchJob.class);
    verify(orchestrator, times(3)).processBatch(jobs.capture());

    String parent = "archive-austinfood-" + NOW.toEpochMilli();
    assertThat(summary.parentJobId()).isEqualTo(parent);
    assertThat(jobs.getAllValues())
        .extracting(BatchJob::batchId)
        .containsExactly(parent + "-batch-1", parent + "-batch-2", parent + "-batch-3");
    assertThat(jobs.getAllValues()).extracting(j -> j.posts().size()).containsExactly(2, 2, 1);
    assertThat(jobs.getAllValues())
        .allSatisfy(
            job -> {
              assertThat(job.collectionType()).isEqualTo(CollectionType.ARCHIVE);
              assertThat(job.totalBatches()).isEqualTo(3);
              assertThat(job.hasPrebuiltPosts()).isTrue();
            });
    assertThat(jobs.getAllValues().get(2).isFinalBatch()).isTrue();
  }

  @Test
  @DisplayName("should keep going after a failed batch and summarize all of them")
  void shouldSummarize_whenOneBatchFails() {
    ArchiveIngestionSummary summary = service.ingest(archive(5));

    assertThat(summary.postsReconstructed()).isEqualTo(5);
    assertThat(summary.commentsReconstructed()).isEqualTo(5);
    assertThat(summary.batches()).hasSize(3);
    assertThat(summary.successfulBatches()).isEqualTo(2);
    assertThat(summary.mentionsExtracted()).isEqualTo(3);
  }

  @Test
  @DisplayName("should reconstruct the scope before ingesting it")
  void shouldReconstructScope() {
    when(reconstructor.reconstruct("austinfood")).thenReturn(archive(1));

    ArchiveIngestionSummary summary = service.ingest("austinfood");

    assertThat(summary.batches()).hasSize(1);
    assertThat(summary.sourceScope()).isEqualTo("austinfood");
  }

  @Test
  @DisplayName("should run no batch for an empty archive")
  void shouldSkip_whenArchiveEmpty() {
    ArchiveIngestionSummary summary = service.ingest(archive(0));

    assertThat(summary.batches()).isEmpty();
    verify(orchestrator, never()).processBatch(any());
  }
}
