package com.flamingo.ai.mentions.service.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.mentions.client.forum.ForumContentClient;
import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.BatchDetails;
import com.flamingo.ai.mentions.domain.model.BatchJob;
import com.flamingo.ai.mentions.domain.model.BatchMetrics;
import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.domain.model.PostSample;
import com.flamingo.ai.mentions.domain.model.SourceBreakdown;
import com.flamingo.ai.mentions.domain.model.TemporalRange;
import com.flamingo.ai.mentions.exception.BatchProcessingException;
import com.flamingo.ai.mentions.exception.ForumApiException;
import com.flamingo.ai.mentions.service.chunking.ChunkValidationReport;
import com.flamingo.ai.mentions.service.chunking.ChunkingResult;
import com.flamingo.ai.mentions.service.chunking.PostChunker;
import com.flamingo.ai.mentions.service.coordinator.ChunkFailure;
import com.flamingo.ai.mentions.service.coordinator.ConcurrencyCoordinator;
import com.flamingo.ai.mentions.service.coordinator.CoordinatorResult;
import com.flamingo.ai.mentions.service.extraction.ExtractionBackend;
import com.flamingo.ai.mentions.service.freshness.FreshnessDecision;
import com.flamingo.ai.mentions.service.freshness.FreshnessGate;
import com.flamingo.ai.mentions.service.normalize.ContentNormalizer;
import com.flamingo.ai.mentions.service.normalize.NormalizedThread;
import com.flamingo.ai.mentions.service.persistence.MentionPersistence;
import com.flamingo.ai.mentions.service.persistence.PersistenceRequest;
import com.flamingo.ai.mentions.service.persistence.PersistenceResult;
import com.flamingo.ai.mentions.service.ranking.RankingRefreshDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one batch job end to end: resolve posts, chunk, extract, enrich, normalize, deduplicate,
 * persist, and request a ranking refresh after a job's final batch.
 *
 * <p>Expected failures come back as a result with {@code success=false}. Only a job missing its
 * required fields is thrown back to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchOrchestrator {

  static final int SNIPPET_LENGTH = 160;

  private final FreshnessGate freshnessGate;
  private final ForumContentClient forumClient;
  private final ContentNormalizer contentNormalizer;
  private final PostChunker chunker;
  private final ConcurrencyCoordinator coordinator;
  private final ExtractionBackend extractionBackend;
  private final MentionPersistence persistence;
  private final RankingRefreshDispatcher rankingRefreshDispatcher;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Processes one batch.
   *
   * @param job the batch job
   * @return the batch outcome
   * @throws BatchProcessingException when the job lacks an id, a collection type, or any post
   */
  public BatchProcessingResult processBatch(BatchJob job) {
    requireValid(job);
    long startedAt = clock.millis();
    Timer.Sample sample = Timer.start(meterRegistry);
    log.info(
        "Processing batch {} ({} {}/{}) for {}",
        job.batchId(),
        job.collectionType().pipeline(),
        job.batchNumber(),
        job.totalBatches(),
        job.sourceScope());

    try {
      // --- 1. Resolve posts (pre-built, or fetched through the freshness gate) ---
      ResolvedPosts resolved = resolvePosts(job);
      if (resolved.gatedOut()) {
        log.info("Batch {}: every candidate post is fresh, nothing to fetch", job.batchId());
        meterRegistry.counter("pipeline.batch.success").increment();
        return BatchProcessingResult.builder()
            .batchId(job.batchId())
            .parentJobId(job.parentJobId())
            .collectionType(job.collectionType())
            .success(true)
            .metrics(
                BatchMetrics.builder()
                    .postsSkippedFresh(resolved.skippedFresh())
                    .postsSkippedNoNewComments(resolved.skippedNoNewComments())
                    .processingTimeMs(clock.millis() - startedAt)
                    .build())
            .completedAt(clock.instant())
            .build();
      }
      List<Post> posts = resolved.posts();
      if (posts.isEmpty()) {
        return fail(job, "No posts could be resolved for batch " + job.batchId());
      }

      long llmStartedAt = clock.millis();
      List<PostSample> postSample = samplePosts(posts);
      List<String> warnings = new ArrayList<>();

      // --- 2. Chunk ---
      ChunkingResult chunking = chunker.chunk(posts);
      ChunkValidationReport report = chunker.validate(posts, chunking);
      if (!report.valid()) {
        log.warn("Batch {} chunk validation issues: {}", job.batchId(), report.issues());
        warnings.addAll(report.issues());
      }

      // --- 3. Extract concurrently ---
      CoordinatorResult extraction = coordinator.process(chunking, extractionBackend);
      for (ChunkFailure failure : extraction.failures()) {
        warnings.add("Chunk " + failure.chunkId() + " failed: " + failure.error());
      }

      // --- 4. Enrich from the batch's own sources ---
      List<Mention> mentions = new ArrayList<>(extraction.mentions());
      SourceEnrichment enrichment = SourceEnrichment.from(posts);
      enrichment.apply(mentions, clock.instant());

      // --- 5. Normalize restaurant names ---
      MentionSurfaceDefaults.apply(mentions);
      int renamed = RestaurantNameNormalizer.normalize(mentions, enrichment::postIdOf);
      meterRegistry.counter("pipeline.mentions.renamed").increment(renamed);

      // --- 6. Drop self-referential duplicates ---
      List<Mention> cleaned = DuplicateMentionFilter.filter(mentions, enrichment::postIdOf);
      int dropped = mentions.size() - cleaned.size();
      meterRegistry.counter("pipeline.mentions.dropped_duplicates").increment(dropped);
      long llmTimeMs = clock.millis() - llmStartedAt;
      log.info(
          "Batch {}: {} mentions extracted, {} renamed, {} dropped as duplicates",
          job.batchId(),
          mentions.size(),
          renamed,
          dropped);

      // --- 7. Persist ---
      long dbStartedAt = clock.millis();
      PersistenceResult stored =
          persistence.persist(
              PersistenceRequest.builder()
                  .mentions(cleaned)
                  .posts(posts)
                  .unsettledSourceIds(unsettledSources(chunking, extraction))
                  .batchId(job.batchId())
                  .collectionType(job.collectionType())
                  .sourceScope(job.sourceScope())
                  .sourceBreakdown(SourceBreakdown.of(job.collectionType(), posts.size()))
                  .temporalRange(TemporalRange.of(posts, clock.instant()))
                  .build());
      long dbTimeMs = clock.millis() - dbStartedAt;

      // --- 8. Ranking refresh after the final batch ---
      requestRankingRefresh(job);

      meterRegistry.counter("pipeline.batch.success").increment();
      return BatchProcessingResult.builder()
          .batchId(job.batchId())
          .parentJobId(job.parentJobId())
          .collectionType(job.collectionType())
          .success(true)
          .metrics(
              BatchMetrics.builder()
                  .postsProcessed(posts.size())
                  .postsSkippedFresh(resolved.skippedFresh())
                  .postsSkippedNoNewComments(resolved.skippedNoNewComments())
                  .chunksProcessed(extraction.metrics().chunksProcessed())
                  .chunksFailed(extraction.metrics().failedChunks())
                  .mentionsExtracted(cleaned.size())
                  .entitiesCreated(stored.entitiesCreated())
                  .connectionsCreated(stored.connectionsCreated())
                  .processingTimeMs(clock.millis() - startedAt)
                  .llmProcessingTimeMs(llmTimeMs)
                  .dbProcessingTimeMs(dbTimeMs)
                  .build())
          .completedAt(clock.instant())
          .details(
              BatchDetails.builder()
                  .createdEntityIds(stored.createdEntityIds())
                  .updatedConnectionIds(stored.affectedConnectionIds())
                  .createdEntities(stored.createdEntities())
                  .reusedEntities(stored.reusedEntities())
                  .warnings(warnings)
                  .llmPostSample(postSample)
                  .build())
          .rawMentionsSample(
              cleaned.stream()
                  .limit(pipelineConfig.getDiagnostics().getRawMentionSampleSize())
                  .toList())
          .build();
    } catch (RuntimeException e) {
      log.error("Batch {} failed: {}", job.batchId(), e.getMessage(), e);
      return fail(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    } finally {
      sample.stop(
          meterRegistry.timer(
              "pipeline.batch.duration", "collection_type", job.collectionType().pipeline()));
    }
  }

  private static void requireValid(BatchJob job) {
    if (job == null) {
      throw new BatchProcessingException(null, "Batch job is required");
    }
    if (job.batchId() == null || job.batchId().isBlank()) {
      throw new BatchProcessingException(null, "Batch job has no batchId", "Batch id is required");
    }
    if (job.collectionType() == null) {
      throw new BatchProcessingException(
          job.batchId(), "Batch job has no collectionType", "Collection type is required");
    }
    if (!job.hasPrebuiltPosts() && job.postIds().isEmpty()) {
      throw new BatchProcessingException(
          job.batchId(),
          "Batch job missing postIds or posts",
          "Batch must carry post ids or posts");
    }
  }

  private ResolvedPosts resolvePosts(BatchJob job) {
    if (job.hasPrebuiltPosts()) {
      log.debug("Batch {}: using {} pre-built posts", job.batchId(), job.posts().size());
      return new ResolvedPosts(job.posts(), 0, 0, false);
    }

    FreshnessDecision decision = freshnessGate.resolve(job.sourceScope(), job.postIds());
    if (decision.nothingToFetch()) {
      return new ResolvedPosts(
          List.of(), decision.skippedFresh(), decision.skippedNoNewComments(), true);
    }

    int depth =
        job.options().depth() != null
            ? job.options().depth()
            : pipelineConfig.getForumApi().getCommentDepth();
    List<Post> posts = new ArrayList<>();
    List<String> toFetch = decision.toFetch();
    for (int i = 0; i < toFetch.size(); i++) {
      String postId = toFetch.get(i);
      if (i > 0) {
        pause(job.options().delayBetweenRequestsMs());
      }
      try {
        JsonNode raw = forumClient.fetchPostWithComments(job.sourceScope(), postId, depth);
        NormalizedThread thread =
            contentNormalizer.normalize(raw, forumClient.postUrl(job.sourceScope(), postId));
        if (!thread.hasPost()) {
          log.warn("Batch {}: skipping post {}, no usable post content", job.batchId(), postId);
          continue;
        }
        posts.add(thread.toPost());
      } catch (ForumApiException e) {
        log.error(
            "Batch {}: failed to fetch post {} (status {}): {}",
            job.batchId(),
            postId,
            e.getStatusCode(),
            e.getMessage());
      }
    }
    return new ResolvedPosts(
        posts, decision.skippedFresh(), decision.skippedNoNewComments(), false);
  }

  private void requestRankingRefresh(BatchJob job) {
    if (!rankingRefreshDispatcher.shouldRefresh(job)) {
      return;
    }
    try {
      rankingRefreshDispatcher.dispatch(job);
    } catch (RuntimeException e) {
      log.warn("Batch {}: ranking refresh not scheduled: {}", job.batchId(), e.getMessage());
    }
  }

  /**
   * Sources that must stay out of the ledger: every comment of a failed chunk, and the post that
   * chunk belongs to, so the freshness gate fetches the post again next run.
   */
  static Set<String> unsettledSources(ChunkingResult chunking, CoordinatorResult extraction) {
    Set<String> failedChunkIds = new HashSet<>();
    for (ChunkFailure failure : extraction.failures()) {
      failedChunkIds.add(failure.chunkId());
    }
    Set<String> unsettled = new HashSet<>();
    if (failedChunkIds.isEmpty()) {
      return unsettled;
    }
    for (int i = 0; i < chunking.size(); i++) {
      ChunkMetadata metadata = chunking.metadata().get(i);
      if (!failedChunkIds.contains(metadata.chunkId())) {
        continue;
      }
      unsettled.add(metadata.postId());
      for (Comment comment : chunking.chunks().get(i).comments()) {
        unsettled.add(comment.id());
      }
    }
    return unsettled;
  }

  private List<PostSample> samplePosts(List<Post> posts) {
    PipelineConfig.Diagnostics diagnostics = pipelineConfig.getDiagnostics();
    if (diagnostics.getPostSampleCount() <= 0) {
      return List.of();
    }
    return posts.stream()
        .limit(diagnostics.getPostSampleCount())
        .map(
            post ->
                new PostSample(
                    post.id(),
                    post.title(),
                    post.sourceScope(),
                    post.author(),
                    post.score(),
                    post.createdAt(),
                    post.comments().size(),
                    post.comments().stream()
                        .limit(diagnostics.getPostSampleCommentCount())
                        .map(BatchOrchestrator::sampleComment)
                        .toList()))
        .toList();
  }

  private static PostSample.CommentSample sampleComment(Comment comment) {
    String body = comment.body() != null ? comment.body() : "";
    return new PostSample.CommentSample(
        comment.id(),
        comment.author(),
        comment.score(),
        comment.createdAt(),
        body.length() > SNIPPET_LENGTH ? body.substring(0, SNIPPET_LENGTH) : body);
  }

  private BatchProcessingResult fail(BatchJob job, String error) {
    meterRegistry.counter("pipeline.batch.failure").increment();
    return BatchProcessingResult.failure(job, error, clock.instant());
  }

  private static void pause(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted between post fetches", e);
    }
  }

  private record ResolvedPosts(
      List<Post> posts, int skippedFresh, int skippedNoNewComments, boolean gatedOut) {}
}
