package com.flamingo.ai.mentions.service.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.mentions.client.forum.ForumContentClient;
import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.BatchJob;
import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import com.flamingo.ai.mentions.domain.model.Chunk;
import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.domain.model.ChunkPost;
import com.flamingo.ai.mentions.domain.model.CollectionType;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.exception.BatchProcessingException;
import com.flamingo.ai.mentions.exception.ForumApiException;
import com.flamingo.ai.mentions.service.chunking.ChunkingResult;
import com.flamingo.ai.mentions.service.chunking.ThreadAwareChunker;
import com.flamingo.ai.mentions.service.coordinator.ChunkFailure;
import com.flamingo.ai.mentions.service.coordinator.ChunkSuccess;
import com.flamingo.ai.mentions.service.coordinator.ConcurrencyCoordinator;
import com.flamingo.ai.mentions.service.coordinator.CoordinatorMetrics;
import com.flamingo.ai.mentions.service.coordinator.CoordinatorResult;
import com.flamingo.ai.mentions.service.extraction.ExtractionBackend;
import com.flamingo.ai.mentions.service.extraction.ExtractionOutput;
import com.flamingo.ai.mentions.service.freshness.FreshnessDecision;
import com.flamingo.ai.mentions.service.freshness.FreshnessGate;
import com.flamingo.ai.mentions.service.normalize.ContentNormalizer;
import com.flamingo.ai.mentions.service.persistence.MentionPersistence;
import com.flamingo.ai.mentions.service.persistence.PersistenceRequest;
import com.flamingo.ai.mentions.service.persistence.PersistenceResult;
import com.flamingo.ai.mentions.service.ranking.RankingRefreshDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BatchOrchestrator Tests")
class BatchOrchestratorTest {

  private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");
  private static final String POST_URL = "https://reddit.com/r/austinfood/comments/p1/";

  private static final String THREAD =
      """
      [
        {"data": {"children": [{"kind": "t3", "data": {
          "name": "t3_p1", "title": "Best BBQ?", "selftext": "Looking for brisket",
          "subreddit": "austinfood", "author": "op", "score": 42, "created_utc": 1767000000}}]}},
        {"data": {"children": [
          {"kind": "t1", "data": {"name": "t1_c1", "body": "Franklin", "score": 10,
            "parent_id": "t3_p1", "created_utc": 1767000100}},
          {"kind": "t1", "data": {"name": "t1_c2", "body": "Franklin brisket", "score": 4,
            "parent_id": "t3_p1", "created_utc": 1767000200}},
          {"kind": "t1", "data": {"name": "t1_c3", "body": "The brisket", "score": 1,
            "parent_id": "t3_p1", "created_utc": 1767000300}}
        ]}}
      ]
      """;

  @Mock private FreshnessGate freshnessGate;
  @Mock private ForumContentClient forumClient;
  @Mock private ConcurrencyCoordinator coordinator;
  @Mock private ExtractionBackend extractionBackend;
  @Mock private MentionPersistence persistence;
  @Mock private RankingRefreshDispatcher rankingRefreshDispatcher;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private PipelineConfig pipelineConfig;
  private SimpleMeterRegistry meterRegistry;
  private BatchOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    orchestrator =
        new BatchOrchestrator(
            freshnessGate,
            forumClient,
            new ContentNormalizer(objectMapper, clock),
            new ThreadAwareChunker(pipelineConfig),
            coordinator,
            extractionBackend,
            persistence,
            rankingRefreshDispatcher,
            pipelineConfig,
            meterRegistry,
            clock);

    lenient()
        .when(coordinator.process(any(ChunkingResult.class), eq(extractionBackend)))
        .thenAnswer(invocation -> extractionResult(List.of()));
    lenient()
        .when(persistence.persist(any(PersistenceRequest.class)))
        .thenReturn(
            PersistenceResult.builder()
                .entitiesCreated(1)
                .connectionsCreated(1)
                .createdEntityIds(List.of("restaurant:franklin"))
                .affectedConnectionIds(List.of("restaurant:franklin|dish:brisket"))
                .build());
    lenient().when(forumClient.postUrl(anyString(), anyString())).thenReturn(POST_URL);
  }

  private static Post post() {
    return new Post(
        "t3_p1",
        "Best BBQ?",
        "Looking for brisket",
        "austinfood",
        "op",
        POST_URL,
        42,
        NOW.minusSeconds(3600),
        List.of(
            new Comment("t1_c1", "Franklin", "a", 10, NOW, "t3_p1", ""),
            new Comment("t1_c2", "Franklin brisket", "b", 4, NOW, "t3_p1", ""),
            new Comment("t1_c3", "The brisket", "c", 1, NOW, "t3_p1", "")));
  }

  private static BatchJob.BatchJobBuilder job() {
    return BatchJob.builder()
        .batchId("batch-1")
        .parentJobId("job-1")
        .collectionType(CollectionType.CHRONOLOGICAL)
        .sourceScope("austinfood")
        .batchNumber(1)
        .totalBatches(2)
        .createdAt(NOW);
  }

  private static BatchJob prebuiltJob() {
    return job().posts(List.of(post())).build();
  }

  private static List<Mention> extractedMentions() {
    List<Mention> mentions = new ArrayList<>();
    mentions.add(mention("m1", "t1_c1", "Franklin", null));
    mentions.add(mention("m2", "t1_c2", "Franklin Brisket", "Brisket"));
    mentions.add(mention("m3", "t1_c3", "Brisket", "brisket"));
    return mentions;
  }

  private static Mention mention(String tempId, String sourceId, String name, String dish) {
    return Mention.builder()
        .tempId(tempId)
        .restaurantName(name)
        .restaurantTempId("r-" + tempId)
        .dishName(dish)
        .generalPraise(dish == null)
        .sourceId(sourceId)
        .build();
  }

  private static CoordinatorResult extractionResult(List<ChunkFailure> failures) {
    ChunkMetadata metadata =
        new ChunkMetadata(
            "chunk_t1_c1", 3, 10, 19.2, 20, "t1_c1", List.of("t1_c1"), List.of(10), "t3_p1", 0);
    ChunkSuccess success =
        new ChunkSuccess(
            "chunk_t1_c1", metadata, ExtractionOutput.of(extractedMentions()), 0.5);
    int processed = 1 + failures.size();
    return new CoordinatorResult(
        List.of(success),
        failures,
        new CoordinatorMetrics(
            0.5, processed, 1, failures.size(), 100.0 / processed, 0, 0.5, 0.5, 0.5, 3));
  }

  @Nested
  @DisplayName("pre-built posts")
  class PrebuiltPostsTests {

    @Test
    @DisplayName("should run every stage and persist the cleaned mentions")
    void shouldProcessPrebuiltPosts() {
      BatchProcessingResult result = orchestrator.processBatch(prebuiltJob());

      assertThat(result.success()).isTrue();
      assertThat(result.error()).isNull();
      assertThat(result.metrics().postsProcessed()).isEqualTo(1);
      assertThat(result.metrics().chunksProcessed()).isEqualTo(1);
      assertThat(result.metrics().mentionsExtracted()).isEqualTo(2);
      assertThat(result.metrics().entitiesCreated()).isEqualTo(1);
      assertThat(result.details().createdEntityIds()).containsExactly("restaurant:franklin");
      verify(freshnessGate, never()).resolve(anyString(), anyList());

      ArgumentCaptor<PersistenceRequest> request =
          ArgumentCaptor.forClass(PersistenceRequest.class);
      verify(persistence).persist(request.capture());
      List<Mention> persisted = request.getValue().mentions();
      assertThat(persisted).extracting(Mention::getTempId).containsExactly("m1", "m2");
      assertThat(persisted).extracting(Mention::getRestaurantName).containsOnly("Franklin");
      assertThat(persisted.get(1).getRestaurantOriginalText()).isEqualTo("Franklin Brisket");
      assertThat(persisted.get(0).getSourceUpvotes()).isEqualTo(10);
      assertThat(persisted.get(0).getSourceScope()).isEqualTo("austinfood");
      assertThat(request.getValue().batchId()).isEqualTo("batch-1");

      assertThat(meterRegistry.counter("pipeline.mentions.renamed").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("pipeline.mentions.dropped_duplicates").count())
          .isEqualTo(1.0);
      assertThat(meterRegistry.counter("pipeline.batch.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should report failed chunks as warnings without failing the batch")
    void shouldWarn_whenChunksFail() {
      when(coordinator.process(any(ChunkingResult.class), eq(extractionBackend)))
          .thenAnswer(
              invocation ->
                  extractionResult(
                      List.of(
                          new ChunkFailure(
                              "chunk_t1_c9", 2, "timeout", "LlmServiceException", 30.0))));

      BatchProcessingResult result = orchestrator.processBatch(prebuiltJob());

      assertThat(result.success()).isTrue();
      assertThat(result.metrics().chunksFailed()).isEqualTo(1);
      assertThat(result.details().warnings()).contains("Chunk chunk_t1_c9 failed: timeout");
    }

    @Test
    @DisplayName("should keep the sources of a failed chunk out of the ledger")
    void shouldMarkFailedChunkSourcesUnsettled_whenChunkFails() {
      when(coordinator.process(any(ChunkingResult.class), eq(extractionBackend)))
          .thenAnswer(
              invocation ->
                  extractionResult(
                      List.of(
                          new ChunkFailure(
                              "chunk_t3_p1_group_1", 3, "timeout", "LlmServiceException", 30.0))));

      BatchProcessingResult result = orchestrator.processBatch(prebuiltJob());

      assertThat(result.success()).isTrue();
      ArgumentCaptor<PersistenceRequest> request =
          ArgumentCaptor.forClass(PersistenceRequest.class);
      verify(persistence).persist(request.capture());
      assertThat(request.getValue().unsettledSourceIds())
          .containsExactlyInAnyOrder("t3_p1", "t1_c1", "t1_c2", "t1_c3");
    }

    @Test
    @DisplayName("should leave nothing unsettled when every chunk succeeds")
    void shouldHaveNoUnsettledSources_whenAllChunksSucceed() {
      orchestrator.processBatch(prebuiltJob());

      ArgumentCaptor<PersistenceRequest> request =
          ArgumentCaptor.forClass(PersistenceRequest.class);
      verify(persistence).persist(request.capture());
      assertThat(request.getValue().unsettledSourceIds()).isEmpty();
    }

    @Test
    @DisplayName("should attach a post sample when diagnostics ask for one")
    void shouldSamplePosts_whenEnabled() {
      pipelineConfig.getDiagnostics().setPostSampleCount(1);
      pipelineConfig.getDiagnostics().setRawMentionSampleSize(1);

      BatchProcessingResult result = orchestrator.processBatch(prebuiltJob());

      assertThat(result.details().llmPostSample()).hasSize(1);
      assertThat(result.details().llmPostSample().get(0).sampleComments()).hasSize(2);
      assertThat(result.rawMentionsSample()).hasSize(1);
    }

    @Test
    @DisplayName("should return a failed result when persistence throws")
    void shouldFail_whenPersistenceThrows() {
      when(persistence.persist(any(PersistenceRequest.class)))
          .thenThrow(new IllegalStateException("database is locked"));

      BatchProcessingResult result = orchestrator.processBatch(prebuiltJob());

      assertThat(result.success()).isFalse();
      assertThat(result.error()).isEqualTo("database is locked");
      assertThat(result.metrics().mentionsExtracted()).isZero();
      assertThat(meterRegistry.counter("pipeline.batch.failure").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("fetched posts")
  class FetchedPostsTests {

    @Test
    @DisplayName("should succeed without work when the freshness gate skips every post")
    void shouldNoOp_whenAllPostsFresh() {
      when(freshnessGate.resolve("austinfood", List.of("p1", "p2")))
          .thenReturn(new FreshnessDecision(List.of(), 1, 1, 0));

      BatchProcessingResult result =
          orchestrator.processBatch(job().postIds(List.of("p1", "p2")).build());

      assertThat(result.success()).isTrue();
      assertThat(result.metrics().postsSkippedFresh()).isEqualTo(1);
      assertThat(result.metrics().postsSkippedNoNewComments()).isEqualTo(1);
      assertThat(result.metrics().postsProcessed()).isZero();
      verify(coordinator, never()).process(any(), any());
      verify(persistence, never()).persist(any());
    }

    @Test
    @DisplayName("should fetch, normalize and process the posts the gate lets through")
    void shouldFetchGatedPosts() throws Exception {
      when(freshnessGate.resolve("austinfood", List.of("p1", "p2")))
          .thenReturn(new FreshnessDecision(List.of("t3_p1"), 1, 0, 0));
      when(forumClient.fetchPostWithComments("austinfood", "t3_p1", 10))
          .thenReturn(objectMapper.readTree(THREAD));

      BatchProcessingResult result =
          orchestrator.processBatch(job().postIds(List.of("p1", "p2")).build());

      assertThat(result.success()).isTrue();
      assertThat(result.metrics().postsProcessed()).isEqualTo(1);
      assertThat(result.metrics().postsSkippedFresh()).isEqualTo(1);

      ArgumentCaptor<PersistenceRequest> request =
          ArgumentCaptor.forClass(PersistenceRequest.class);
      verify(persistence).persist(request.capture());
      Post fetched = request.getValue().posts().get(0);
      assertThat(fetched.url()).isEqualTo(POST_URL);
      assertThat(fetched.comments()).hasSize(3);
    }

    @Test
    @DisplayName("should return a failed result when no post could be fetched")
    void shouldFail_whenEveryFetchFails() {
      when(freshnessGate.resolve(anyString(), anyList()))
          .thenReturn(FreshnessDecision.fetchAll(List.of("t3_p1")));
      when(forumClient.fetchPostWithComments(anyString(), anyString(), anyInt()))
          .thenThrow(new ForumApiException("Forum API returned 404", 404));

      BatchProcessingResult result =
          orchestrator.processBatch(job().postIds(List.of("p1")).build());

      assertThat(result.success()).isFalse();
      assertThat(result.error()).contains("No posts could be resolved");
      verify(coordinator, never()).process(any(), any());
    }
  }

  @Nested
  @DisplayName("validation")
  class ValidationTests {

    @Test
    @DisplayName("should reject jobs missing an id, a collection type or any post")
    void shouldThrow_whenRequiredFieldsMissing() {
      assertThatThrownBy(() -> orchestrator.processBatch(null))
          .isInstanceOf(BatchProcessingException.class);
      assertThatThrownBy(
              () -> orchestrator.processBatch(job().batchId(" ").postIds(List.of("p1")).build()))
          .isInstanceOf(BatchProcessingException.class)
          .hasMessageContaining("batchId");
      assertThatThrownBy(
              () ->
                  orchestrator.processBatch(
                      job().collectionType(null).postIds(List.of("p1")).build()))
          .isInstanceOf(BatchProcessingException.class)
          .hasMessageContaining("collectionType");
      assertThatThrownBy(() -> orchestrator.processBatch(job().build()))
          .isInstanceOf(BatchProcessingException.class)
          .hasMessageContaining("postIds");
    }
  }

  @Nested
  @DisplayName("ranking refresh")
  class RankingRefreshTests {

    @Test
    @DisplayName("should dispatch a refresh when the dispatcher accepts the batch")
    void shouldDispatch_whenFinalBatch() {
      BatchJob last = job().batchNumber(2).posts(List.of(post())).build();
      when(rankingRefreshDispatcher.shouldRefresh(last)).thenReturn(true);

      orchestrator.processBatch(last);

      verify(rankingRefreshDispatcher).dispatch(last);
    }

    @Test
    @DisplayName("should not dispatch when the dispatcher declines")
    void shouldNotDispatch_whenDeclined() {
      BatchJob first = job().posts(List.of(post())).build();
      when(rankingRefreshDispatcher.shouldRefresh(first)).thenReturn(false);

      orchestrator.processBatch(first);

      verify(rankingRefreshDispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("should still succeed when scheduling the refresh fails")
    void shouldSucceed_whenDispatchThrows() {
      BatchJob last = job().batchNumber(2).posts(List.of(post())).build();
      when(rankingRefreshDispatcher.shouldRefresh(last)).thenReturn(true);
      doThrow(new IllegalStateException("executor shut down"))
          .when(rankingRefreshDispatcher)
          .dispatch(last);

      BatchProcessingResult result = orchestrator.processBatch(last);

      assertThat(result.success()).isTrue();
    }
  }

  @Nested
  @DisplayName("unsettled sources")
  class UnsettledSourcesTests {

    @Test
    @DisplayName("should collect only the comments and post of failed chunks")
    void shouldCollectFailedChunkSources() {
      Post post = post();
      List<Comment> comments = post.comments();
      ChunkingResult chunking =
          new ChunkingResult(
              List.of(
                  new Chunk(ChunkPost.full(post), List.of(comments.get(0))),
                  new Chunk(ChunkPost.light(post), comments.subList(1, 3))),
              List.of(
                  new ChunkMetadata(
                      "chunk_a", 1, 10, 6.4, 10, "t1_c1", List.of("t1_c1"), List.of(10), "t3_p1",
                      0),
                  new ChunkMetadata(
                      "chunk_b", 2, 4, 12.8, 10, "group:t1_c2,t1_c3", List.of("t1_c2", "t1_c3"),
                      List.of(4, 1), "t3_p1", 1)));
      CoordinatorResult extraction =
          new CoordinatorResult(
              List.of(),
              List.of(new ChunkFailure("chunk_b", 2, "boom", "RuntimeException", 1.0)),
              new CoordinatorMetrics(1.0, 2, 1, 1, 50.0, 0, 1.0, 1.0, 1.0, 3));

      assertThat(BatchOrchestrator.unsettledSources(chunking, extraction))
          .containsExactlyInAnyOrder("t3_p1", "t1_c2", "t1_c3");
    }
  }
}
