package com.flamingo.ai.mentions.service.coordinator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.Chunk;
import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.domain.model.ChunkPost;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.domain.model.SourceType;
import com.flamingo.ai.mentions.exception.LlmServiceException;
import com.flamingo.ai.mentions.service.chunking.ChunkingResult;
import com.flamingo.ai.mentions.service.extraction.ExtractionBackend;
import com.flamingo.ai.mentions.service.extraction.ExtractionOutput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ConcurrencyCoordinator Tests")
class ConcurrencyCoordinatorTest {

  @Mock private ExtractionBackend backend;

  private PipelineConfig pipelineConfig;
  private ThreadPoolTaskExecutor executor;
  private BackpressureGate gate;
  private SimpleMeterRegistry meterRegistry;
  private ConcurrencyCoordinator coordinator;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    pipelineConfig.getCoordinator().setPoolSize(4);
    pipelineConfig.getCoordinator().setWorkerIdSpace(4);
    pipelineConfig.getCoordinator().setMaxWaitPollMs(10);
    pipelineConfig.getCoordinator().setDefaultRateLimitCooldownMs(200);

    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setThreadNamePrefix("extract-test-");
    executor.initialize();

    gate = new BackpressureGate(pipelineConfig, Clock.systemUTC());
    meterRegistry = new SimpleMeterRegistry();
    coordinator = new ConcurrencyCoordinator(executor, gate, pipelineConfig, meterRegistry);

    lenient().when(backend.throttleDelay()).thenReturn(Duration.ZERO);
    lenient()
        .when(backend.extract(any(Chunk.class), anyString()))
        .thenAnswer(
            invocation -> {
              Chunk chunk = invocation.getArgument(0);
              return ExtractionOutput.of(List.of(validMention(chunk.comments().get(0).id())));
            });
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  private static ChunkingResult chunks(int... rootScores) {
    List<Chunk> chunks = new ArrayList<>();
    List<ChunkMetadata> metadata = new ArrayList<>();
    for (int i = 0; i < rootScores.length; i++) {
      String postId = "t3_p" + i;
      String commentId = "t1_c" + i;
      Post post =
          new Post(postId, "BBQ", "Where?", "austinfood", "op", "", 1, Instant.EPOCH, List.of());
      Comment comment =
          new Comment(commentId, "Franklin", "a", rootScores[i], Instant.EPOCH, postId, "");
      chunks.add(new Chunk(ChunkPost.full(post), List.of(comment)));
      metadata.add(
          new ChunkMetadata(
              "chunk_" + commentId,
              1,
              rootScores[i],
              6.4,
              10,
              commentId,
              List.of(commentId),
              List.of(rootScores[i]),
              postId,
              0));
    }
    return new ChunkingResult(chunks, metadata);
  }

  private static Mention validMention(String sourceId) {
    return Mention.builder()
        .tempId("m-" + sourceId)
        .restaurantName("Franklin")
        .restaurantTempId("r-" + sourceId)
        .generalPraise(true)
        .sourceType(SourceType.COMMENT)
        .sourceId(sourceId)
        .build();
  }

  @Nested
  @DisplayName("process")
  class ProcessTests {

    @Test
    @DisplayName("should settle every chunk when one of them fails")
    void shouldCollectFailure_whenOneChunkThrows() {
      when(backend.extract(any(Chunk.class), anyString()))
          .thenAnswer(
              invocation -> {
                Chunk chunk = invocation.getArgument(0);
                String commentId = chunk.comments().get(0).id();
                if ("t1_c2".equals(commentId)) {
                  throw new IllegalStateException("model returned garbage");
                }
                return ExtractionOutput.of(List.of(validMention(commentId)));
              });

      CoordinatorResult result = coordinator.process(chunks(5, 20, 3, 1), backend);

      assertThat(result.successes())
          .extracting(ChunkSuccess::chunkId)
          .containsExactly("chunk_t1_c0", "chunk_t1_c1", "chunk_t1_c3");
      assertThat(result.failures()).hasSize(1);
      ChunkFailure failure = result.failures().get(0);
      assertThat(failure.chunkId()).isEqualTo("chunk_t1_c2");
      assertThat(failure.errorType()).isEqualTo("IllegalStateException");
      assertThat(failure.error()).isEqualTo("model returned garbage");
      assertThat(result.metrics().successRate()).isEqualTo(75.0);
      assertThat(result.metrics().engagedChunks()).isEqualTo(1);
      assertThat(result.mentions()).hasSize(3);
      assertThat(meterRegistry.counter("pipeline.chunks.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fail a chunk whose mention lacks a vital field")
    void shouldFailChunk_whenMentionMissingSourceId() {
      Mention broken = validMention("t1_c0").toBuilder().sourceId(" ").build();
      when(backend.extract(any(Chunk.class), anyString()))
          .thenReturn(ExtractionOutput.of(List.of(broken)));

      CoordinatorResult result = coordinator.process(chunks(5), backend);

      assertThat(result.successes()).isEmpty();
      assertThat(result.failures().get(0).errorType())
          .isEqualTo("InvalidExtractionOutputException");
      assertThat(result.failures().get(0).error()).contains("sourceId");
    }

    @Test
    @DisplayName("should fail a chunk whose output has no mention list")
    void shouldFailChunk_whenMentionsNull() {
      when(backend.extract(any(Chunk.class), anyString()))
          .thenReturn(ExtractionOutput.of(null));

      CoordinatorResult result = coordinator.process(chunks(5), backend);

      assertThat(result.failures()).hasSize(1);
      assertThat(result.failures().get(0).error()).contains("missing mentions list");
    }

    @Test
    @DisplayName("should accept a dish mention without the menu item flag")
    void shouldSucceed_whenOnlyMenuFlagMissing() {
      Mention dish = validMention("t1_c0").toBuilder().dishName("brisket").build();
      when(backend.extract(any(Chunk.class), anyString()))
          .thenReturn(ExtractionOutput.of(List.of(dish)));

      CoordinatorResult result = coordinator.process(chunks(5), backend);

      assertThat(result.successes()).hasSize(1);
    }

    @Test
    @DisplayName("should report full success for an empty run")
    void shouldReportFullSuccess_whenNoChunks() {
      CoordinatorResult result = coordinator.process(ChunkingResult.empty(), backend);

      assertThat(result.metrics().chunksProcessed()).isZero();
      assertThat(result.metrics().successRate()).isEqualTo(100.0);
      assertThat(result.mentions()).isEmpty();
    }

    @Test
    @DisplayName("should hold all workers back after a rate-limited failure")
    void shouldExtendGate_whenRateLimited() {
      when(backend.extract(any(Chunk.class), anyString()))
          .thenThrow(LlmServiceException.rateLimited("429 Too Many Requests", null));

      CoordinatorResult result = coordinator.process(chunks(5), backend);

      assertThat(result.failures()).hasSize(1);
      assertThat(result.failures().get(0).errorType()).isEqualTo("LlmServiceException");
      assertThat(gate.remaining()).isPositive();
    }

    @Test
    @DisplayName("should wait out the backend throttle before dispatching")
    void shouldWait_whenBackendThrottles() {
      when(backend.throttleDelay()).thenReturn(Duration.ofMillis(100), Duration.ZERO);

      CoordinatorResult result = coordinator.process(chunks(5), backend);

      assertThat(result.successes()).hasSize(1);
      assertThat(result.metrics().totalDurationSeconds()).isGreaterThanOrEqualTo(0.09);
    }
  }

  @Nested
  @DisplayName("status")
  class StatusTests {

    @Test
    @DisplayName("should accumulate lifetime stats across runs")
    void shouldAccumulateStats() {
      coordinator.process(chunks(1, 2), backend);
      coordinator.process(chunks(3), backend);

      PerformanceStats stats = coordinator.performanceStats();
      assertThat(stats.runsCoordinated()).isEqualTo(2);
      assertThat(stats.chunksSucceeded()).isEqualTo(3);
      assertThat(stats.chunksFailed()).isZero();
      assertThat(stats.successRate()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("should report pool size and clear backpressure when idle")
    void shouldReportIdleQueue() {
      QueueStatus status = coordinator.queueStatus();

      assertThat(status.poolSize()).isEqualTo(4);
      assertThat(status.queuedChunks()).isZero();
      assertThat(status.backpressureRemainingMs()).isZero();
    }
  }
}
