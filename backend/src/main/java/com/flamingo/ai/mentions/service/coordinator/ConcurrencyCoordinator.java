package com.flamingo.ai.mentions.service.coordinator;

import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.Chunk;
import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.exception.LlmServiceException;
import com.flamingo.ai.mentions.service.chunking.ChunkingResult;
import com.flamingo.ai.mentions.service.extraction.ExtractionBackend;
import com.flamingo.ai.mentions.service.extraction.ExtractionOutput;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs extraction over all chunks of a batch on the bounded extraction pool and settles every
 * chunk, so one failing chunk never aborts the others.
 *
 * <p>Before each dispatch a worker waits out the shared {@link BackpressureGate}. A backend asking
 * for a throttle delay, or a rate-limited failure, pushes the gate for every worker.
 */
@Service
@Slf4j
public class ConcurrencyCoordinator {

  private final ThreadPoolTaskExecutor executor;
  private final BackpressureGate gate;
  private final PipelineConfig.Coordinator settings;
  private final MeterRegistry meterRegistry;

  private final AtomicLong runs = new AtomicLong();
  private final AtomicLong succeeded = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final DoubleAdder successSeconds = new DoubleAdder();

  public ConcurrencyCoordinator(
      @Qualifier("extractionExecutor") ThreadPoolTaskExecutor executor,
      BackpressureGate gate,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.gate = gate;
    this.settings = pipelineConfig.getCoordinator();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Extracts every chunk and waits for all of them to settle.
   *
   * @param chunking chunks with index-aligned metadata
   * @param backend extraction backend
   * @return successes and failures, each in chunk order, with run metrics
   */
  public CoordinatorResult process(ChunkingResult chunking, ExtractionBackend backend) {
    long started = System.nanoTime();
    int count = chunking.size();
    log.info("Coordinating {} chunks on {} workers", count, settings.getPoolSize());

    List<CompletableFuture<Object>> futures = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Chunk chunk = chunking.chunks().get(i);
      ChunkMetadata metadata = chunking.metadata().get(i);
      String workerId = "worker-" + (i % settings.getWorkerIdSpace());
      futures.add(
          CompletableFuture.supplyAsync(
                  () -> runChunk(chunk, metadata, workerId, backend), executor)
              .exceptionally(e -> failure(metadata, unwrap(e), 0)));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<ChunkSuccess> successes = new ArrayList<>();
    List<ChunkFailure> failures = new ArrayList<>();
    for (CompletableFuture<Object> future : futures) {
      Object outcome = future.join();
      if (outcome instanceof ChunkSuccess success) {
        successes.add(success);
      } else {
        failures.add((ChunkFailure) outcome);
      }
    }

    double totalSeconds = (System.nanoTime() - started) / 1e9;
    CoordinatorMetrics metrics = summarize(successes, failures, totalSeconds);
    record(successes, failures);
    log.info(
        "Coordinated {} chunks in {}s: {} succeeded, {} failed ({}%), {} mentions",
        count,
        String.format("%.1f", totalSeconds),
        successes.size(),
        failures.size(),
        String.format("%.1f", metrics.successRate()),
        metrics.mentionsExtracted());
    return new CoordinatorResult(successes, failures, metrics);
  }

  /** Current pool occupancy and remaining backpressure. */
  public QueueStatus queueStatus() {
    int queued =
        executor.getThreadPoolExecutor() == null
            ? 0
            : executor.getThreadPoolExecutor().getQueue().size();
    return new QueueStatus(
        executor.getActiveCount(), settings.getPoolSize(), queued, gate.remaining().toMillis());
  }

  /** Lifetime counters since startup. */
  public PerformanceStats performanceStats() {
    long ok = succeeded.get();
    long total = ok + failed.get();
    return new PerformanceStats(
        runs.get(),
        ok,
        failed.get(),
        total == 0 ? 100.0 : ok * 100.0 / total,
        ok == 0 ? 0 : successSeconds.sum() / ok);
  }

  private Object runChunk(
      Chunk chunk, ChunkMetadata metadata, String workerId, ExtractionBackend backend) {
    long started = System.nanoTime();
    try {
      gate.awaitClear(workerId);
      Duration throttle = backend.throttleDelay();
      if (throttle != null && !throttle.isZero() && !throttle.isNegative()) {
        gate.extend(throttle);
        gate.awaitClear(workerId);
      }

      ExtractionOutput output = backend.extract(chunk, workerId);
      validate(output, metadata.chunkId());
      double seconds = elapsedSeconds(started);
      log.debug(
          "Chunk {} done in {}s with {} mentions",
          metadata.chunkId(),
          String.format("%.2f", seconds),
          output.mentions().size());
      return new ChunkSuccess(metadata.chunkId(), metadata, output, seconds);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return failure(metadata, e, elapsedSeconds(started));
    } catch (LlmServiceException e) {
      if (e.isRateLimited()) {
        Duration cooldown =
            e.getRetryAfter().orElse(Duration.ofMillis(settings.getDefaultRateLimitCooldownMs()));
        gate.extend(cooldown);
        log.warn(
            "Rate limited on chunk {}, holding workers for {}ms",
            metadata.chunkId(),
            cooldown.toMillis());
      }
      return failure(metadata, e, elapsedSeconds(started));
    } catch (RuntimeException e) {
      return failure(metadata, e, elapsedSeconds(started));
    }
  }

  /** Rejects outputs that are missing fields every downstream stage relies on. */
  private static void validate(ExtractionOutput output, String chunkId) {
    if (output == null || output.mentions() == null) {
      throw new InvalidExtractionOutputException(chunkId + ": missing mentions list");
    }
    List<Mention> mentions = output.mentions();
    for (int i = 0; i < mentions.size(); i++) {
      Mention mention = mentions.get(i);
      if (isBlank(mention.getRestaurantTempId())) {
        throw new InvalidExtractionOutputException(
            chunkId + ": mention " + i + " has no restaurantTempId");
      }
      if (mention.getGeneralPraise() == null) {
        throw new InvalidExtractionOutputException(
            chunkId + ": mention " + i + " has no generalPraise flag");
      }
      if (isBlank(mention.getSourceId())) {
        throw new InvalidExtractionOutputException(
            chunkId + ": mention " + i + " has no sourceId");
      }
      if (mention.hasDish() && mention.getDishIsMenuItem() == null) {
        log.warn("{}: mention {} names a dish without dishIsMenuItem", chunkId, i);
      }
    }
  }

  private CoordinatorMetrics summarize(
      List<ChunkSuccess> successes, List<ChunkFailure> failures, double totalSeconds) {
    int processed = successes.size() + failures.size();
    double average =
        successes.stream().mapToDouble(ChunkSuccess::durationSeconds).average().orElse(0);
    double fastest = successes.stream().mapToDouble(ChunkSuccess::durationSeconds).min().orElse(0);
    double slowest = successes.stream().mapToDouble(ChunkSuccess::durationSeconds).max().orElse(0);
    int engaged =
        (int)
            successes.stream()
                .filter(
                    s -> s.metadata().rootCommentScore() > settings.getEngagedScoreThreshold())
                .count();
    int mentions = successes.stream().mapToInt(s -> s.output().mentions().size()).sum();
    return new CoordinatorMetrics(
        totalSeconds,
        processed,
        successes.size(),
        failures.size(),
        processed == 0 ? 100.0 : successes.size() * 100.0 / processed,
        engaged,
        average,
        fastest,
        slowest,
        mentions);
  }

  private void record(List<ChunkSuccess> successes, List<ChunkFailure> failures) {
    runs.incrementAndGet();
    succeeded.addAndGet(successes.size());
    failed.addAndGet(failures.size());
    successes.forEach(s -> successSeconds.add(s.durationSeconds()));
    meterRegistry.counter("pipeline.chunks.success").increment(successes.size());
    meterRegistry.counter("pipeline.chunks.failure").increment(failures.size());
  }

  private static ChunkFailure failure(ChunkMetadata metadata, Throwable error, double seconds) {
    log.warn("Chunk {} failed: {}", metadata.chunkId(), error.getMessage());
    return new ChunkFailure(
        metadata.chunkId(),
        metadata.commentCount(),
        error.getMessage(),
        error.getClass().getSimpleName(),
        seconds);
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }

  private static double elapsedSeconds(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1e9;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /** Extraction returned, but its output cannot be used. */
  static class InvalidExtractionOutputException extends RuntimeException {
    InvalidExtractionOutputException(String message) {
      super(message);
    }
  }
}
