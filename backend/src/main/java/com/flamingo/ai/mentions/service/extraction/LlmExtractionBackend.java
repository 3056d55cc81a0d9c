package com.flamingo.ai.mentions.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.mentions.agent.MentionExtractionAgent;
import com.flamingo.ai.mentions.agent.dto.ExtractedMention;
import com.flamingo.ai.mentions.agent.dto.ExtractionResponse;
import com.flamingo.ai.mentions.domain.model.Chunk;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.SourceType;
import com.flamingo.ai.mentions.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Extraction backend that sends each chunk to the chat model through the extraction agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmExtractionBackend implements ExtractionBackend {

  private final MentionExtractionAgent agent;
  private final RequestSlotReserver slotReserver;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @CircuitBreaker(name = "llm", fallbackMethod = "extractFallback")
  @Retry(name = "llm")
  public ExtractionOutput extract(Chunk chunk, String workerId) {
    String chunkJson = serialize(chunk);
    int inputTokens = slotReserver.estimateInputTokens(chunkJson.length());
    RequestSlotReserver.Reservation reservation = slotReserver.reserve(workerId);
    sleep(reservation.waitTime());

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      ExtractionResponse response = agent.extract(chunkJson);
      sample.stop(meterRegistry.timer("llm.extraction.duration"));
      meterRegistry.counter("llm.extraction.requests", "outcome", "success").increment();

      List<Mention> mentions = null;
      if (response != null && response.mentions() != null) {
        mentions = new ArrayList<>(response.mentions().size());
        for (ExtractedMention extracted : response.mentions()) {
          if (extracted != null) {
            mentions.add(toMention(extracted));
          }
        }
      }
      return new ExtractionOutput(mentions, reservation.waitTime(), inputTokens);
    } catch (RuntimeException e) {
      boolean rateLimited = isRateLimited(e);
      meterRegistry
          .counter("llm.extraction.requests", "outcome", rateLimited ? "rate_limited" : "failure")
          .increment();
      if (rateLimited) {
        throw new LlmServiceException(
            "Extraction rate limited: " + e.getMessage(), e, true, null);
      }
      throw e;
    }
  }

  @Override
  public Duration throttleDelay() {
    return slotReserver.throttleDelay();
  }

  /**
   * Only an open circuit is translated. Every other failure propagates unchanged so the {@code llm}
   * retry, which ignores {@link LlmServiceException}, still sees transient errors.
   */
  @SuppressWarnings("unused")
  private ExtractionOutput extractFallback(Chunk chunk, String workerId, Throwable t) {
    if (t instanceof CallNotPermittedException) {
      log.warn("Extraction circuit open, rejecting chunk for post {}", chunk.post().id());
      throw new LlmServiceException("Extraction circuit is open: " + t.getMessage(), t);
    }
    log.debug("Extraction call failed for post {}: {}", chunk.post().id(), t.getMessage());
    if (t instanceof RuntimeException runtimeError) {
      throw runtimeError;
    }
    throw new LlmServiceException("Extraction failed: " + t.getMessage(), t);
  }

  private String serialize(Chunk chunk) {
    try {
      return objectMapper.writeValueAsString(chunk);
    } catch (JsonProcessingException e) {
      throw new LlmServiceException("Failed to serialize chunk for extraction", e);
    }
  }

  private static void sleep(Duration wait) {
    if (wait.isZero() || wait.isNegative()) {
      return;
    }
    try {
      Thread.sleep(wait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmServiceException("Interrupted while waiting for a request slot", e);
    }
  }

  static boolean isRateLimited(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof LlmServiceException llmError && llmError.isRateLimited()) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("429") || lower.contains("rate limit")) {
          return true;
        }
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  static Mention toMention(ExtractedMention extracted) {
    return Mention.builder()
        .tempId(extracted.tempId())
        .restaurantName(extracted.restaurantName())
        .restaurantOriginalText(extracted.restaurantOriginalText())
        .restaurantTempId(extracted.restaurantTempId())
        .dishName(extracted.dishName())
        .dishCategories(copy(extracted.dishCategories()))
        .dishOriginalText(extracted.dishOriginalText())
        .dishTempId(extracted.dishTempId())
        .dishIsMenuItem(extracted.dishIsMenuItem())
        .restaurantAttributes(copy(extracted.restaurantAttributes()))
        .dishAttributes(copy(extracted.dishAttributes()))
        .generalPraise(extracted.generalPraise())
        .sourceType(parseSourceType(extracted.sourceType()))
        .sourceId(extracted.sourceId())
        .build();
  }

  private static List<String> copy(List<String> values) {
    return values == null ? new ArrayList<>() : new ArrayList<>(values);
  }

  private static SourceType parseSourceType(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return SourceType.fromWire(value);
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring unknown source type '{}'", value);
      return null;
    }
  }
}
