package com.flamingo.ai.mentions.service.extraction;

import com.flamingo.ai.mentions.config.PipelineConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands out request start times that keep extraction calls under the provider's request rate.
 *
 * <p>Reservations are spaced at least {@code minSpacingMs} apart and never exceed {@code
 * safeRequestsPerMinute} within any sliding minute. A worker that already reserved within the same
 * wall-clock second is pushed back by {@code workerSlotMs} so one worker cannot monopolize slots.
 */
@Component
@Slf4j
public class RequestSlotReserver {

  private static final long WINDOW_MS = 60_000;

  private final PipelineConfig.RateLimit limits;
  private final Clock clock;

  private final Deque<Long> window = new ArrayDeque<>();
  private final Map<String, Long> lastSecondByWorker = new HashMap<>();
  private long lastReservation;

  public RequestSlotReserver(PipelineConfig pipelineConfig, Clock clock) {
    this.limits = pipelineConfig.getRateLimit();
    this.clock = clock;
  }

  /** A reserved slot: when the request may start and how long the caller has to wait for it. */
  public record Reservation(long startAtMillis, Duration waitTime, int requestsInWindow) {}

  /** Reserves the next free slot for {@code workerId}. */
  public synchronized Reservation reserve(String workerId) {
    long now = clock.millis();
    prune(now);

    long slot = Math.max(now, lastReservation + limits.getMinSpacingMs());
    if (window.size() >= limits.getSafeRequestsPerMinute()) {
      slot = Math.max(slot, window.peekFirst() + WINDOW_MS + limits.getMinSpacingMs());
    }

    long second = slot / 1000;
    Long previousSecond = lastSecondByWorker.put(workerId, second);
    if (previousSecond != null && previousSecond == second) {
      slot += limits.getWorkerSlotMs();
      lastSecondByWorker.put(workerId, slot / 1000);
    }

    window.addLast(slot);
    lastReservation = slot;
    Duration wait = Duration.ofMillis(slot - now);
    if (wait.toMillis() > 1000) {
      log.debug("Worker {} waits {}ms for a request slot", workerId, wait.toMillis());
    }
    return new Reservation(slot, wait, window.size());
  }

  /** Time until a slot opens when the window is full; zero otherwise. */
  public synchronized Duration throttleDelay() {
    long now = clock.millis();
    prune(now);
    if (window.size() < limits.getSafeRequestsPerMinute()) {
      return Duration.ZERO;
    }
    return Duration.ofMillis(Math.max(0, window.peekFirst() + WINDOW_MS - now));
  }

  /** Input tokens a chunk of {@code chars} characters is budgeted at. */
  public int estimateInputTokens(int chars) {
    int estimate = chars / 4 + limits.getInputTokenOverhead();
    return Math.max(limits.getMinInputTokens(), Math.min(limits.getMaxInputTokens(), estimate));
  }

  private void prune(long now) {
    while (!window.isEmpty() && window.peekFirst() <= now - WINDOW_MS) {
      window.pollFirst();
    }
  }
}
