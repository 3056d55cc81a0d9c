package com.flamingo.ai.mentions.service.coordinator;

import com.flamingo.ai.mentions.config.PipelineConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Shared "do not dispatch before" deadline. Any worker may push it later; nobody can pull it
 * earlier. Waiters poll in bounded slices so a deadline extended mid-wait is picked up.
 */
@Component
@Slf4j
public class BackpressureGate {

  private final AtomicLong deadline = new AtomicLong();
  private final AtomicLong loggedStall = new AtomicLong();
  private final Clock clock;
  private final long maxPollMs;

  public BackpressureGate(PipelineConfig pipelineConfig, Clock clock) {
    this.clock = clock;
    this.maxPollMs = pipelineConfig.getCoordinator().getMaxWaitPollMs();
  }

  /**
   * Moves the deadline to at least {@code now + delay}.
   *
   * @return the deadline in epoch millis after the update
   */
  public long extend(Duration delay) {
    long candidate = clock.millis() + Math.max(0, delay.toMillis());
    return deadline.accumulateAndGet(candidate, Math::max);
  }

  /** Time left until the deadline; zero when clear. */
  public Duration remaining() {
    return Duration.ofMillis(Math.max(0, deadline.get() - clock.millis()));
  }

  /**
   * Blocks until the deadline has passed. Only the first waiter of each stall logs it.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitClear(String waiterId) throws InterruptedException {
    while (true) {
      long until = deadline.get();
      long waitMs = until - clock.millis();
      if (waitMs <= 0) {
        return;
      }
      if (loggedStall.getAndSet(until) != until) {
        log.warn("Backpressure active: {} holding dispatch for {}ms", waiterId, waitMs);
      }
      Thread.sleep(Math.min(waitMs, maxPollMs));
    }
  }
}
