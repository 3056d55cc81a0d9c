package com.flamingo.ai.mentions.service.coordinator;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mentions.config.PipelineConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BackpressureGate Tests")
class BackpressureGateTest {

  private PipelineConfig pipelineConfig;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    pipelineConfig.getCoordinator().setMaxWaitPollMs(20);
  }

  @Test
  @DisplayName("should never move the deadline earlier")
  void shouldKeepLatestDeadline_whenExtendedWithShorterDelay() {
    Clock clock = Clock.fixed(Instant.parse("2026-01-15T12:00:00Z"), ZoneOffset.UTC);
    BackpressureGate gate = new BackpressureGate(pipelineConfig, clock);

    gate.extend(Duration.ofSeconds(5));
    gate.extend(Duration.ofSeconds(1));

    assertThat(gate.remaining()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("should report zero remaining when never extended or extended negatively")
  void shouldBeClear_whenNotExtended() {
    Clock clock = Clock.fixed(Instant.parse("2026-01-15T12:00:00Z"), ZoneOffset.UTC);
    BackpressureGate gate = new BackpressureGate(pipelineConfig, clock);

    assertThat(gate.remaining()).isZero();
    gate.extend(Duration.ofSeconds(-3));
    assertThat(gate.remaining()).isZero();
  }

  @Test
  @DisplayName("should return immediately when the gate is clear")
  void shouldNotBlock_whenClear() throws InterruptedException {
    BackpressureGate gate = new BackpressureGate(pipelineConfig, Clock.systemUTC());

    long started = System.nanoTime();
    gate.awaitClear("worker-0");

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(50));
  }

  @Test
  @DisplayName("should block until an extended deadline has passed")
  void shouldBlockUntilDeadline() throws InterruptedException {
    BackpressureGate gate = new BackpressureGate(pipelineConfig, Clock.systemUTC());
    gate.extend(Duration.ofMillis(150));

    long started = System.nanoTime();
    gate.awaitClear("worker-0");

    assertThat(Duration.ofNanos(System.nanoTime() - started))
        .isGreaterThanOrEqualTo(Duration.ofMillis(140));
    assertThat(gate.remaining()).isZero();
  }
}
