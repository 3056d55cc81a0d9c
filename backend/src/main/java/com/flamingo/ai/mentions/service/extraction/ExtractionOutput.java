package com.flamingo.ai.mentions.service.extraction;

import com.flamingo.ai.mentions.domain.model.Mention;
import java.time.Duration;
import java.util.List;

/**
 * Result of extracting one chunk.
 *
 * @param mentions extracted mentions; null means the backend returned no mention list at all
 * @param rateLimitWait time the request waited for its rate-limit slot
 * @param estimatedInputTokens input token estimate used for pacing
 */
public record ExtractionOutput(
    List<Mention> mentions, Duration rateLimitWait, int estimatedInputTokens) {

  public static ExtractionOutput of(List<Mention> mentions) {
    return new ExtractionOutput(mentions, Duration.ZERO, 0);
  }
}
