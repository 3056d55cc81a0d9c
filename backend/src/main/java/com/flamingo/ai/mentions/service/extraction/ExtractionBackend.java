package com.flamingo.ai.mentions.service.extraction;

import com.flamingo.ai.mentions.domain.model.Chunk;
import java.time.Duration;

/**
 * The language-model extraction step, seen as a black box by the coordinator.
 *
 * <p>Implementations may throw {@link com.flamingo.ai.mentions.exception.LlmServiceException};
 * a rate-limited one tells the coordinator to hold every worker back.
 */
public interface ExtractionBackend {

  /**
   * Extracts mentions from one chunk.
   *
   * @param chunk the chunk
   * @param workerId round-robin worker id used to reserve a request slot
   * @return the extraction output
   */
  ExtractionOutput extract(Chunk chunk, String workerId);

  /** Time the backend wants callers to wait before the next dispatch; zero when clear. */
  Duration throttleDelay();
}
