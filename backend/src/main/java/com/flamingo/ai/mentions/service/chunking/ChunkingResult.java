package com.flamingo.ai.mentions.service.chunking;

import com.flamingo.ai.mentions.domain.model.Chunk;
import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import java.util.List;

/**
 * Output of chunking a set of posts.
 *
 * @param chunks the chunks, post by post
 * @param metadata metadata index-aligned with {@code chunks}
 */
public record ChunkingResult(List<Chunk> chunks, List<ChunkMetadata> metadata) {

  public ChunkingResult {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    metadata = metadata == null ? List.of() : List.copyOf(metadata);
    if (chunks.size() != metadata.size()) {
      throw new IllegalArgumentException(
          "Chunk and metadata counts differ: " + chunks.size() + " vs " + metadata.size());
    }
  }

  public static ChunkingResult empty() {
    return new ChunkingResult(List.of(), List.of());
  }

  public int size() {
    return chunks.size();
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
