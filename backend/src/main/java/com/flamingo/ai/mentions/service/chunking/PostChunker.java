package com.flamingo.ai.mentions.service.chunking;

import com.flamingo.ai.mentions.domain.model.Post;
import java.util.List;

/**
 * Strategy interface for splitting posts and their comment trees into extraction-sized chunks.
 *
 * <p>Implementations must never split a comment thread across chunks and must flag exactly one
 * chunk per post for post-level extraction.
 */
public interface PostChunker {

  /**
   * Chunks the given posts.
   *
   * @param posts posts with attached comments
   * @return chunks with index-aligned metadata
   */
  ChunkingResult chunk(List<Post> posts);

  /**
   * Checks that a chunking result preserves the input's comments. Problems are reported, never
   * thrown.
   *
   * @param posts the input that was chunked
   * @param result the chunking output
   * @return the validation report
   */
  ChunkValidationReport validate(List<Post> posts, ChunkingResult result);
}
