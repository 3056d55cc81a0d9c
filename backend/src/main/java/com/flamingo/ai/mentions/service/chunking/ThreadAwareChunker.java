package com.flamingo.ai.mentions.service.chunking;

import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.Chunk;
import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.domain.model.ChunkPost;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Post;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Greedy, thread-preserving chunker.
 *
 * <p>Per post: top-level comments are ordered by score (stable), each expanded to its full reply
 * thread, and threads are packed into groups until adding the next one would exceed the character
 * budget, the token budget, or the comment cap while tokens are already above the soft threshold.
 * A single thread larger than the budget still becomes its own chunk. Comments no thread reached
 * are collected into one trailing orphan chunk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ThreadAwareChunker implements PostChunker {

  private final PipelineConfig pipelineConfig;

  @Override
  @Timed(value = "pipeline.chunking", description = "Time to chunk posts into extraction units")
  public ChunkingResult chunk(List<Post> posts) {
    List<Chunk> chunks = new ArrayList<>();
    List<ChunkMetadata> metadata = new ArrayList<>();

    for (Post post : posts) {
      chunkPost(post, chunks, metadata);
    }

    log.debug("Chunked {} posts into {} chunks", posts.size(), chunks.size());
    return new ChunkingResult(chunks, metadata);
  }

  /** Token estimate used for budgeting: a quarter of the characters, at least one. */
  public static int estimateTokens(int chars) {
    if (chars <= 0) {
      return 0;
    }
    return Math.max(1, chars / 4);
  }

  private void chunkPost(Post post, List<Chunk> chunks, List<ChunkMetadata> metadata) {
    PipelineConfig.Chunking limits = pipelineConfig.getChunking();
    int contextChars = post.contextLength();

    if (post.comments().isEmpty()) {
      addPostOnlyChunk(post, chunks, metadata);
      return;
    }

    List<CommentThread> threads = collectThreads(post);
    List<ThreadGroup> groups = packThreads(threads, contextChars, limits);
    int sequence = 0;

    if (groups.isEmpty()) {
      // Nothing attaches to the post directly; keep post-level extraction on its own chunk
      addPostOnlyChunk(post, chunks, metadata);
      sequence++;
    }

    for (int i = 0; i < groups.size(); i++) {
      ThreadGroup group = groups.get(i);
      boolean first = i == 0;
      List<String> rootIds = group.threads.stream().map(t -> t.rootId).toList();
      List<Integer> rootScores = group.threads.stream().map(t -> t.rootScore).toList();
      List<Comment> comments =
          group.threads.stream().flatMap(t -> t.comments.stream()).toList();
      boolean single = group.threads.size() == 1;

      chunks.add(new Chunk(first ? ChunkPost.full(post) : ChunkPost.light(post), comments));
      metadata.add(
          new ChunkMetadata(
              single ? "chunk_" + rootIds.get(0) : "chunk_" + post.id() + "_group_" + (i + 1),
              comments.size(),
              Collections.max(rootScores),
              comments.size() * limits.getSecondsPerComment(),
              estimateTokens(group.charLength),
              single ? rootIds.get(0) : "group:" + String.join(",", rootIds),
              rootIds,
              rootScores,
              post.id(),
              sequence++));
    }

    Set<String> placed =
        groups.stream()
            .flatMap(g -> g.threads.stream())
            .flatMap(t -> t.comments.stream())
            .map(Comment::id)
            .collect(Collectors.toSet());
    List<Comment> orphans =
        post.comments().stream().filter(c -> !placed.contains(c.id())).toList();

    if (!orphans.isEmpty()) {
      int orphanChars = contextChars + orphans.stream().mapToInt(Comment::length).sum();
      int maxScore = orphans.stream().mapToInt(Comment::score).max().orElse(0);
      log.debug("Post {} has {} orphaned comments", post.id(), orphans.size());

      chunks.add(new Chunk(ChunkPost.light(post), orphans));
      metadata.add(
          new ChunkMetadata(
              "chunk_orphaned_" + post.id(),
              orphans.size(),
              maxScore,
              orphans.size() * limits.getSecondsPerComment(),
              estimateTokens(orphanChars),
              ChunkMetadata.ORPHANED_ROOT,
              List.of(),
              List.of(),
              post.id(),
              sequence));
    }
  }

  private void addPostOnlyChunk(Post post, List<Chunk> chunks, List<ChunkMetadata> metadata) {
    chunks.add(new Chunk(ChunkPost.full(post), List.of()));
    metadata.add(
        new ChunkMetadata(
            "chunk_post_" + post.id(),
            0,
            0,
            pipelineConfig.getChunking().getPostOnlySeconds(),
            estimateTokens(post.contextLength()),
            post.id(),
            List.of(),
            List.of(),
            post.id(),
            0));
  }

  /**
   * Expands every top-level comment into its reply thread. The walk is iterative and guarded by a
   * per-post visited set, so cyclic or duplicated parent links cannot loop or place a comment
   * twice.
   */
  private List<CommentThread> collectThreads(Post post) {
    Map<String, List<Comment>> repliesByParent = new HashMap<>();
    for (Comment comment : post.comments()) {
      if (comment.parentId() != null) {
        repliesByParent.computeIfAbsent(comment.parentId(), k -> new ArrayList<>()).add(comment);
      }
    }

    List<Comment> topLevel = new ArrayList<>();
    for (Comment comment : post.comments()) {
      if (isTopLevel(comment, post)) {
        topLevel.add(comment);
      }
    }
    topLevel.sort(Comparator.comparingInt(Comment::score).reversed());

    Set<String> visited = new HashSet<>();
    List<CommentThread> threads = new ArrayList<>();
    for (Comment root : topLevel) {
      if (!visited.add(root.id())) {
        continue;
      }
      List<Comment> threadComments = new ArrayList<>();
      Deque<Comment> stack = new ArrayDeque<>();
      stack.push(root);
      while (!stack.isEmpty()) {
        Comment current = stack.pop();
        threadComments.add(current);
        List<Comment> replies = repliesByParent.getOrDefault(current.id(), List.of());
        for (int i = replies.size() - 1; i >= 0; i--) {
          Comment reply = replies.get(i);
          if (visited.add(reply.id())) {
            stack.push(reply);
          }
        }
      }
      threads.add(new CommentThread(root.id(), root.score(), threadComments));
    }
    return threads;
  }

  private static boolean isTopLevel(Comment comment, Post post) {
    String parent = comment.parentId();
    return parent == null
        || parent.equals(post.id())
        || Objects.equals(parent, post.bareId());
  }

  private static List<ThreadGroup> packThreads(
      List<CommentThread> threads, int contextChars, PipelineConfig.Chunking limits) {
    int softTokens = limits.softTokenThreshold();
    List<ThreadGroup> groups = new ArrayList<>();
    ThreadGroup current = null;

    for (CommentThread thread : threads) {
      if (current == null) {
        current = new ThreadGroup(thread, contextChars);
        continue;
      }

      int proposedComments = current.commentCount + thread.comments.size();
      int proposedChars = current.charLength + thread.charLength;
      int proposedTokens = estimateTokens(proposedChars);

      boolean exceeds =
          proposedChars > limits.getMaxChars()
              || proposedTokens > limits.getMaxTokens()
              || (proposedComments > limits.getMaxComments() && proposedTokens >= softTokens);

      if (exceeds) {
        groups.add(current);
        current = new ThreadGroup(thread, contextChars);
      } else {
        current.add(thread);
      }
    }

    if (current != null) {
      groups.add(current);
    }
    return groups;
  }

  @Override
  public ChunkValidationReport validate(List<Post> posts, ChunkingResult result) {
    List<String> issues = new ArrayList<>();

    int original = posts.stream().mapToInt(p -> p.comments().size()).sum();
    int chunked = result.chunks().stream().mapToInt(c -> c.comments().size()).sum();
    int fromMetadata = result.metadata().stream().mapToInt(ChunkMetadata::commentCount).sum();
    int empty = (int) result.chunks().stream().filter(c -> c.comments().isEmpty()).count();

    if (original != chunked) {
      issues.add("Comment count mismatch: original " + original + ", chunked " + chunked);
    }
    if (chunked != fromMetadata) {
      issues.add("Metadata count mismatch: chunks " + chunked + ", metadata " + fromMetadata);
    }

    Map<String, Long> emptyByPost =
        result.chunks().stream()
            .filter(c -> c.comments().isEmpty())
            .collect(Collectors.groupingBy(c -> c.post().id(), Collectors.counting()));
    emptyByPost.forEach(
        (postId, count) -> {
          if (count > 1) {
            issues.add(
                "Found " + count + " empty chunks for post " + postId + " (at most 1 expected)");
          }
        });

    Set<String> seen = new HashSet<>();
    for (Chunk chunk : result.chunks()) {
      for (Comment comment : chunk.comments()) {
        if (!seen.add(comment.id())) {
          issues.add("Comment " + comment.id() + " appears in more than one chunk");
        }
      }
    }

    return new ChunkValidationReport(
        issues.isEmpty(), issues, original, chunked, fromMetadata, empty, result.size());
  }

  private static final class CommentThread {
    private final String rootId;
    private final int rootScore;
    private final List<Comment> comments;
    private final int charLength;

    private CommentThread(String rootId, int rootScore, List<Comment> comments) {
      this.rootId = rootId;
      this.rootScore = rootScore;
      this.comments = comments;
      this.charLength = comments.stream().mapToInt(Comment::length).sum();
    }
  }

  private static final class ThreadGroup {
    private final List<CommentThread> threads = new ArrayList<>();
    private int commentCount;
    private int charLength;

    private ThreadGroup(CommentThread first, int contextChars) {
      threads.add(first);
      commentCount = first.comments.size();
      charLength = contextChars + first.charLength;
    }

    private void add(CommentThread thread) {
      threads.add(thread);
      commentCount += thread.comments.size();
      charLength += thread.charLength;
    }
  }
}
