package com.flamingo.ai.mentions.service.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.service.archive.NdjsonArchiveReader.LineOutcome;
import com.flamingo.ai.mentions.service.normalize.ForumFields;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rebuilds posts and comments for one community from its bulk archive pair: a submissions file
 * and a comments file, both zstd-compressed NDJSON named {@code {scope}_{submissions|comments}.zst}
 * under {@code {baseDirectory}/{scope}/}.
 *
 * <p>The first pass indexes submissions by post id. The second attaches each comment to the post
 * named by its {@code link_id}, synthesizing a placeholder post when the submission was never
 * seen. Comments with a missing or unrecognized {@code parent_id} reply directly to the post.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArchiveReconstructor {

  static final String PLACEHOLDER_TITLE = "(archived submission)";
  static final String DEFAULT_TITLE = "(archived post)";

  private static final int FALLBACK_ID_LENGTH = 16;

  private final NdjsonArchiveReader reader;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  /** Kind of archive file in a scope's pair. */
  public enum ArchiveFileType {
    SUBMISSIONS("submissions"),
    COMMENTS("comments");

    private final String suffix;

    ArchiveFileType(String suffix) {
      this.suffix = suffix;
    }
  }

  /** Location of one archive file for {@code scope}. */
  public Path archiveFile(String scope, ArchiveFileType type) {
    return Path.of(pipelineConfig.getArchive().getBaseDirectory())
        .resolve(scope)
        .resolve(scope + "_" + type.suffix + ".zst");
  }

  /** Reconstructs {@code scope} from the configured archive directory. */
  @Timed(value = "pipeline.archive.reconstruct", description = "Time to rebuild an archive scope")
  public ArchiveReconstruction reconstruct(String scope) {
    return reconstruct(
        scope,
        archiveFile(scope, ArchiveFileType.SUBMISSIONS),
        archiveFile(scope, ArchiveFileType.COMMENTS));
  }

  /**
   * Reconstructs {@code scope} from explicit files.
   *
   * @param scope the community name, used when records lack one
   * @param submissionsFile submissions archive
   * @param commentsFile comments archive
   * @return posts ascending by creation time, each with comments descending by score
   */
  public ArchiveReconstruction reconstruct(String scope, Path submissionsFile, Path commentsFile) {
    Map<String, PostDraft> drafts = new LinkedHashMap<>();

    ArchiveFileMetrics submissionMetrics =
        reader.stream(submissionsFile, record -> applySubmission(record, scope, drafts));
    ArchiveFileMetrics commentMetrics =
        reader.stream(commentsFile, record -> applyComment(record, scope, drafts));

    List<Post> posts = new ArrayList<>(drafts.size());
    for (PostDraft draft : drafts.values()) {
      posts.add(draft.build());
    }
    posts.sort(Comparator.comparing(Post::createdAt));

    log.info(
        "Reconstructed scope {}: {} posts, {} comments",
        scope,
        posts.size(),
        posts.stream().mapToInt(p -> p.comments().size()).sum());
    return new ArchiveReconstruction(scope, posts, submissionMetrics, commentMetrics);
  }

  private LineOutcome applySubmission(
      JsonNode record, String scope, Map<String, PostDraft> drafts) {
    String rawId = ForumFields.text(record, "id");
    if (rawId == null) {
      rawId = ForumFields.text(record, "name");
    }
    String postId = ForumFields.withPrefix(rawId, ForumFields.POST_PREFIX);
    if (postId == null) {
      postId =
          ForumFields.POST_PREFIX
              + fallbackId(
                  ForumFields.textOr(record, "title", ""),
                  ForumFields.textOr(record, "author", ""),
                  record.path("created_utc").asText(""),
                  ForumFields.textOr(record, "permalink", ""));
    }

    String title = ForumFields.text(record, "title");
    String selfText = ForumFields.text(record, "selftext");
    String body = ForumFields.isRemoved(selfText) ? title : selfText;
    String url = ForumFields.permalink(record);
    if (url == null) {
      url = ForumFields.text(record, "url");
    }

    PostDraft draft = drafts.computeIfAbsent(postId, PostDraft::new);
    draft.title = title != null ? title : DEFAULT_TITLE;
    draft.body = body != null ? body : "";
    draft.sourceScope = ForumFields.textOr(record, "subreddit", scope);
    draft.author = ForumFields.textOr(record, "author", ForumFields.DELETED);
    draft.url = url != null ? url : "";
    draft.score = ForumFields.score(record);
    draft.createdAt = ForumFields.timestamp(record, "created_utc", clock);
    return LineOutcome.APPLIED;
  }

  private LineOutcome applyComment(
      JsonNode record, String scope, Map<String, PostDraft> drafts) {
    String body = ForumFields.text(record, "body");
    if (ForumFields.isRemoved(body)) {
      return LineOutcome.SKIPPED;
    }

    String linkId = ForumFields.text(record, "link_id");
    String rawParent = ForumFields.text(record, "parent_id");
    String createdRaw = record.path("created_utc").asText("");

    String postId = ForumFields.withPrefix(linkId, ForumFields.POST_PREFIX);
    if (postId == null && rawParent != null && rawParent.startsWith(ForumFields.POST_PREFIX)) {
      postId = rawParent;
    }
    if (postId == null) {
      postId = ForumFields.POST_PREFIX + fallbackId("post", rawParent, createdRaw, body);
    }

    String permalink = ForumFields.permalink(record);
    PostDraft draft = drafts.get(postId);
    if (draft == null) {
      draft = new PostDraft(postId);
      draft.title = PLACEHOLDER_TITLE;
      draft.body = PLACEHOLDER_TITLE;
      draft.sourceScope = ForumFields.textOr(record, "subreddit", scope);
      draft.author = ForumFields.textOr(record, "author", ForumFields.DELETED);
      draft.url = permalink != null ? permalink : "";
      draft.score = ForumFields.score(record);
      draft.createdAt = ForumFields.timestamp(record, "created_utc", clock);
      drafts.put(postId, draft);
    }

    String commentId =
        ForumFields.withPrefix(ForumFields.text(record, "id"), ForumFields.COMMENT_PREFIX);
    if (commentId == null) {
      commentId = ForumFields.COMMENT_PREFIX + fallbackId(linkId, rawParent, createdRaw, body);
    }

    String parentId = ForumFields.parentId(record);
    draft.comments.add(
        new Comment(
            commentId,
            body,
            ForumFields.textOr(record, "author", ForumFields.DELETED),
            ForumFields.score(record),
            ForumFields.timestamp(record, "created_utc", clock),
            parentId != null ? parentId : postId,
            permalink != null ? permalink : ""));
    return LineOutcome.APPLIED;
  }

  /** Stable id derived from record content, so re-running an archive yields the same ids. */
  @VisibleForTesting
  static String fallbackId(String... parts) {
    String seed =
        Arrays.stream(parts).map(part -> part == null ? "" : part).collect(Collectors.joining("|"));
    return Hashing.sha256()
        .hashString(seed, StandardCharsets.UTF_8)
        .toString()
        .substring(0, FALLBACK_ID_LENGTH);
  }

  private static final class PostDraft {
    private final String id;
    private final List<Comment> comments = new ArrayList<>();
    private String title;
    private String body;
    private String sourceScope;
    private String author;
    private String url;
    private int score;
    private Instant createdAt;

    private PostDraft(String id) {
      this.id = id;
    }

    private Post build() {
      comments.sort(Comparator.comparingInt(Comment::score).reversed());
      return new Post(id, title, body, sourceScope, author, url, score, createdAt, comments);
    }
  }
}
