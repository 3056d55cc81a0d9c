package com.flamingo.ai.mentions.service.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Post;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts a forum thread response (a two-element array: post listing, comment listing) into a
 * flat, parent-linked {@link Post} and {@link Comment} list.
 *
 * <p>Deleted and removed comments are dropped, but their replies are still walked and kept; they
 * either attach to a surviving ancestor or end up in the chunker's orphan chunk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentNormalizer {

  private static final String COMMENT_KIND = "t1";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** Parses and normalizes a raw JSON thread response. */
  public NormalizedThread normalize(String rawResponse, String postUrl) {
    if (rawResponse == null || rawResponse.isBlank()) {
      return NormalizedThread.empty();
    }
    try {
      return normalize(objectMapper.readTree(rawResponse), postUrl);
    } catch (JsonProcessingException e) {
      log.warn("Unparseable thread response for {}: {}", postUrl, e.getOriginalMessage());
      return NormalizedThread.empty();
    }
  }

  /**
   * Normalizes an already parsed thread response.
   *
   * @param response two-element array of listings
   * @param postUrl canonical url of the post
   * @return the post (null when absent or empty) with its surviving comments
   */
  public NormalizedThread normalize(JsonNode response, String postUrl) {
    if (response == null || !response.isArray() || response.size() < 2) {
      return NormalizedThread.empty();
    }

    Post post = null;
    JsonNode postChildren = response.get(0).path("data").path("children");
    for (JsonNode child : postChildren) {
      JsonNode data = child.get("data");
      if (data != null && data.isObject()) {
        post = toPost(data, postUrl);
        break;
      }
    }

    List<Comment> comments = flattenComments(response.get(1).path("data").path("children"));
    return new NormalizedThread(post, comments);
  }

  private Post toPost(JsonNode data, String postUrl) {
    String title = ForumFields.textOr(data, "title", "");
    String selfText = ForumFields.text(data, "selftext");
    if (title.isBlank() && (selfText == null || selfText.isBlank())) {
      return null;
    }

    String id = ForumFields.text(data, "name");
    if (id == null) {
      id = ForumFields.withPrefix(ForumFields.text(data, "id"), ForumFields.POST_PREFIX);
    }

    return new Post(
        id != null ? id : "t3_unknown",
        title,
        selfText != null ? selfText : title,
        ForumFields.textOr(data, "subreddit", ""),
        ForumFields.textOr(data, "author", "unknown"),
        postUrl,
        ForumFields.score(data),
        ForumFields.timestamp(data, "created_utc", clock),
        List.of());
  }

  /** Depth-first walk in API order, iterative so deep reply chains cannot overflow the stack. */
  private List<Comment> flattenComments(JsonNode children) {
    List<Comment> result = new ArrayList<>();
    Deque<JsonNode> stack = new ArrayDeque<>();
    pushReversed(stack, children);

    while (!stack.isEmpty()) {
      JsonNode child = stack.pop();
      JsonNode data = child.get("data");
      if (data == null || !data.isObject()) {
        continue;
      }

      if (COMMENT_KIND.equals(ForumFields.text(child, "kind"))) {
        Comment comment = toComment(data);
        if (comment != null) {
          result.add(comment);
        }
      }

      JsonNode replies = data.get("replies");
      if (replies != null && replies.isObject()) {
        pushReversed(stack, replies.path("data").path("children"));
      }
    }
    return result;
  }

  private Comment toComment(JsonNode data) {
    String body = ForumFields.text(data, "body");
    if (ForumFields.isRemoved(body)) {
      return null;
    }
    String id = ForumFields.text(data, "name");
    if (id == null) {
      id = ForumFields.withPrefix(ForumFields.text(data, "id"), ForumFields.COMMENT_PREFIX);
    }
    if (id == null) {
      return null;
    }
    String url = ForumFields.permalink(data);
    return new Comment(
        id,
        body,
        ForumFields.textOr(data, "author", ForumFields.DELETED),
        ForumFields.score(data),
        ForumFields.timestamp(data, "created_utc", clock),
        ForumFields.parentId(data),
        url != null ? url : "");
  }

  private static void pushReversed(Deque<JsonNode> stack, JsonNode children) {
    if (children == null || !children.isArray()) {
      return;
    }
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(children.get(i));
    }
  }
}
