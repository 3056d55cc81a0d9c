package com.flamingo.ai.mentions.client.forum;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Read access to the forum's content API. */
public interface ForumContentClient {

  /**
   * Fetches a post with its comment tree.
   *
   * @param scope community name
   * @param postId post id, with or without its {@code t3_} prefix
   * @param depth maximum comment depth
   * @return the raw two-listing thread response
   * @throws com.flamingo.ai.mentions.exception.ForumApiException when the call fails
   */
  JsonNode fetchPostWithComments(String scope, String postId, int depth);

  /**
   * Fetches the ids of a post's newest comments.
   *
   * @param scope community name
   * @param postId post id, with or without its {@code t3_} prefix
   * @param limit maximum number of ids
   * @return comment fullnames, newest first
   * @throws com.flamingo.ai.mentions.exception.ForumApiException when the call fails
   */
  List<String> fetchRecentCommentIds(String scope, String postId, int limit);

  /** Canonical url of a post. */
  String postUrl(String scope, String postId);
}
