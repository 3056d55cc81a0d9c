package com.flamingo.ai.mentions.client.forum;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.exception.ForumApiException;
import com.flamingo.ai.mentions.service.normalize.ForumFields;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** HTTP client for the Reddit thread endpoints. Encapsulates all WebClient communication. */
@Component
@Slf4j
public class RedditApiClient implements ForumContentClient {

  private static final String THREAD_PATH = "/r/{scope}/comments/{postId}";

  private final WebClient webClient;
  private final int readTimeoutMs;

  public RedditApiClient(PipelineConfig pipelineConfig) {
    PipelineConfig.ForumApi api = pipelineConfig.getForumApi();
    this.readTimeoutMs = api.getReadTimeoutMs();
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(api.getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
    if (api.getBearerToken() != null && !api.getBearerToken().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + api.getBearerToken());
    }
    this.webClient = builder.build();
    log.info("Forum API client initialized: baseUrl={}", api.getBaseUrl());
  }

  @Override
  public JsonNode fetchPostWithComments(String scope, String postId, int depth) {
    return get(scope, postId, "top", depth, null);
  }

  @Override
  public List<String> fetchRecentCommentIds(String scope, String postId, int limit) {
    JsonNode response = get(scope, postId, "new", 1, limit);
    List<String> ids = new ArrayList<>();
    if (response == null || !response.isArray() || response.size() < 2) {
      return ids;
    }
    for (JsonNode child : response.get(1).path("data").path("children")) {
      if (!"t1".equals(ForumFields.text(child, "kind"))) {
        continue;
      }
      JsonNode data = child.path("data");
      String id = ForumFields.text(data, "name");
      if (id == null) {
        id = ForumFields.withPrefix(ForumFields.text(data, "id"), ForumFields.COMMENT_PREFIX);
      }
      if (id != null) {
        ids.add(id);
      }
      if (ids.size() >= limit) {
        break;
      }
    }
    return ids;
  }

  @Override
  public String postUrl(String scope, String postId) {
    return ForumFields.PERMALINK_HOST + "/r/" + scope + "/comments/" + bareId(postId) + "/";
  }

  private JsonNode get(String scope, String postId, String sort, int depth, Integer limit) {
    try {
      return webClient
          .get()
          .uri(
              uriBuilder -> {
                uriBuilder
                    .path(THREAD_PATH)
                    .queryParam("sort", sort)
                    .queryParam("depth", depth)
                    .queryParam("raw_json", 1);
                if (limit != null) {
                  uriBuilder.queryParam("limit", limit);
                }
                return uriBuilder.build(scope, bareId(postId));
              })
          .accept(MediaType.APPLICATION_JSON)
          .retrieve()
          .bodyToMono(JsonNode.class)
          .timeout(Duration.ofMillis(readTimeoutMs))
          .block();
    } catch (WebClientResponseException e) {
      if (e.getStatusCode().value() == 429) {
        log.warn("Forum API rate limited for {}/{}", scope, postId);
      }
      throw new ForumApiException(
          "Forum API returned " + e.getStatusCode().value() + " for " + scope + "/" + postId,
          e.getStatusCode().value(),
          e);
    } catch (WebClientException e) {
      throw new ForumApiException("Forum API call failed for " + scope + "/" + postId, 0, e);
    } catch (RuntimeException e) {
      // block() surfaces reactor timeouts as unchecked wrappers
      throw new ForumApiException("Forum API call failed for " + scope + "/" + postId, 0, e);
    }
  }

  private static String bareId(String postId) {
    return postId != null && postId.startsWith(ForumFields.POST_PREFIX)
        ? postId.substring(ForumFields.POST_PREFIX.length())
        : postId;
  }
}
