package com.flamingo.ai.mentions.config;

import com.flamingo.ai.mentions.domain.model.CollectionType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the collection-to-extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Chunking chunking = new Chunking();
  private Coordinator coordinator = new Coordinator();
  private RateLimit rateLimit = new RateLimit();
  private Freshness freshness = new Freshness();
  private Archive archive = new Archive();
  private ForumApi forumApi = new ForumApi();
  private Ranking ranking = new Ranking();
  private Diagnostics diagnostics = new Diagnostics();

  @Getter
  @Setter
  public static class Chunking {
    private int maxComments = 80;
    private int maxChars = 12000;
    private int maxTokens = 35000;

    /** Lower bound of the token level at which the comment cap starts to apply. */
    private int softTokenFloor = 1000;

    /** Fraction of maxTokens at which the comment cap starts to apply. */
    private double softTokenRatio = 0.8;

    private double secondsPerComment = 6.4;
    private double postOnlySeconds = 5;

    public int softTokenThreshold() {
      return Math.max(softTokenFloor, (int) Math.floor(maxTokens * softTokenRatio));
    }
  }

  @Getter
  @Setter
  public static class Coordinator {
    private int poolSize = 16;

    /** Size of the round-robin worker id space handed to the rate limiter. */
    private int workerIdSpace = 16;

    private long maxWaitPollMs = 2000;

    /** Root score above which a chunk counts as an engaged thread. */
    private int engagedScoreThreshold = 10;

    /** Cooldown applied when a rate-limit error carries no retry-after hint. */
    private long defaultRateLimitCooldownMs = 5000;
  }

  @Getter
  @Setter
  public static class RateLimit {
    private int safeRequestsPerMinute = 950;
    private long minSpacingMs = 63;
    private long workerSlotMs = 30;
    private int inputTokenOverhead = 2600;
    private int minInputTokens = 1500;
    private int maxInputTokens = 15000;
  }

  @Getter
  @Setter
  public static class Freshness {
    private boolean enabled = true;
    private int lookbackDays = 21;
    private int probeSampleSize = 5;
    private int minNewComments = 3;

    /** Ledger pipeline scopes consulted when deciding whether a post was already processed. */
    private List<String> pipelineScopes =
        new ArrayList<>(List.of("chronological", "archive", "keyword", "on-demand"));
  }

  @Getter
  @Setter
  public static class Archive {
    private String baseDirectory = "data/archives";
    private int batchSize = 20;
    private int maxLineBytes = 8 * 1024 * 1024;

    /** zstd long-distance window; bulk forum dumps are compressed with a 2 GiB window. */
    private int windowLogMax = 31;
  }

  @Getter
  @Setter
  public static class ForumApi {
    private String baseUrl = "https://oauth.reddit.com";
    private String userAgent = "forum-mention-pipeline/0.1";
    private String bearerToken = "";
    private int readTimeoutMs = 15000;
    private int commentDepth = 10;
  }

  @Getter
  @Setter
  public static class Ranking {
    private boolean enabled = true;
    private Set<CollectionType> refreshCollectionTypes =
        EnumSet.of(CollectionType.ARCHIVE, CollectionType.CHRONOLOGICAL);
  }

  @Getter
  @Setter
  public static class Diagnostics {
    /** Number of posts copied into the result as a sample; 0 disables sampling. */
    private int postSampleCount = 0;

    private int postSampleCommentCount = 2;
    private int rawMentionSampleSize = 25;
  }
}
