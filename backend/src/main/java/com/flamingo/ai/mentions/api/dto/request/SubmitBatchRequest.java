package com.flamingo.ai.mentions.api.dto.request;

import com.flamingo.ai.mentions.domain.model.BatchJob;
import com.flamingo.ai.mentions.domain.model.BatchOptions;
import com.flamingo.ai.mentions.domain.model.CollectionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running one batch of post ids. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitBatchRequest {

  @NotBlank(message = "Batch id is required")
  private String batchId;

  private String parentJobId;

  @NotBlank(message = "Collection type is required")
  @Pattern(
      regexp = "^(chronological|keyword|archive|on-demand)$",
      message = "Collection type must be chronological, keyword, archive, or on-demand")
  private String collectionType;

  @NotBlank(message = "Source scope is required")
  private String sourceScope;

  @Min(value = 1, message = "Batch number must be at least 1")
  @Builder.Default
  private int batchNumber = 1;

  @Min(value = 1, message = "Total batches must be at least 1")
  @Builder.Default
  private int totalBatches = 1;

  private int priority;

  @NotEmpty(message = "At least one post id is required")
  @Size(max = 100, message = "A batch must not exceed 100 posts")
  private List<String> postIds;

  @Min(value = 1, message = "Depth must be at least 1")
  @Max(value = 50, message = "Depth must be at most 50")
  private Integer depth;

  @Min(value = 0, message = "Delay must not be negative")
  private long delayBetweenRequestsMs;

  /** Builds the job this request describes. */
  public BatchJob toJob(Instant createdAt) {
    return BatchJob.builder()
        .batchId(batchId)
        .parentJobId(parentJobId != null ? parentJobId : batchId)
        .collectionType(CollectionType.fromPipeline(collectionType))
        .sourceScope(sourceScope)
        .batchNumber(batchNumber)
        .totalBatches(totalBatches)
        .createdAt(createdAt)
        .priority(priority)
        .postIds(postIds)
        .options(new BatchOptions(depth, delayBetweenRequestsMs))
        .build();
  }
}
