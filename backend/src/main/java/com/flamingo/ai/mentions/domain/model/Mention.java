package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One restaurant/food pairing extracted from a post or comment. Created by the extraction backend,
 * enriched and normalized in place by the batch orchestrator, then handed to persistence.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Mention {

  private String tempId;

  private String restaurantName;
  private String restaurantOriginalText;
  private String restaurantTempId;

  private String dishName;
  @Builder.Default private List<String> dishCategories = new ArrayList<>();
  private String dishOriginalText;
  private String dishTempId;
  private Boolean dishIsMenuItem;

  @Builder.Default private List<String> restaurantAttributes = new ArrayList<>();
  @Builder.Default private List<String> dishAttributes = new ArrayList<>();

  /** True when the mention praises the restaurant without naming a dish. */
  private Boolean generalPraise;

  private SourceType sourceType;
  private String sourceId;

  // Filled from the batch's own posts after extraction
  private String sourceContent;
  private Integer sourceUpvotes;
  private String sourceUrl;
  private Instant sourceCreatedAt;
  private String sourceScope;
  private String postContext;

  public boolean hasDish() {
    return dishName != null && !dishName.isBlank();
  }
}
