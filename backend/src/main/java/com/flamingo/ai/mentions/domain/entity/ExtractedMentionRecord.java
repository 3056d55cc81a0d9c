package com.flamingo.ai.mentions.domain.entity;

import com.flamingo.ai.mentions.domain.converter.AttributeListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A cleaned mention as stored after a successful batch. */
@Entity
@Table(
    name = "extracted_mentions",
    indexes = {
      @Index(name = "idx_mentions_restaurant", columnList = "restaurantKey"),
      @Index(name = "idx_mentions_restaurant_dish", columnList = "restaurantKey, dishKey")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractedMentionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String batchId;

  @Column(nullable = false)
  private String collectionType;

  private String sourceScope;

  @Column(nullable = false)
  private String sourceId;

  private String sourceType;

  @Column(nullable = false)
  private String restaurantName;

  /** Token key of the restaurant name; identifies the restaurant entity. */
  @Column(nullable = false)
  private String restaurantKey;

  private String restaurantOriginalText;

  private String dishName;

  /** Token key of the dish name, null for general praise. */
  private String dishKey;

  private String dishOriginalText;

  @Convert(converter = AttributeListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> dishCategories = new ArrayList<>();

  @Convert(converter = AttributeListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> restaurantAttributes = new ArrayList<>();

  @Convert(converter = AttributeListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> dishAttributes = new ArrayList<>();

  private Boolean dishIsMenuItem;

  @Column(nullable = false)
  private boolean generalPraise;

  private int sourceUpvotes;

  private String sourceUrl;

  private Instant sourceCreatedAt;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }
}
