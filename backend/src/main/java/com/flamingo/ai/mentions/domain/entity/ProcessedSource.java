package com.flamingo.ai.mentions.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Ledger row recording that a post or comment was processed by a collection pipeline. */
@Entity
@Table(
    name = "processed_sources",
    indexes = @Index(name = "idx_processed_sources_source", columnList = "sourceId, pipeline"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessedSource {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Collection pipeline name, e.g. {@code chronological} or {@code archive}. */
  @Column(nullable = false)
  private String pipeline;

  @Column(nullable = false)
  private String sourceId;

  @Column(nullable = false)
  private String sourceType;

  private String sourceScope;

  private String batchId;

  @Column(nullable = false)
  private Instant processedAt;

  @PrePersist
  protected void onCreate() {
    if (processedAt == null) {
      processedAt = Instant.now();
    }
  }
}
