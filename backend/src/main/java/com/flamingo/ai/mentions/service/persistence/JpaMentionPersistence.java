package com.flamingo.ai.mentions.service.persistence;

import com.flamingo.ai.mentions.domain.entity.ExtractedMentionRecord;
import com.flamingo.ai.mentions.domain.entity.ProcessedSource;
import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.EntitySummary;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.domain.model.SourceType;
import com.flamingo.ai.mentions.domain.repository.ExtractedMentionRepository;
import com.flamingo.ai.mentions.domain.repository.ProcessedSourceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores mentions in {@code extracted_mentions} and marks every post and comment of the batch in
 * the source ledger. A restaurant counts as created the first time its name key is stored; a
 * connection is a restaurant-dish pair stored for the first time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaMentionPersistence implements MentionPersistence {

  private static final String RESTAURANT = "restaurant";

  private final ExtractedMentionRepository mentionRepository;
  private final ProcessedSourceRepository processedSourceRepository;
  private final Clock clock;

  @Override
  @Transactional
  public PersistenceResult persist(PersistenceRequest request) {
    Map<String, EntitySummary> created = new LinkedHashMap<>();
    Map<String, EntitySummary> reused = new LinkedHashMap<>();
    Set<String> connections = new LinkedHashSet<>();
    List<ExtractedMentionRecord> records = new ArrayList<>(request.mentions().size());

    for (Mention mention : request.mentions()) {
      String restaurantKey = key(mention.getRestaurantName());
      if (restaurantKey.isEmpty()) {
        continue;
      }
      String dishKey = mention.hasDish() ? key(mention.getDishName()) : null;
      String entityId = RESTAURANT + ":" + restaurantKey;

      if (!created.containsKey(entityId) && !reused.containsKey(entityId)) {
        EntitySummary summary =
            new EntitySummary(entityId, mention.getRestaurantName(), RESTAURANT);
        if (mentionRepository.existsByRestaurantKey(restaurantKey)) {
          reused.put(entityId, summary);
        } else {
          created.put(entityId, summary);
        }
      }

      if (dishKey != null && !dishKey.isEmpty()) {
        String connectionId = entityId + "|dish:" + dishKey;
        if (!connections.contains(connectionId)
            && !mentionRepository.existsByRestaurantKeyAndDishKey(restaurantKey, dishKey)) {
          connections.add(connectionId);
        }
      }

      records.add(toRecord(mention, restaurantKey, dishKey, request));
    }

    mentionRepository.saveAll(records);
    int ledgerRows = recordProcessedSources(request);

    log.info(
        "Persisted batch {}: {} mentions, {} new restaurants, {} new connections, {} ledger rows",
        request.batchId(),
        records.size(),
        created.size(),
        connections.size(),
        ledgerRows);

    return PersistenceResult.builder()
        .entitiesCreated(created.size())
        .connectionsCreated(connections.size())
        .createdEntityIds(new ArrayList<>(created.keySet()))
        .affectedConnectionIds(new ArrayList<>(connections))
        .createdEntities(new ArrayList<>(created.values()))
        .reusedEntities(new ArrayList<>(reused.values()))
        .build();
  }

  private int recordProcessedSources(PersistenceRequest request) {
    Instant now = clock.instant();
    String pipeline = request.collectionType().pipeline();
    List<ProcessedSource> rows = new ArrayList<>();
    Set<String> unsettled = request.unsettledSourceIds();
    for (Post post : request.posts()) {
      if (!unsettled.contains(post.id())) {
        rows.add(
            ledgerRow(pipeline, post.id(), SourceType.POST, post.sourceScope(), request, now));
      }
      for (Comment comment : post.comments()) {
        if (unsettled.contains(comment.id())) {
          continue;
        }
        rows.add(
            ledgerRow(
                pipeline, comment.id(), SourceType.COMMENT, post.sourceScope(), request, now));
      }
    }
    processedSourceRepository.saveAll(rows);
    return rows.size();
  }

  private static ProcessedSource ledgerRow(
      String pipeline,
      String sourceId,
      SourceType type,
      String scope,
      PersistenceRequest request,
      Instant now) {
    return ProcessedSource.builder()
        .pipeline(pipeline)
        .sourceId(sourceId)
        .sourceType(type.wireValue())
        .sourceScope(scope != null ? scope : request.sourceScope())
        .batchId(request.batchId())
        .processedAt(now)
        .build();
  }

  private static ExtractedMentionRecord toRecord(
      Mention mention, String restaurantKey, String dishKey, PersistenceRequest request) {
    return ExtractedMentionRecord.builder()
        .batchId(request.batchId())
        .collectionType(request.collectionType().pipeline())
        .sourceScope(mention.getSourceScope())
        .sourceId(mention.getSourceId())
        .sourceType(mention.getSourceType() != null ? mention.getSourceType().wireValue() : null)
        .restaurantName(mention.getRestaurantName())
        .restaurantKey(restaurantKey)
        .restaurantOriginalText(mention.getRestaurantOriginalText())
        .dishName(mention.getDishName())
        .dishKey(dishKey)
        .dishOriginalText(mention.getDishOriginalText())
        .dishCategories(mention.getDishCategories())
        .restaurantAttributes(mention.getRestaurantAttributes())
        .dishAttributes(mention.getDishAttributes())
        .dishIsMenuItem(mention.getDishIsMenuItem())
        .generalPraise(Boolean.TRUE.equals(mention.getGeneralPraise()))
        .sourceUpvotes(mention.getSourceUpvotes() != null ? mention.getSourceUpvotes() : 0)
        .sourceUrl(mention.getSourceUrl())
        .sourceCreatedAt(mention.getSourceCreatedAt())
        .build();
  }

  /** Lower-cased, whitespace-collapsed name used as the entity key. */
  static String key(String name) {
    if (name == null) {
      return "";
    }
    return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
  }
}
