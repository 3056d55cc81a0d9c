package com.flamingo.ai.mentions.agent.dto;

import java.util.List;

/**
 * One mention as returned by the extraction model. Boxed types stay null when the model omits a
 * field, so missing vital fields can be told apart from false values.
 */
public record ExtractedMention(
    String tempId,
    String restaurantName,
    String restaurantOriginalText,
    String restaurantTempId,
    String dishName,
    List<String> dishCategories,
    String dishOriginalText,
    String dishTempId,
    Boolean dishIsMenuItem,
    List<String> restaurantAttributes,
    List<String> dishAttributes,
    Boolean generalPraise,
    String sourceType, // "post" or "comment"
    String sourceId) {}
