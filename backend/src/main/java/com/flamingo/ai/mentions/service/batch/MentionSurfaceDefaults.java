package com.flamingo.ai.mentions.service.batch;

import com.flamingo.ai.mentions.domain.model.Mention;
import java.util.List;

/** Fills blank surface forms from the extracted names so persistence always has one. */
final class MentionSurfaceDefaults {

  private MentionSurfaceDefaults() {}

  static void apply(List<Mention> mentions) {
    for (Mention mention : mentions) {
      if (isBlank(mention.getRestaurantOriginalText())) {
        mention.setRestaurantOriginalText(mention.getRestaurantName());
      }
      if (isBlank(mention.getDishOriginalText())) {
        mention.setDishOriginalText(mention.getDishName());
      }
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
