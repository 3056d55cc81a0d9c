package com.flamingo.ai.mentions.service.batch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Tokenization shared by name normalization and duplicate filtering. */
final class NameTokens {

  private static final Pattern SEPARATOR = Pattern.compile("[^a-z0-9]+");

  private NameTokens() {}

  /** Lower-cased alphanumeric runs of {@code value}; empty for null or blank input. */
  static List<String> of(String value) {
    List<String> tokens = new ArrayList<>();
    if (value == null || value.isBlank()) {
      return tokens;
    }
    for (String token : SEPARATOR.split(value.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  static String key(List<String> tokens) {
    return String.join(" ", tokens);
  }

  static boolean isSubset(Collection<String> small, Set<String> big) {
    return big.containsAll(small);
  }
}
