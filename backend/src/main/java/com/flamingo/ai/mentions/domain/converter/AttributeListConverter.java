package com.flamingo.ai.mentions.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores category and attribute lists as a JSON array in a TEXT column. Blank entries are dropped
 * on write; an empty list is stored as {@code []}.
 */
@Converter
@Slf4j
public class AttributeListConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> values) {
    List<String> cleaned =
        values == null
            ? List.of()
            : values.stream().filter(v -> v != null && !v.isBlank()).map(String::trim).toList();
    try {
      return MAPPER.writeValueAsString(cleaned);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Attribute list is not serializable", e);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return List.of();
    }
    try {
      return MAPPER.readValue(column, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable attribute list column, treating as empty: {}", e.getOriginalMessage());
      return List.of();
    }
  }
}
