package com.flamingo.ai.mentions.domain.model;

/**
 * A restaurant or dish entity touched by persistence.
 *
 * @param id persistence id
 * @param name canonical name
 * @param type {@code restaurant} or {@code dish}
 */
public record EntitySummary(String id, String name, String type) {}
