package com.flamingo.ai.mentions.service.persistence;

/** Stores a batch's cleaned mentions and records its sources as processed. */
public interface MentionPersistence {

  PersistenceResult persist(PersistenceRequest request);
}
