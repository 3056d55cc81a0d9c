package com.flamingo.ai.mentions.service.coordinator;

import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.service.extraction.ExtractionOutput;

/** A chunk whose extraction returned a valid output. */
public record ChunkSuccess(
    String chunkId, ChunkMetadata metadata, ExtractionOutput output, double durationSeconds) {}
