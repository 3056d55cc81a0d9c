package com.flamingo.ai.mentions.service.coordinator;

/** A chunk whose extraction failed or returned an invalid output. */
public record ChunkFailure(
    String chunkId, int commentCount, String error, String errorType, double durationSeconds) {}
