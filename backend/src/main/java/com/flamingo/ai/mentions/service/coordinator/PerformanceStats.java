package com.flamingo.ai.mentions.service.coordinator;

/** Lifetime counters of the coordinator since startup. */
public record PerformanceStats(
    long runsCoordinated,
    long chunksSucceeded,
    long chunksFailed,
    double successRate,
    double averageChunkSeconds) {}
