package com.flamingo.ai.mentions.service.coordinator;

/** Live view of the extraction pool. */
public record QueueStatus(
    int activeWorkers, int poolSize, int queuedChunks, long backpressureRemainingMs) {}
