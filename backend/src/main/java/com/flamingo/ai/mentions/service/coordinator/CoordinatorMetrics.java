package com.flamingo.ai.mentions.service.coordinator;

/**
 * Aggregate numbers for one coordinated run.
 *
 * @param totalDurationSeconds wall time of the whole run
 * @param chunksProcessed chunks dispatched
 * @param successfulChunks chunks with a valid output
 * @param failedChunks chunks that failed
 * @param successRate percentage of successful chunks, 100 when nothing was dispatched
 * @param engagedChunks successful chunks whose root comment score is above the threshold
 * @param averageChunkSeconds mean duration of successful chunks
 * @param fastestChunkSeconds fastest successful chunk
 * @param slowestChunkSeconds slowest successful chunk
 * @param mentionsExtracted mentions across successful chunks
 */
public record CoordinatorMetrics(
    double totalDurationSeconds,
    int chunksProcessed,
    int successfulChunks,
    int failedChunks,
    double successRate,
    int engagedChunks,
    double averageChunkSeconds,
    double fastestChunkSeconds,
    double slowestChunkSeconds,
    int mentionsExtracted) {}
