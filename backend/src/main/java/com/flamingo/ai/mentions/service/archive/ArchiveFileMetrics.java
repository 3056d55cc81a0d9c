package com.flamingo.ai.mentions.service.archive;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Line counters for one streamed archive file.
 *
 * @param file the archive file
 * @param totalLines non-blank lines read
 * @param validLines lines parsed and applied
 * @param skippedLines parsed lines intentionally ignored (e.g. deleted comment bodies)
 * @param errorLines lines that failed to parse or lacked required references
 * @param processingTime wall time spent streaming the file
 */
public record ArchiveFileMetrics(
    Path file,
    long totalLines,
    long validLines,
    long skippedLines,
    long errorLines,
    Duration processingTime) {}
