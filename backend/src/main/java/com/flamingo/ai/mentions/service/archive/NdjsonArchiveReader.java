package com.flamingo.ai.mentions.service.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.exception.ArchiveProcessingException;
import com.github.luben.zstd.ZstdInputStream;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Streams a compressed newline-delimited JSON file one record at a time. Only the current line,
 * capped at the configured maximum, is held in memory. A malformed line is counted and skipped;
 * only a file that cannot be opened or decompressed fails as a whole.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NdjsonArchiveReader {

  private static final String ZSTD_EXTENSION = ".zst";
  private static final int READ_BUFFER_BYTES = 1 << 16;
  private static final int READ_BUFFER_CHARS = 1 << 13;

  private final ObjectMapper objectMapper;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /** Outcome a handler reports for one parsed record. */
  public enum LineOutcome {
    APPLIED,
    SKIPPED,
    REJECTED
  }

  /** Receives each parsed record. */
  @FunctionalInterface
  public interface RecordHandler {
    LineOutcome handle(JsonNode record);
  }

  /**
   * Streams every record of {@code file} into {@code handler}.
   *
   * @throws ArchiveProcessingException if the file cannot be opened or its stream is corrupt
   */
  public ArchiveFileMetrics stream(Path file, RecordHandler handler) {
    long started = System.nanoTime();
    long total = 0;
    long valid = 0;
    long skipped = 0;
    long errors = 0;
    int maxLineChars = pipelineConfig.getArchive().getMaxLineBytes();

    try (BoundedLineReader reader = new BoundedLineReader(open(file), maxLineChars)) {
      long length;
      while ((length = reader.readLine()) >= 0) {
        if (length > maxLineChars) {
          total++;
          errors++;
          log.debug("Oversized line {} in {} ({} chars)", total, file, length);
          continue;
        }
        String line = reader.line();
        if (line.isBlank()) {
          continue;
        }
        total++;

        LineOutcome outcome;
        try {
          JsonNode record = objectMapper.readTree(line);
          outcome =
              record != null && record.isObject() ? handler.handle(record) : LineOutcome.REJECTED;
        } catch (JsonProcessingException e) {
          outcome = LineOutcome.REJECTED;
          log.debug("Malformed line {} in {}: {}", total, file, e.getOriginalMessage());
        }

        switch (outcome) {
          case APPLIED -> valid++;
          case SKIPPED -> skipped++;
          case REJECTED -> errors++;
        }
      }
    } catch (IOException e) {
      throw new ArchiveProcessingException(file, "Failed to stream archive file " + file, e);
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    meterRegistry.counter("pipeline.archive.lines", "result", "valid").increment(valid);
    meterRegistry.counter("pipeline.archive.lines", "result", "skipped").increment(skipped);
    meterRegistry.counter("pipeline.archive.lines", "result", "error").increment(errors);
    log.info(
        "Streamed {}: total={}, valid={}, skipped={}, errors={}, took={}ms",
        file.getFileName(),
        total,
        valid,
        skipped,
        errors,
        elapsed.toMillis());
    return new ArchiveFileMetrics(file, total, valid, skipped, errors, elapsed);
  }

  private Reader open(Path file) throws IOException {
    InputStream raw = new BufferedInputStream(Files.newInputStream(file), READ_BUFFER_BYTES);
    InputStream decoded = raw;
    if (file.getFileName().toString().endsWith(ZSTD_EXTENSION)) {
      try {
        ZstdInputStream zstd = new ZstdInputStream(raw);
        zstd.setLongMax(pipelineConfig.getArchive().getWindowLogMax());
        decoded = zstd;
      } catch (IOException e) {
        raw.close();
        throw e;
      }
    }
    return new InputStreamReader(decoded, StandardCharsets.UTF_8);
  }

  /**
   * Line reader that keeps at most {@code maxChars} characters of a line. The rest of an oversized
   * line is counted and discarded, so one huge record never has to fit in memory.
   */
  @VisibleForTesting
  static final class BoundedLineReader implements Closeable {

    private final Reader in;
    private final int maxChars;
    private final char[] buffer = new char[READ_BUFFER_CHARS];
    private final StringBuilder line = new StringBuilder();
    private int position;
    private int limit;

    BoundedLineReader(Reader in, int maxChars) {
      this.in = in;
      this.maxChars = maxChars;
    }

    /**
     * Advances to the next line.
     *
     * @return the line's full length in characters, or -1 at end of input
     */
    long readLine() throws IOException {
      line.setLength(0);
      long length = 0;
      boolean sawAny = false;
      while (true) {
        if (position == limit) {
          limit = in.read(buffer, 0, buffer.length);
          position = 0;
          if (limit <= 0) {
            limit = 0;
            return sawAny ? length : -1;
          }
        }
        sawAny = true;
        char c = buffer[position++];
        if (c == '\n') {
          return length;
        }
        if (c == '\r') {
          continue;
        }
        if (length < maxChars) {
          line.append(c);
        }
        length++;
      }
    }

    /** Content of the current line, truncated to the limit. */
    String line() {
      return line.toString();
    }

    @Override
    public void close() throws IOException {
      in.close();
    }
  }
}
