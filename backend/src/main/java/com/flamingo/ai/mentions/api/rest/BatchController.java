package com.flamingo.ai.mentions.api.rest;

import com.flamingo.ai.mentions.api.dto.request.SubmitBatchRequest;
import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import com.flamingo.ai.mentions.service.batch.BatchOrchestrator;
import jakarta.validation.Valid;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for running batch jobs. */
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
@Slf4j
public class BatchController {

  private final BatchOrchestrator orchestrator;
  private final Clock clock;

  /**
   * Runs one batch synchronously.
   *
   * @param request the batch description
   * @return the batch result; a failed batch is still a 200 with {@code success=false}
   */
  @PostMapping
  public ResponseEntity<BatchProcessingResult> runBatch(
      @Valid @RequestBody SubmitBatchRequest request) {
    log.info(
        "Running batch {} for {} ({} posts)",
        request.getBatchId(),
        request.getSourceScope(),
        request.getPostIds().size());
    return ResponseEntity.ok(orchestrator.processBatch(request.toJob(clock.instant())));
  }
}
