package com.flamingo.ai.mentions.api.rest;

import com.flamingo.ai.mentions.api.dto.response.ArchiveIngestionResponse;
import com.flamingo.ai.mentions.service.archive.ArchiveIngestionService;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for bulk archive ingestion. */
@RestController
@RequestMapping("/api/archives")
@RequiredArgsConstructor
@Validated
@Slf4j
public class ArchiveController {

  private final ArchiveIngestionService ingestionService;

  /**
   * Reconstructs a community's archive and processes it batch by batch.
   *
   * @param scope community name; also the archive directory name
   * @return ingestion summary
   */
  @PostMapping("/{scope}")
  public ResponseEntity<ArchiveIngestionResponse> ingest(
      @PathVariable
          @Pattern(regexp = "^[A-Za-z0-9_]{2,64}$", message = "Scope must be a community name")
          String scope) {
    log.info("Archive ingestion requested for {}", scope);
    return ResponseEntity.ok(ArchiveIngestionResponse.fromSummary(ingestionService.ingest(scope)));
  }
}
