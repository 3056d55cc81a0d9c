package com.flamingo.ai.mentions.api.rest;

import com.flamingo.ai.mentions.api.dto.request.ChunkPreviewRequest;
import com.flamingo.ai.mentions.api.dto.response.ChunkPreviewResponse;
import com.flamingo.ai.mentions.api.dto.response.CoordinatorStatusResponse;
import com.flamingo.ai.mentions.service.chunking.ChunkingResult;
import com.flamingo.ai.mentions.service.chunking.PostChunker;
import com.flamingo.ai.mentions.service.coordinator.ConcurrencyCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for pipeline introspection: pool status and chunking previews. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PipelineStatusController {

  private final ConcurrencyCoordinator coordinator;
  private final PostChunker chunker;

  @GetMapping("/coordinator/status")
  public ResponseEntity<CoordinatorStatusResponse> coordinatorStatus() {
    return ResponseEntity.ok(
        new CoordinatorStatusResponse(coordinator.queueStatus(), coordinator.performanceStats()));
  }

  /** Chunks the given posts without extracting anything. */
  @PostMapping("/chunks/preview")
  public ResponseEntity<ChunkPreviewResponse> previewChunks(
      @Valid @RequestBody ChunkPreviewRequest request) {
    ChunkingResult result = chunker.chunk(request.getPosts());
    return ResponseEntity.ok(
        new ChunkPreviewResponse(result.metadata(), chunker.validate(request.getPosts(), result)));
  }
}
