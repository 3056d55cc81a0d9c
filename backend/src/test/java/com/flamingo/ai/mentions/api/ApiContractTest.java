package com.flamingo.ai.mentions.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mentions.api.rest.ArchiveController;
import com.flamingo.ai.mentions.api.rest.BatchController;
import com.flamingo.ai.mentions.api.rest.PipelineStatusController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning controller paths:
 *
 * <ul>
 *   <li>POST /api/batches - Run one batch
 *   <li>POST /api/archives/{scope} - Ingest a community archive
 *   <li>GET /api/coordinator/status - Extraction pool status
 *   <li>POST /api/chunks/preview - Chunk posts without extracting
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("BatchController API contract")
  class BatchControllerContract {

    @Test
    @DisplayName("should be mapped to /api/batches")
    void shouldBeMappedToApiBatches() {
      RequestMapping mapping = BatchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/batches");
    }
  }

  @Nested
  @DisplayName("ArchiveController API contract")
  class ArchiveControllerContract {

    @Test
    @DisplayName("should be mapped to /api/archives")
    void shouldBeMappedToApiArchives() {
      RequestMapping mapping = ArchiveController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/archives");
    }
  }

  @Nested
  @DisplayName("PipelineStatusController API contract")
  class PipelineStatusControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping =
          PipelineStatusController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }
  }
}
