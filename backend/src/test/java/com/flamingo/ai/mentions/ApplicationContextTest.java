package com.flamingo.ai.mentions;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mentions.service.batch.BatchOrchestrator;
import com.flamingo.ai.mentions.service.coordinator.ConcurrencyCoordinator;
import com.flamingo.ai.mentions.service.extraction.ExtractionBackend;
import com.flamingo.ai.mentions.service.freshness.FreshnessGate;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

/**
 * Verifies the Spring application context loads. The chat model is mocked so no API key is needed,
 * and the database is a throwaway SQLite file under the build directory.
 */
@SpringBootTest
@TestPropertySource(properties = "spring.datasource.url=jdbc:sqlite:target/context-test.db")
class ApplicationContextTest {

  @MockBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline services should be wired")
  void pipelineServicesShouldBeWired() {
    assertThat(applicationContext.getBean(BatchOrchestrator.class)).isNotNull();
    assertThat(applicationContext.getBean(ConcurrencyCoordinator.class)).isNotNull();
    assertThat(applicationContext.getBean(FreshnessGate.class)).isNotNull();
    assertThat(applicationContext.getBean(ExtractionBackend.class)).isNotNull();
  }
}
