package com.flamingo.ai.mentions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the forum mention ingestion service. */
@SpringBootApplication
public class MentionPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(MentionPipelineApplication.class, args);
  }
}
