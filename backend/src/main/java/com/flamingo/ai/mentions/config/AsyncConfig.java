package com.flamingo.ai.mentions.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Bounded pool the coordinator dispatches extraction chunks on. */
  @Bean(name = "extractionExecutor")
  public ThreadPoolTaskExecutor extractionExecutor(PipelineConfig pipelineConfig) {
    int poolSize = pipelineConfig.getCoordinator().getPoolSize();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "rankingRefreshExecutor")
  public Executor rankingRefreshExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("rank-refresh-");
    executor.initialize();
    return executor;
  }
}
