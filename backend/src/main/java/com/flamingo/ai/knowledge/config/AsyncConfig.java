package com.flamingo.ai.knowledge.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the document processing worker pool. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor(KnowledgeConfig knowledgeConfig) {
    KnowledgeConfig.Processing processing = knowledgeConfig.getProcessing();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(processing.getCorePoolSize());
    executor.setMaxPoolSize(processing.getMaxPoolSize());
    executor.setQueueCapacity(processing.getQueueCapacity());
    executor.setThreadNamePrefix("doc-proc-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
