package dev.lyceum.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executors for the request path.
 *
 * <ul>
 *   <li>{@code retrievalExecutor} runs per-variant vector searches and the relevance judge call;
 *       callers bound each task with their own timeout
 *   <li>{@code answerExecutor} runs one answer stream per question so the servlet thread is
 *       released while the answer streams
 * </ul>
 *
 * <p>Neither pool queues: a task either starts on a thread at once, growing the pool up to its
 * maximum, or is rejected. A queued answer would delay its {@code searching} event, and a queued
 * search would spend its timeout waiting. Both use the default abort policy instead of running
 * work on the caller's thread, where timeouts could not be enforced; callers treat a rejection as
 * a soft failure.
 */
@Configuration
public class ExecutorConfig {

  @Bean("retrievalExecutor")
  public Executor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(64);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }

  @Bean("answerExecutor")
  public Executor answerExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("answer-");
    executor.initialize();
    return executor;
  }
}
