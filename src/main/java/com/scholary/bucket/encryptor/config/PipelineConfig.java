package com.scholary.bucket.encryptor.config;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the encryption pipeline.
 *
 * <p>Enables EncryptionProperties and sets up the executor objects are processed on. With one
 * worker (the default) objects run sequentially on the request thread. With more, a bounded pool
 * is used; when its queue is full the submitting thread runs the object itself. Submissions are
 * only rejected once the pool is shutting down.
 */
@Configuration
@EnableConfigurationProperties(EncryptionProperties.class)
public class PipelineConfig {

  @Bean(name = "pipelineExecutor")
  public Executor pipelineExecutor(EncryptionProperties properties) {
    if (properties.workerThreads() == 1) {
      return new SyncTaskExecutor();
    }

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueCapacity());
    executor.setThreadNamePrefix("encryption-");
    executor.setRejectedExecutionHandler(callerRunsUntilShutdown());
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.initialize();
    return executor;
  }

  /** Runs overflow on the submitting thread; after shutdown the task is rejected, not dropped. */
  static RejectedExecutionHandler callerRunsUntilShutdown() {
    return (task, pool) -> {
      if (pool.isShutdown()) {
        throw new RejectedExecutionException("Pipeline executor is shut down");
      }
      task.run();
    };
  }

  /** Carries the submitting thread's MDC (correlation id, bucket) onto the worker. */
  static TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        } else {
          MDC.clear();
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
