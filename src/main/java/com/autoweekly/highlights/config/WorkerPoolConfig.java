package com.autoweekly.highlights.config;

import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Log4j2
@Configuration
public class WorkerPoolConfig {

  @Value("${highlights.worker-pool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /**
   * Fixed-size pool that runs one item per task. Its size bounds the number of concurrent calls to
   * the conversion and summarization services.
   */
  @Bean(name = "highlightsWorkerPool")
  public ThreadPoolTaskExecutor highlightsWorkerPool(PipelineSettings settings) {
    int size = Math.max(1, settings.getWorkerCount());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setThreadNamePrefix("highlights-worker-");

    // Let in-flight items finish on shutdown
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);

    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

    executor.initialize();
    log.info(
        "ThreadPoolTaskExecutor initialized poolSize={} awaitTerminationSeconds={}",
        size,
        awaitTerminationSeconds);
    return executor;
  }
}
