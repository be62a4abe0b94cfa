package io.b2mash.chatops.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executor for background channel lookups that outlive the request that started them. */
@Configuration
public class AsyncConfig {

  public static final String CHANNEL_LOOKUP_EXECUTOR = "channelLookupExecutor";

  @Bean(name = CHANNEL_LOOKUP_EXECUTOR)
  public TaskExecutor channelLookupExecutor(
      @Value("${chatops.slack.lookup-executor.pool-size:4}") int poolSize,
      @Value("${chatops.slack.lookup-executor.queue-capacity:100}") int queueCapacity) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("slack-lookup-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
