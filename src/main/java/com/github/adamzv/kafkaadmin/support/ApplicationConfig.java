package com.github.adamzv.kafkaadmin.support;

import com.github.adamzv.kafkaadmin.adapters.mcp.AdminTools;
import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.common.utils.Time;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({KafkaProperties.class, RetryProperties.class, TimeoutsProperties.class})
public class ApplicationConfig {

  private static final int FAN_OUT_THREADS = 8;

  private final RetryProperties retryProperties;
  private final TimeoutsProperties timeoutsProperties;

  public ApplicationConfig(RetryProperties retryProperties, TimeoutsProperties timeoutsProperties) {
    this.retryProperties = retryProperties;
    this.timeoutsProperties = timeoutsProperties;
  }

  @Bean
  public RetryPolicy retryPolicy() {
    return retryProperties.toDomain();
  }

  @Bean
  public AdminTimeouts adminTimeouts() {
    return timeoutsProperties.toDomain();
  }

  @Bean
  public Time time() {
    return Time.SYSTEM;
  }

  /**
   * Runs the per-broker calls of group operations.
   */
  @Bean(destroyMethod = "shutdown")
  public ExecutorService adminFanOutExecutor() {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads = runnable -> {
      Thread thread = new Thread(runnable, "admin-fan-out-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(FAN_OUT_THREADS, threads);
  }

  @Bean
  public ToolCallbackProvider adminToolsProvider(AdminTools adminTools) {
    return MethodToolCallbackProvider
        .builder()
        .toolObjects(adminTools)
        .build();
  }
}
