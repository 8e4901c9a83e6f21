package com.github.adamzv.kafkaadmin.support;

import com.github.adamzv.kafkaadmin.application.ClusterAdmin;
import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Connects the admin client once the application is ready. A failed connection is logged and
 * left to the first tool call, which reports it to the client.
 */
@Component
public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final ClusterAdmin admin;
  private final KafkaProperties kafkaProperties;
  private final RetryPolicy retryPolicy;
  private final AdminTimeouts timeouts;
  private final Environment environment;

  public StartupLogger(ClusterAdmin admin,
                       KafkaProperties kafkaProperties,
                       RetryPolicy retryPolicy,
                       AdminTimeouts timeouts,
                       Environment environment) {
    this.admin = admin;
    this.kafkaProperties = kafkaProperties;
    this.retryPolicy = retryPolicy;
    this.timeouts = timeouts;
    this.environment = environment;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    String serverName = environment.getProperty("spring.ai.mcp.server.name", "kafka-admin");
    String serverVersion = environment.getProperty("spring.ai.mcp.server.version", "unknown");
    log.info(
        "mcp_server_ready name={} version={} bootstrapServers={} retry={{retries={}, maxRetryTime={}}} requestTimeout={}",
        serverName,
        serverVersion,
        kafkaProperties.bootstrapServers(),
        retryPolicy.retries(),
        retryPolicy.maxRetryTime(),
        timeouts.request()
    );

    try {
      admin.connect();
    } catch (ProblemException ex) {
      log.error(
          "admin_connect_failed bootstrapServers={} code={} message={}",
          kafkaProperties.bootstrapServers(),
          ex.code(),
          ex.getMessage()
      );
    }
  }
}
