package com.github.adamzv.kafkaadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KafkaAdminApplication {

  public static void main(String[] args) {
    SpringApplication.run(KafkaAdminApplication.class, args);
  }
}
