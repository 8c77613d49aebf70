package com.harness.alerting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertingEngineApplication {
  public static void main(String[] args) {
    SpringApplication.run(AlertingEngineApplication.class, args);
  }
}
