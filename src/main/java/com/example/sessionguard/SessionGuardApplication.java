package com.example.sessionguard;

import com.example.sessionguard.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Session Guard Application
 *
 * Session lifecycle service for authenticated users:
 * - two-tier session storage (in-process cache, Redis)
 * - per-user session limits with least-recently-active eviction
 * - advisory suspicious-activity detection and step-up signalling
 * - session dashboard API
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class SessionGuardApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(SessionGuardApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
