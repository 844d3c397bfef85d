package com.example.sftpbroker;

import com.example.sftpbroker.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SFTP Broker Application
 *
 * Brokers remote SFTP sessions on behalf of browser clients:
 * - one authenticated SSH/SFTP connection per session cookie
 * - bounded session count and idle expiry
 * - streamed single-file and ZIP archive downloads
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class SftpBrokerApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(SftpBrokerApplication.class);

    app.setLazyInitialization(false);
    // Registry teardown closes every remote connection on shutdown
    app.setRegisterShutdownHook(true);

    app.run(args);
  }
}
