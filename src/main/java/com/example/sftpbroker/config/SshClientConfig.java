package com.example.sftpbroker.config;

import com.example.sftpbroker.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.keyverifier.KnownHostsServerKeyVerifier;
import org.apache.sshd.client.keyverifier.RejectAllServerKeyVerifier;
import org.apache.sshd.client.keyverifier.ServerKeyVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Shared MINA SSHD client. Every session's SSH connection is multiplexed on this client's I/O
 * service; it is started once and stopped with the application context.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class SshClientConfig {

  @Bean(destroyMethod = "stop")
  public SshClient sshClient(ApplicationProperties properties) {
    SshClient client = SshClient.setUpDefaultClient();
    client.setServerKeyVerifier(serverKeyVerifier(properties.sftp()));
    client.start();
    log.info("SSH client started (strict host key checking: {})",
             properties.sftp().strictHostKeyChecking());
    return client;
  }

  private ServerKeyVerifier serverKeyVerifier(ApplicationProperties.SftpProperties sftp) {
    if (!sftp.strictHostKeyChecking()) {
      log.warn("Host key verification is disabled; any server key will be accepted.");
      return AcceptAllServerKeyVerifier.INSTANCE;
    }
    if (StringUtils.hasText(sftp.knownHostsFile())) {
      return new KnownHostsServerKeyVerifier(RejectAllServerKeyVerifier.INSTANCE, Path.of(sftp.knownHostsFile()));
    }
    return new KnownHostsServerKeyVerifier(RejectAllServerKeyVerifier.INSTANCE,
                                           Path.of(System.getProperty("user.home"), ".ssh", "known_hosts"));
  }
}
