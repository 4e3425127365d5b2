package com.acme.brickwatch.scheduler.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

class RedissonFactoryTest {

  @Test
  @DisplayName("should configure a single server with database, client name and password")
  void testToConfig() {
    // When
    Config config = RedissonFactory.toConfig("redis://cache:6379", "secret", 2, "brickwatch-a");

    // Then
    SingleServerConfig server = config.useSingleServer();
    assertThat(server.getAddress()).isEqualTo("redis://cache:6379");
    assertThat(server.getDatabase()).isEqualTo(2);
    assertThat(server.getClientName()).isEqualTo("brickwatch-a");
    assertThat(server.getPassword()).isEqualTo("secret");
    assertThat(server.getConnectionPoolSize()).isEqualTo(4);
  }

  @Test
  @DisplayName("should leave the password unset when none is configured")
  void testBlankPassword() {
    Config config = RedissonFactory.toConfig("redis://localhost:6379", " ", 0, RedissonFactory.DEFAULT_CLIENT_NAME);

    assertThat(config.useSingleServer().getPassword()).isNull();
    assertThat(config.useSingleServer().getClientName()).isEqualTo("brickwatch");
  }
}
