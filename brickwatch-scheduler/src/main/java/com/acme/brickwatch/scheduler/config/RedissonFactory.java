package com.acme.brickwatch.scheduler.config;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

/**
 * Redis client for cross-process deadline broadcasts; only created when an address is set. Each
 * instance registers under its own client name so peers are visible in {@code CLIENT LIST}.
 */
@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  static final String DEFAULT_CLIENT_NAME = "brickwatch";

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(
      @Property(name = "redisson.address") String address,
      @Nullable @Property(name = "redisson.password") String password,
      @Value("${redisson.database:0}") int database,
      @Value("${redisson.client-name:" + DEFAULT_CLIENT_NAME + "}") String clientName) {
    return Redisson.create(toConfig(address, password, database, clientName));
  }

  static Config toConfig(String address, String password, int database, String clientName) {
    Config config = new Config();
    SingleServerConfig server =
        config.useSingleServer().setAddress(address).setDatabase(database).setClientName(clientName);
    if (password != null && !password.isBlank()) {
      server.setPassword(password);
    }
    // Broadcasts are tiny and rare
    server.setConnectionPoolSize(4).setConnectionMinimumIdleSize(1);
    return config;
  }
}
