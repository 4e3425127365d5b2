package com.acme.brickwatch.scheduler.config;

import com.acme.brickwatch.config.MailConfig;
import com.acme.brickwatch.config.SchedulerConfig;
import com.acme.brickwatch.schedule.DeadlineCalculator;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this module binds its POJOs to
 * application.yml and registers them for injection.
 */
@Factory
public class CoreBeansFactory {

  /** Creates SchedulerConfig bean populated from application.yml scheduler.* properties */
  @Singleton
  @ConfigurationProperties("scheduler")
  public SchedulerConfig schedulerConfig() {
    return new SchedulerConfig();
  }

  /** Creates MailConfig bean populated from application.yml mail.* properties */
  @Singleton
  @ConfigurationProperties("mail")
  public MailConfig mailConfig() {
    return new MailConfig();
  }

  @Singleton
  public DeadlineCalculator deadlineCalculator() {
    return new DeadlineCalculator();
  }

  /** All deadlines are computed in UTC */
  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }
}
