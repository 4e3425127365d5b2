package com.acme.brickwatch.config;

import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment to avoid configuration errors.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final SchedulerConfig schedulerConfig;
    private final MailConfig mailConfig;

    @Property(name = "micronaut.server.port")
    private int serverPort;

    @Property(name = "db.dialect")
    private String dialect;

    @Property(name = "datasources.default.url")
    private String datasourceUrl;

    @Property(name = "datasources.default.maximum-pool-size")
    private int maxPoolSize;

    @Value("${redisson.enabled:true}")
    private boolean redissonEnabled;

    @Value("${redisson.address:}")
    private String redissonAddress;

    @Value("${brickwatch.api.auth-key:}")
    private String authKey;

    public ConfigurationLogger(SchedulerConfig schedulerConfig, MailConfig mailConfig) {
        this.schedulerConfig = schedulerConfig;
        this.mailConfig = mailConfig;
    }

    @Override
    public void onApplicationEvent(ServerStartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");

        LOG.info("━━━ Server ━━━");
        LOG.info("  Port:               {}", serverPort);
        LOG.info("  Auth Key:           {} (required on /api/** except trigger)", authKey.isEmpty() ? "NOT SET" : "SET");

        LOG.info("━━━ Database ━━━");
        LOG.info("  Dialect:            {}", dialect);
        LOG.info("  JDBC URL:           {}", datasourceUrl);
        LOG.info("  Max Pool Size:      {}", maxPoolSize);

        LOG.info("━━━ Deadline Scheduler ━━━");
        LOG.info("  Enabled:            {}", schedulerConfig.isEnabled() ? "ENABLED" : "DISABLED");
        LOG.info("  Resync Interval:    {} (Backstop rebuild of the wake queue from the store)", schedulerConfig.getResyncInterval());
        LOG.info("  Backoff:            {} .. {}", schedulerConfig.getInitialBackoff(), schedulerConfig.getMaxBackoff());
        LOG.info("  Reconcile Batch:    {}", schedulerConfig.getReconcileBatchSize());

        LOG.info("━━━ Notifications ━━━");
        LOG.info("  Sweep Interval:     {}", schedulerConfig.getNotificationSweepInterval());
        LOG.info("  Claim Timeout:      {} (Abandoned claims become pending again after this)", schedulerConfig.getNotificationClaimTimeout());
        LOG.info("  Sender Threads:     {}", schedulerConfig.getNotificationThreads());
        String smtpHost = mailConfig.getSmtp().getHost();
        LOG.info("  SMTP Relay:         {}", smtpHost == null ? "NONE (notices are logged)" : smtpHost + ":" + mailConfig.getSmtp().getPort());
        LOG.info("  Sender:             {} <{}>", mailConfig.getSenderName(), mailConfig.getSender());

        LOG.info("━━━ Coordination ━━━");
        LOG.info("  Redis Broadcast:    {}", redissonEnabled && !redissonAddress.isEmpty() ? redissonAddress : "DISABLED");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
