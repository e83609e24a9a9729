package com.acme.upkeep.config;

import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final AccountConfig accountConfig;
    private final SchedulerConfig schedulerConfig;

    @Property(name = "micronaut.server.port")
    private int serverPort;

    @Property(name = "scheduler.relay.enabled")
    private boolean relayEnabled;

    public ConfigurationLogger(AccountConfig accountConfig, SchedulerConfig schedulerConfig) {
        this.accountConfig = accountConfig;
        this.schedulerConfig = schedulerConfig;
    }

    @Override
    public void onApplicationEvent(ServerStartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Server Configuration ━━━");
        LOG.info("  Port:               {} (HTTP endpoint listening port)", serverPort);
        LOG.info("");

        LOG.info("━━━ Account Configuration ━━━");
        LOG.info("  Account:            {} (Address outbound calls are made from)", accountConfig.getAddress());
        LOG.info("  Owner:              {} (Signs operations, may manage subscriptions)", accountConfig.getOwner());
        LOG.info("  Dispatcher:         {} (Submits operations, may manage subscriptions)", accountConfig.getDispatcher());
        LOG.info("  Ledger Tokens:      {} (Tokens the simulated ledger accepts transfers for)", accountConfig.getTokens());
        LOG.info("");

        LOG.info("━━━ Upkeep Configuration ━━━");
        LOG.info("  Relay:              {} (Scheduled checkUpkeep/performUpkeep poll)", relayEnabled ? "ENABLED" : "DISABLED");
        LOG.info("  Poll Interval:      {} (Delay between upkeep polls)", schedulerConfig.getPollInterval());
        LOG.info("  Batch Cap:          {} (Maximum subscriptions executed per poll)", schedulerConfig.getBatchCap());
        LOG.info("  Rotating Scan:      {} (Resume scan after the last executed id)", schedulerConfig.isRotateScanStart());
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");
    }
}
