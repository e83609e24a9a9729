package com.acme.upkeep.relay;

import com.acme.upkeep.domain.UpkeepCheck;
import com.acme.upkeep.domain.UpkeepReport;
import com.acme.upkeep.service.RecurringPaymentAccount;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Polls the account for due subscriptions and performs the upkeep it reports. */
@Singleton
@Requires(property = "scheduler.relay.enabled", value = "true", defaultValue = "true")
public class UpkeepRelay {
  private static final Logger LOG = LoggerFactory.getLogger(UpkeepRelay.class);

  private final RecurringPaymentAccount account;

  public UpkeepRelay(RecurringPaymentAccount account) {
    this.account = account;
  }

  @Scheduled(fixedDelay = "${scheduler.poll-interval:30s}")
  public void tick() {
    try {
      UpkeepCheck check = account.checkUpkeep();
      if (!check.upkeepNeeded()) {
        LOG.debug("No upkeep needed");
        return;
      }

      UpkeepReport report = account.performUpkeep(check.performData());
      if (!report.failed().isEmpty()) {
        LOG.warn("Upkeep left {} subscriptions due after failed transfers: {}",
            report.failed().size(), report.failed());
      }
      LOG.debug("Upkeep performed: executed={} failed={} skipped={}",
          report.executed(), report.failed(), report.skipped());
    } catch (Exception e) {
      LOG.error("Error in UpkeepRelay tick: {}", e.getMessage(), e);
    }
  }
}
