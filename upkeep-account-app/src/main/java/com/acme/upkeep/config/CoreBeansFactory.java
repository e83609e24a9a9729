package com.acme.upkeep.config;

import com.acme.upkeep.event.InMemoryEventLog;
import com.acme.upkeep.ledger.InMemoryLedger;
import com.acme.upkeep.repository.InMemorySubscriptionRepository;
import com.acme.upkeep.repository.SubscriptionRepository;
import com.acme.upkeep.service.RecurringPaymentAccount;
import com.acme.upkeep.signer.UnavailableSignerRecovery;
import com.acme.upkeep.spi.SignerRecovery;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this module does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates AccountConfig bean populated from application.yml account.* properties */
  @Singleton
  @ConfigurationProperties("account")
  public AccountConfig accountConfig() {
    return new AccountConfig();
  }

  /** Creates SchedulerConfig bean populated from application.yml scheduler.* properties */
  @Singleton
  @ConfigurationProperties("scheduler")
  public SchedulerConfig schedulerConfig() {
    return new SchedulerConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public SubscriptionRepository subscriptionRepository() {
    return new InMemorySubscriptionRepository();
  }

  @Singleton
  public InMemoryEventLog eventLog() {
    return new InMemoryEventLog();
  }

  /** Ledger the account's outbound calls are settled against */
  @Singleton
  public InMemoryLedger ledger(AccountConfig accountConfig) {
    InMemoryLedger ledger = new InMemoryLedger(accountConfig.accountAddress());
    accountConfig.tokenAddresses().forEach(ledger::registerToken);
    return ledger;
  }

  /** Fallback used until a real recovery primitive is provided as a bean */
  @Singleton
  @Requires(missingBeans = SignerRecovery.class)
  public SignerRecovery signerRecovery() {
    return new UnavailableSignerRecovery();
  }

  @Singleton
  public RecurringPaymentAccount recurringPaymentAccount(
      AccountConfig accountConfig,
      SchedulerConfig schedulerConfig,
      SubscriptionRepository repository,
      SignerRecovery signerRecovery,
      InMemoryLedger ledger,
      InMemoryEventLog eventLog,
      Clock clock) {
    return new RecurringPaymentAccount(
        accountConfig, schedulerConfig, repository, signerRecovery, ledger, eventLog, clock);
  }
}
