package com.acme.upkeep.service;

import com.acme.upkeep.codec.TransferCalldata;
import com.acme.upkeep.core.AccountError;
import com.acme.upkeep.core.AccountException;
import com.acme.upkeep.core.Address;
import com.acme.upkeep.core.SubscriptionInvalidException;
import com.acme.upkeep.domain.Subscription;
import com.acme.upkeep.domain.SubscriptionEvent;
import com.acme.upkeep.repository.SubscriptionRepository;
import com.acme.upkeep.spi.EventPublisher;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Create/cancel lifecycle of subscriptions, gated to the dispatcher or the owner. */
@Slf4j
@RequiredArgsConstructor
public class SubscriptionRegistry {
  private final SubscriptionRepository repository;
  private final AccessGate accessGate;
  private final ReentrancyGuard reentrancyGuard;
  private final EventPublisher events;
  private final Clock clock;

  public long create(
      Address caller,
      Address beneficiary,
      Address token,
      BigInteger amount,
      Duration initialDelay,
      Duration interval) {
    accessGate.requireDispatcherOrOwner(caller);
    reentrancyGuard.requireNotEntered();

    if (beneficiary == null || beneficiary.isZero()) {
      throw new AccountException(AccountError.BENEFICIARY_IS_ZERO, "Beneficiary is the zero address");
    }
    if (token == null || token.isZero()) {
      throw new AccountException(AccountError.TOKEN_ADDR_IS_ZERO, "Token is the zero address");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new AccountException(AccountError.AMOUNT_IS_ZERO, "Amount must be positive");
    }
    if (amount.compareTo(TransferCalldata.MAX_AMOUNT) > 0) {
      throw new AccountException(
          AccountError.AMOUNT_OUT_OF_RANGE, "Amount " + amount + " does not fit in uint256");
    }
    if (initialDelay == null || initialDelay.isZero() || initialDelay.isNegative()) {
      throw new AccountException(AccountError.EXECUTE_TIME_IS_ZERO, "Initial delay must be positive");
    }
    if (interval == null || interval.compareTo(initialDelay) < 0) {
      throw new AccountException(
          AccountError.INTERVAL_TOO_SHORT,
          "Interval " + interval + " is shorter than initial delay " + initialDelay);
    }
    // The first due time and the one after it must both be representable
    Instant now = clock.instant();
    if (!Subscription.fitsAfter(now, initialDelay)
        || !Subscription.fitsAfter(now.plus(initialDelay), interval)) {
      throw new AccountException(
          AccountError.SCHEDULE_OUT_OF_RANGE,
          "Schedule of delay " + initialDelay + " and interval " + interval + " overflows");
    }

    long id = repository.count() + 1;
    Subscription subscription =
        new Subscription(id, beneficiary, token, amount, initialDelay, interval, now);
    repository.append(subscription);
    log.info(
        "Subscription {} created: {} of token {} to {} every {}, first due {}",
        id,
        amount,
        token,
        beneficiary,
        interval,
        subscription.getNextExecuteAt());

    events.publish(new SubscriptionEvent.SubscriptionCreated(token, id, amount, initialDelay));
    return id;
  }

  public void cancel(Address caller, long id) {
    accessGate.requireDispatcherOrOwner(caller);
    reentrancyGuard.requireNotEntered();

    Subscription subscription =
        repository
            .findById(id)
            .filter(Subscription::isActive)
            .orElseThrow(() -> new SubscriptionInvalidException(id));
    subscription.cancel();
    log.info("Subscription {} cancelled by {}", id, caller);

    events.publish(new SubscriptionEvent.SubscriptionCancelled(true, id));
  }

  /** Returns the record for any assigned id, cancelled ones included. */
  public Subscription get(long id) {
    return repository.findById(id).orElseThrow(() -> new SubscriptionInvalidException(id));
  }

  public List<Subscription> list() {
    return repository.findAll();
  }

  public long totalSubscriptions() {
    return repository.count();
  }
}
