package com.acme.upkeep.service;

import com.acme.upkeep.codec.TransferCalldata;
import com.acme.upkeep.config.SchedulerConfig;
import com.acme.upkeep.domain.CallResult;
import com.acme.upkeep.domain.DueBatch;
import com.acme.upkeep.domain.Subscription;
import com.acme.upkeep.domain.SubscriptionEvent;
import com.acme.upkeep.domain.UpkeepReport;
import com.acme.upkeep.repository.SubscriptionRepository;
import com.acme.upkeep.spi.CallExecutor;
import com.acme.upkeep.spi.EventPublisher;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds due subscriptions in bounded batches and executes them with per-item outcomes.
 *
 * <p>{@link #executeDue(List)} is callable by anyone, so every id in a submitted batch is
 * re-checked against current state before anything is invoked.
 */
@Slf4j
public class UpkeepScheduler {
  private final SubscriptionRepository repository;
  private final CallExecutor callExecutor;
  private final EventPublisher events;
  private final ReentrancyGuard reentrancyGuard;
  private final Clock clock;
  private final int batchCap;
  private final boolean rotateScanStart;

  // Last id handed to the call executor; only read when rotating
  private long scanCursor;

  public UpkeepScheduler(
      SubscriptionRepository repository,
      CallExecutor callExecutor,
      EventPublisher events,
      ReentrancyGuard reentrancyGuard,
      Clock clock,
      SchedulerConfig config) {
    if (config.getBatchCap() <= 0) {
      throw new IllegalArgumentException("Batch cap must be positive: " + config.getBatchCap());
    }
    this.repository = repository;
    this.callExecutor = callExecutor;
    this.events = events;
    this.reentrancyGuard = reentrancyGuard;
    this.clock = clock;
    this.batchCap = config.getBatchCap();
    this.rotateScanStart = config.isRotateScanStart();
  }

  public DueBatch checkDue() {
    long total = repository.count();
    if (total == 0) {
      return DueBatch.empty();
    }

    Instant now = clock.instant();
    long start = rotateScanStart ? scanCursor % total : 0;
    List<Long> due = new ArrayList<>();
    for (long i = 0; i < total && due.size() < batchCap; i++) {
      long id = (start + i) % total + 1;
      repository.findById(id).filter(s -> s.isDueAt(now)).ifPresent(s -> due.add(s.getId()));
    }
    return DueBatch.of(due);
  }

  public UpkeepReport executeDue(List<Long> batch) {
    return reentrancyGuard.guard(() -> runBatch(batch));
  }

  private UpkeepReport runBatch(List<Long> batch) {
    Instant now = clock.instant();
    Set<Long> seen = new HashSet<>();
    List<Long> executed = new ArrayList<>();
    List<Long> failed = new ArrayList<>();
    List<Long> skipped = new ArrayList<>();

    for (Long id : batch) {
      if (id == null) {
        log.warn("Ignoring null id in upkeep batch");
        continue;
      }
      if (!seen.add(id)) {
        log.warn("Subscription {} appears more than once in batch, skipping repeat", id);
        skipped.add(id);
        continue;
      }
      Optional<Subscription> due = repository.findById(id).filter(s -> s.isDueAt(now));
      if (due.isEmpty()) {
        log.warn("Subscription {} is unknown, cancelled or not yet due, skipping", id);
        skipped.add(id);
        continue;
      }

      if (execute(due.get())) {
        executed.add(id);
        publish(new SubscriptionEvent.SubscriptionExecuted(id, true));
      } else {
        failed.add(id);
        publish(new SubscriptionEvent.SubscriptionFailed(id, false));
      }
      scanCursor = id;
    }

    if (!executed.isEmpty() || !failed.isEmpty()) {
      log.info(
          "Upkeep batch done: executed={} failed={} skipped={}", executed, failed, skipped);
    }
    return new UpkeepReport(executed, failed, skipped);
  }

  /**
   * Pays one subscription and moves its due time. Never throws: any problem with the record or the
   * token call is reported as a failure and leaves the due time where it was.
   */
  private boolean execute(Subscription subscription) {
    if (!subscription.canAdvance()) {
      log.warn(
          "Subscription {} cannot be scheduled past {}, not paying",
          subscription.getId(),
          subscription.getNextExecuteAt());
      return false;
    }
    try {
      byte[] payload =
          TransferCalldata.encode(subscription.getBeneficiary(), subscription.getAmount());
      CallResult result = callExecutor.invoke(subscription.getToken(), BigInteger.ZERO, payload);
      if (!result.success()) {
        log.warn(
            "Transfer for subscription {} rejected by token {}",
            subscription.getId(),
            subscription.getToken());
        return false;
      }
    } catch (RuntimeException e) {
      log.warn("Transfer for subscription {} raised: {}", subscription.getId(), e.getMessage(), e);
      return false;
    }
    subscription.advance();
    return true;
  }

  private void publish(SubscriptionEvent event) {
    try {
      events.publish(event);
    } catch (RuntimeException e) {
      log.error("Failed to publish {}: {}", event, e.getMessage(), e);
    }
  }
}
