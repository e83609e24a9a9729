package com.acme.upkeep.domain;

import com.acme.upkeep.core.Address;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import lombok.Getter;

/**
 * A recurring payment obligation. Records are never removed: cancellation is a terminal
 * tombstone and cancelled records stay readable for audit.
 */
@Getter
public class Subscription {
  private final long id;
  private final Address beneficiary;
  private final Address token;
  private final BigInteger amount;
  private final Duration initialDelay;
  private final Duration interval;
  private final Instant createdAt;
  private Instant nextExecuteAt;
  private boolean active;

  public Subscription(
      long id,
      Address beneficiary,
      Address token,
      BigInteger amount,
      Duration initialDelay,
      Duration interval,
      Instant createdAt) {
    if (id <= 0) {
      throw new IllegalArgumentException("Subscription ID must be positive");
    }
    if (beneficiary == null || token == null || amount == null) {
      throw new IllegalArgumentException("Beneficiary, token and amount cannot be null");
    }
    if (initialDelay == null || interval == null || createdAt == null) {
      throw new IllegalArgumentException("Timing fields cannot be null");
    }

    this.id = id;
    this.beneficiary = beneficiary;
    this.token = token;
    this.amount = amount;
    this.initialDelay = initialDelay;
    this.interval = interval;
    this.createdAt = createdAt;
    this.nextExecuteAt = createdAt.plus(initialDelay);
    this.active = true;
  }

  public boolean isDueAt(Instant now) {
    return active && !now.isBefore(nextExecuteAt);
  }

  /** Whether {@link #advance()} can move the due time without leaving the {@link Instant} range. */
  public boolean canAdvance() {
    return fitsAfter(nextExecuteAt, interval);
  }

  /** Whether {@code start + step} is still a representable {@link Instant}. */
  public static boolean fitsAfter(Instant start, Duration step) {
    try {
      start.plus(step);
      return true;
    } catch (DateTimeException | ArithmeticException e) {
      return false;
    }
  }

  /** Moves the due time forward by exactly one interval after a successful execution. */
  public void advance() {
    if (!active) {
      throw new IllegalStateException("Cannot advance cancelled subscription " + id);
    }
    this.nextExecuteAt = nextExecuteAt.plus(interval);
  }

  public void cancel() {
    if (!active) {
      throw new IllegalStateException("Subscription " + id + " is already cancelled");
    }
    this.active = false;
  }
}
