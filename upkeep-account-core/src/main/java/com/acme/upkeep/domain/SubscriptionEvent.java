package com.acme.upkeep.domain;

import com.acme.upkeep.core.Address;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.math.BigInteger;
import java.time.Duration;

/**
 * Events surfaced to observers of the subscription lifecycle. Component order of each record is
 * the observable payload shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = SubscriptionEvent.SubscriptionCreated.class, name = "SubscriptionCreated"),
  @JsonSubTypes.Type(value = SubscriptionEvent.SubscriptionCancelled.class, name = "SubscriptionCancelled"),
  @JsonSubTypes.Type(value = SubscriptionEvent.SubscriptionExecuted.class, name = "SubscriptionExecuted"),
  @JsonSubTypes.Type(value = SubscriptionEvent.SubscriptionFailed.class, name = "SubscriptionFailed")
})
public sealed interface SubscriptionEvent {

  long id();

  /** A subscription was registered */
  record SubscriptionCreated(Address token, long id, BigInteger amount, Duration initialDelay)
      implements SubscriptionEvent {}

  /** A subscription was cancelled; {@code cancelled} is always true */
  record SubscriptionCancelled(boolean cancelled, long id) implements SubscriptionEvent {}

  /** A scheduled transfer went through; {@code success} is always true */
  record SubscriptionExecuted(long id, boolean success) implements SubscriptionEvent {}

  /** A scheduled transfer failed and stays due; {@code success} is always false */
  record SubscriptionFailed(long id, boolean success) implements SubscriptionEvent {}
}
