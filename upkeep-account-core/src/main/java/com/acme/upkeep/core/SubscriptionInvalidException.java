package com.acme.upkeep.core;

public class SubscriptionInvalidException extends AccountException {
  private final long subscriptionId;

  public SubscriptionInvalidException(long subscriptionId) {
    super(AccountError.SUBSCRIPTION_INVALID, "Subscription invalid: " + subscriptionId);
    this.subscriptionId = subscriptionId;
  }

  public long getSubscriptionId() {
    return subscriptionId;
  }
}
