package com.acme.upkeep.web;

import com.acme.upkeep.domain.Subscription;

/** Read model of a subscription; addresses, amounts and times rendered as strings. */
public record SubscriptionView(
    long id,
    String beneficiary,
    String token,
    String amount,
    String initialDelay,
    String interval,
    String createdAt,
    String nextExecuteAt,
    boolean active) {

  public static SubscriptionView from(Subscription subscription) {
    return new SubscriptionView(
        subscription.getId(),
        subscription.getBeneficiary().toString(),
        subscription.getToken().toString(),
        subscription.getAmount().toString(),
        subscription.getInitialDelay().toString(),
        subscription.getInterval().toString(),
        subscription.getCreatedAt().toString(),
        subscription.getNextExecuteAt().toString(),
        subscription.isActive());
  }
}
