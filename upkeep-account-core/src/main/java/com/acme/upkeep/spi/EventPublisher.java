package com.acme.upkeep.spi;

import com.acme.upkeep.domain.SubscriptionEvent;

@FunctionalInterface
public interface EventPublisher {
  void publish(SubscriptionEvent event);
}
