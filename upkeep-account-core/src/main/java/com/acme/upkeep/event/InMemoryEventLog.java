package com.acme.upkeep.event;

import com.acme.upkeep.core.Jsons;
import com.acme.upkeep.domain.SubscriptionEvent;
import com.acme.upkeep.spi.EventPublisher;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/** Keeps every published event in emission order and logs it as JSON. */
@Slf4j
public class InMemoryEventLog implements EventPublisher {
  private final List<SubscriptionEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void publish(SubscriptionEvent event) {
    events.add(event);
    log.info("Subscription event {}", Jsons.toJson(event));
  }

  public List<SubscriptionEvent> events() {
    return List.copyOf(events);
  }

  public List<SubscriptionEvent> eventsFor(long subscriptionId) {
    return events.stream().filter(e -> e.id() == subscriptionId).toList();
  }
}
