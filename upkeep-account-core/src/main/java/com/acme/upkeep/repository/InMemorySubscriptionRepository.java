package com.acme.upkeep.repository;

import com.acme.upkeep.domain.Subscription;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** List-backed arena: id n lives at index n - 1. Returns live records. */
public class InMemorySubscriptionRepository implements SubscriptionRepository {
  private final List<Subscription> arena = new ArrayList<>();

  @Override
  public synchronized void append(Subscription subscription) {
    long expected = arena.size() + 1L;
    if (subscription.getId() != expected) {
      throw new IllegalArgumentException(
          "Expected subscription id " + expected + " but got " + subscription.getId());
    }
    arena.add(subscription);
  }

  @Override
  public synchronized Optional<Subscription> findById(long id) {
    if (id < 1 || id > arena.size()) {
      return Optional.empty();
    }
    return Optional.of(arena.get((int) (id - 1)));
  }

  @Override
  public synchronized List<Subscription> findAll() {
    return Collections.unmodifiableList(new ArrayList<>(arena));
  }

  @Override
  public synchronized long count() {
    return arena.size();
  }
}
