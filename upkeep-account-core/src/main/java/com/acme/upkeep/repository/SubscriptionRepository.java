package com.acme.upkeep.repository;

import com.acme.upkeep.domain.Subscription;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of subscriptions indexed by id. Ids are dense: the n-th appended record has id
 * n, so {@link #count()} doubles as the highest assigned id. Records are never removed.
 */
public interface SubscriptionRepository {

  /** Appends a record whose id must equal {@code count() + 1}. */
  void append(Subscription subscription);

  Optional<Subscription> findById(long id);

  /** All records in ascending id order, cancelled ones included */
  List<Subscription> findAll();

  long count();
}
