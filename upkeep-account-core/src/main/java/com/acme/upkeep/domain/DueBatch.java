package com.acme.upkeep.domain;

import java.util.List;

/** Result of one due-subscription scan, ids in scan order. */
public record DueBatch(boolean dueExists, List<Long> ids) {

  public DueBatch {
    ids = List.copyOf(ids);
  }

  public static DueBatch empty() {
    return new DueBatch(false, List.of());
  }

  public static DueBatch of(List<Long> ids) {
    return new DueBatch(!ids.isEmpty(), ids);
  }
}
