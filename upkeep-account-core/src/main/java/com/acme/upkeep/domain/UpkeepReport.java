package com.acme.upkeep.domain;

import java.util.List;

/**
 * Per-item outcome of one executeDue call. Skipped ids were not due, unknown, cancelled, or
 * repeated within the batch; nothing was invoked or emitted for them.
 */
public record UpkeepReport(List<Long> executed, List<Long> failed, List<Long> skipped) {

  public UpkeepReport {
    executed = List.copyOf(executed);
    failed = List.copyOf(failed);
    skipped = List.copyOf(skipped);
  }

  public int attempted() {
    return executed.size() + failed.size();
  }
}
