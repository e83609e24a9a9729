package com.acme.upkeep.service;

import com.acme.upkeep.core.AccountError;
import com.acme.upkeep.core.AccountException;
import java.util.function.Supplier;

/**
 * Scoped flag set for the duration of any call that leaves the account. Mutating entry points
 * reached while the flag is set are rejected.
 */
public class ReentrancyGuard {
  private boolean entered;

  public boolean isEntered() {
    return entered;
  }

  public void requireNotEntered() {
    if (entered) {
      throw new AccountException(
          AccountError.REENTRANT_CALL, "Reentrant call while an outbound invocation is in progress");
    }
  }

  public <T> T guard(Supplier<T> action) {
    requireNotEntered();
    entered = true;
    try {
      return action.get();
    } finally {
      entered = false;
    }
  }
}
