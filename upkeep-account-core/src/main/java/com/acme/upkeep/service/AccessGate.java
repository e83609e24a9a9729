package com.acme.upkeep.service;

import com.acme.upkeep.core.AccountError;
import com.acme.upkeep.core.AccountException;
import com.acme.upkeep.core.Address;

/**
 * Privileged-caller guards evaluated against the identity of the current caller. The two identity
 * predicates are kept separate and only ever combined with OR.
 */
public class AccessGate {
  private final Address owner;
  private final Address dispatcher;

  public AccessGate(Address owner, Address dispatcher) {
    if (owner == null || owner.isZero()) {
      throw new IllegalArgumentException("Owner cannot be the zero address");
    }
    if (dispatcher == null || dispatcher.isZero()) {
      throw new IllegalArgumentException("Dispatcher cannot be the zero address");
    }
    this.owner = owner;
    this.dispatcher = dispatcher;
  }

  public Address owner() {
    return owner;
  }

  public Address dispatcher() {
    return dispatcher;
  }

  public boolean isDispatcher(Address caller) {
    return dispatcher.equals(caller);
  }

  public boolean isOwner(Address caller) {
    return owner.equals(caller);
  }

  public void requireDispatcher(Address caller) {
    if (!isDispatcher(caller)) {
      throw new AccountException(
          AccountError.NOT_AUTHORIZED_DISPATCHER, "Caller " + caller + " is not the dispatcher");
    }
  }

  public void requireDispatcherOrOwner(Address caller) {
    if (!(isDispatcher(caller) || isOwner(caller))) {
      throw new AccountException(
          AccountError.NOT_AUTHORIZED_DISPATCHER_OR_OWNER,
          "Caller " + caller + " is neither the dispatcher nor the owner");
    }
  }
}
