package com.acme.upkeep.spi;

import com.acme.upkeep.core.Address;
import com.acme.upkeep.domain.CallResult;
import java.math.BigInteger;

/**
 * Outbound invocation on behalf of the account. Callee failures are reported through {@link
 * CallResult#success()}, not by throwing. An invocation may call back into the account.
 */
@FunctionalInterface
public interface CallExecutor {
  CallResult invoke(Address target, BigInteger value, byte[] payload);
}
