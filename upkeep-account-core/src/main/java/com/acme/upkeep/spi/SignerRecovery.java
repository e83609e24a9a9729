package com.acme.upkeep.spi;

import com.acme.upkeep.core.Address;

/**
 * Signature recovery primitive. Implementations must be pure: the same digest and signature always
 * recover the same identity.
 */
@FunctionalInterface
public interface SignerRecovery {

  /** Returned when the signature is malformed or does not recover to any identity. */
  Address INVALID_SIGNER = Address.ZERO;

  Address recover(byte[] digest, byte[] signature);
}
