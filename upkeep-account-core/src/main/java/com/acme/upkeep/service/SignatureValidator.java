package com.acme.upkeep.service;

import com.acme.upkeep.core.Address;
import com.acme.upkeep.spi.SignerRecovery;
import lombok.RequiredArgsConstructor;

/** Stateless check that a digest was signed by exactly one expected identity. */
@RequiredArgsConstructor
public class SignatureValidator {
  private final SignerRecovery signerRecovery;

  public boolean isSignedBy(byte[] digest, byte[] signature, Address expected) {
    Address recovered = signerRecovery.recover(digest, signature);
    if (recovered == null || SignerRecovery.INVALID_SIGNER.equals(recovered)) {
      return false;
    }
    return recovered.equals(expected);
  }
}
