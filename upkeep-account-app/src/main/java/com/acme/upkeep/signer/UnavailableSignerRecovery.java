package com.acme.upkeep.signer;

import com.acme.upkeep.core.Address;
import com.acme.upkeep.spi.SignerRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Recovers nobody, so every operation submitted for validation is rejected. */
public class UnavailableSignerRecovery implements SignerRecovery {
  private static final Logger LOG = LoggerFactory.getLogger(UnavailableSignerRecovery.class);

  @Override
  public Address recover(byte[] digest, byte[] signature) {
    LOG.warn("No signer recovery configured, treating signature as invalid");
    return INVALID_SIGNER;
  }
}
