package com.acme.upkeep.domain;

import com.acme.upkeep.core.Address;
import java.math.BigInteger;

/**
 * Inbound operation submitted by the dispatcher on the owner's behalf. Gas and fee fields are
 * carried for completeness; validation only reads sender, nonce, callData and signature.
 */
public record UserOperation(
    Address sender,
    BigInteger nonce,
    byte[] callData,
    BigInteger callGasLimit,
    BigInteger verificationGasLimit,
    BigInteger preVerificationGas,
    BigInteger maxFeePerGas,
    BigInteger maxPriorityFeePerGas,
    byte[] signature) {

  public UserOperation {
    if (nonce == null) {
      throw new IllegalArgumentException("Nonce cannot be null");
    }
    callData = callData == null ? new byte[0] : callData;
    signature = signature == null ? new byte[0] : signature;
  }

  public static UserOperation of(Address sender, BigInteger nonce, byte[] callData, byte[] signature) {
    return new UserOperation(
        sender,
        nonce,
        callData,
        BigInteger.ZERO,
        BigInteger.ZERO,
        BigInteger.ZERO,
        BigInteger.ZERO,
        BigInteger.ZERO,
        signature);
  }
}
