package com.acme.upkeep.service;

import com.acme.upkeep.core.AccountError;
import com.acme.upkeep.core.AccountException;
import com.acme.upkeep.core.Address;
import com.acme.upkeep.domain.CallResult;
import com.acme.upkeep.domain.UserOperation;
import com.acme.upkeep.spi.CallExecutor;
import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates operations the dispatcher submits on the owner's behalf and settles the dispatcher's
 * prefund.
 *
 * <p>Failures are always raised as {@link AccountException}; the only value ever returned is
 * {@link #VALIDATION_SUCCESS}. Replay protection is the dispatcher's nonce ledger; here the nonce
 * only gets a format check.
 */
@Slf4j
@RequiredArgsConstructor
public class OperationValidator {

  public static final long VALIDATION_SUCCESS = 0L;
  public static final BigInteger MAX_NONCE = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  private static final byte[] EMPTY = new byte[0];

  private final AccessGate accessGate;
  private final SignatureValidator signatureValidator;
  private final CallExecutor callExecutor;
  private final ReentrancyGuard reentrancyGuard;

  public long validate(
      Address caller, UserOperation op, byte[] opDigest, BigInteger missingFunds) {
    accessGate.requireDispatcher(caller);
    reentrancyGuard.requireNotEntered();

    if (!signatureValidator.isSignedBy(opDigest, op.signature(), accessGate.owner())) {
      throw new AccountException(
          AccountError.VALIDATION_FAILED, "Operation is not signed by the account owner");
    }

    if (op.nonce().signum() < 0 || op.nonce().compareTo(MAX_NONCE) > 0) {
      throw new AccountException(
          AccountError.NONCE_OUT_OF_RANGE, "Nonce out of range: " + op.nonce());
    }

    if (missingFunds != null && missingFunds.signum() > 0) {
      payPrefund(caller, missingFunds);
    }
    return VALIDATION_SUCCESS;
  }

  // Funding sufficiency is the dispatcher's concern; a failed settlement never fails validation.
  private void payPrefund(Address dispatcher, BigInteger missingFunds) {
    try {
      CallResult result =
          reentrancyGuard.guard(() -> callExecutor.invoke(dispatcher, missingFunds, EMPTY));
      if (!result.success()) {
        log.warn("Prefund of {} to dispatcher {} was not settled", missingFunds, dispatcher);
      }
    } catch (RuntimeException e) {
      log.warn("Prefund of {} to dispatcher {} raised: {}", missingFunds, dispatcher, e.getMessage(), e);
    }
  }
}
