package com.acme.upkeep.core;

/**
 * Rejection of the current call. Authorization and input rejections leave account state untouched;
 * a {@link TransferFailedException} from a batch keeps the effects of the calls that ran before it.
 */
public class AccountException extends RuntimeException {
  private final AccountError error;

  public AccountException(AccountError error, String message) {
    super(message);
    this.error = error;
  }

  public AccountError getError() {
    return error;
  }
}
