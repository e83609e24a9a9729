package com.acme.upkeep.core;

/** Rejection reasons raised by account entry points. None of them is process-fatal. */
public enum AccountError {
  NOT_AUTHORIZED_DISPATCHER(Category.AUTHORIZATION),
  NOT_AUTHORIZED_DISPATCHER_OR_OWNER(Category.AUTHORIZATION),
  VALIDATION_FAILED(Category.AUTHORIZATION),
  REENTRANT_CALL(Category.AUTHORIZATION),

  BENEFICIARY_IS_ZERO(Category.INPUT),
  TOKEN_ADDR_IS_ZERO(Category.INPUT),
  AMOUNT_IS_ZERO(Category.INPUT),
  AMOUNT_OUT_OF_RANGE(Category.INPUT),
  EXECUTE_TIME_IS_ZERO(Category.INPUT),
  INTERVAL_TOO_SHORT(Category.INPUT),
  SCHEDULE_OUT_OF_RANGE(Category.INPUT),
  SUBSCRIPTION_INVALID(Category.INPUT),
  NONCE_OUT_OF_RANGE(Category.INPUT),

  TRANSFER_FAILED(Category.EXECUTION);

  public enum Category {
    AUTHORIZATION,
    INPUT,
    EXECUTION
  }

  private final Category category;

  AccountError(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }
}
