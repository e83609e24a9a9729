package com.acme.upkeep.core;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for the account error taxonomy */
class AccountExceptionTest {

  @Test
  @DisplayName("Errors should fall into authorization, input and execution categories")
  void testCategories() {
    assertThat(AccountError.NOT_AUTHORIZED_DISPATCHER.category())
        .isEqualTo(AccountError.Category.AUTHORIZATION);
    assertThat(AccountError.NOT_AUTHORIZED_DISPATCHER_OR_OWNER.category())
        .isEqualTo(AccountError.Category.AUTHORIZATION);
    assertThat(AccountError.VALIDATION_FAILED.category())
        .isEqualTo(AccountError.Category.AUTHORIZATION);
    assertThat(AccountError.NONCE_OUT_OF_RANGE.category()).isEqualTo(AccountError.Category.INPUT);
    assertThat(AccountError.SUBSCRIPTION_INVALID.category()).isEqualTo(AccountError.Category.INPUT);
    assertThat(AccountError.TRANSFER_FAILED.category()).isEqualTo(AccountError.Category.EXECUTION);
  }

  @Test
  @DisplayName("SubscriptionInvalidException should carry the offending id")
  void testSubscriptionInvalid() {
    SubscriptionInvalidException exception = new SubscriptionInvalidException(42);

    assertThat(exception.getError()).isEqualTo(AccountError.SUBSCRIPTION_INVALID);
    assertThat(exception.getSubscriptionId()).isEqualTo(42);
    assertThat(exception).hasMessage("Subscription invalid: 42");
  }

  @Test
  @DisplayName("TransferFailedException should carry a defensive copy of the return data")
  void testTransferFailed() {
    byte[] returnData = {0x08, (byte) 0xc3, 0x79, (byte) 0xa0};
    TransferFailedException exception = new TransferFailedException(returnData);
    returnData[0] = 0;

    assertThat(exception.getError()).isEqualTo(AccountError.TRANSFER_FAILED);
    assertThat(exception.getReturnData()).containsExactly(0x08, 0xc3, 0x79, 0xa0);
    assertThat(exception).hasMessage("Transfer failed: 0x08c379a0");
  }

  @Test
  @DisplayName("TransferFailedException should accept missing return data")
  void testTransferFailedNoData() {
    TransferFailedException exception = new TransferFailedException(null);

    assertThat(exception.getReturnData()).isEmpty();
    assertThat(exception).hasMessage("Transfer failed: 0x");
  }
}
