package com.acme.upkeep.web;

import static org.assertj.core.api.Assertions.*;

import com.acme.upkeep.core.AccountError;
import com.acme.upkeep.core.AccountException;
import com.acme.upkeep.core.SubscriptionInvalidException;
import com.acme.upkeep.core.TransferFailedException;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AccountExceptionHandlerTest {

    private final AccountExceptionHandler handler = new AccountExceptionHandler();

    @ParameterizedTest
    @CsvSource({
        "NOT_AUTHORIZED_DISPATCHER, FORBIDDEN",
        "NOT_AUTHORIZED_DISPATCHER_OR_OWNER, FORBIDDEN",
        "VALIDATION_FAILED, FORBIDDEN",
        "REENTRANT_CALL, FORBIDDEN",
        "BENEFICIARY_IS_ZERO, BAD_REQUEST",
        "INTERVAL_TOO_SHORT, BAD_REQUEST",
        "AMOUNT_OUT_OF_RANGE, BAD_REQUEST",
        "SCHEDULE_OUT_OF_RANGE, BAD_REQUEST",
        "NONCE_OUT_OF_RANGE, BAD_REQUEST",
        "SUBSCRIPTION_INVALID, NOT_FOUND",
        "TRANSFER_FAILED, BAD_GATEWAY"
    })
    @DisplayName("Should map each error to its HTTP status")
    void shouldMapStatus(AccountError error, HttpStatus expected) {
        assertThat((Object) AccountExceptionHandler.statusFor(error)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should return 404 with the exception message for an unknown subscription")
    void shouldBuildNotFoundBody() {
        HttpResponse<ErrorResponse> response = handler.handle(null, new SubscriptionInvalidException(7));

        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.body())
            .isEqualTo(new ErrorResponse("Subscription invalid: 7", "SUBSCRIPTION_INVALID", 404));
    }

    @Test
    @DisplayName("Should return 502 for a failed transfer")
    void shouldBuildBadGatewayBody() {
        HttpResponse<ErrorResponse> response = handler.handle(null, new TransferFailedException(new byte[] {1}));

        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.body().message()).isEqualTo("Transfer failed: 0x01");
    }

    @Test
    @DisplayName("Should return 403 for an unauthorized caller")
    void shouldBuildForbiddenBody() {
        HttpResponse<ErrorResponse> response = handler.handle(
            null, new AccountException(AccountError.NOT_AUTHORIZED_DISPATCHER, "nope"));

        assertThat(response.code()).isEqualTo(403);
        assertThat(response.body().error()).isEqualTo("NOT_AUTHORIZED_DISPATCHER");
    }
}
