package com.acme.upkeep.web;

import com.acme.upkeep.core.AccountError;
import com.acme.upkeep.core.AccountException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Global exception handler for AccountException.
 *
 * <p>Authorization failures map to 403, an unknown or cancelled subscription to 404, other input
 * errors to 400 and a failed outbound transfer to 502.
 */
@Produces
@Singleton
@Requires(classes = {AccountException.class, ExceptionHandler.class})
public class AccountExceptionHandler
    implements ExceptionHandler<AccountException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, AccountException exception) {
    HttpStatus status = statusFor(exception.getError());
    return HttpResponse.status(status)
        .body(new ErrorResponse(exception.getMessage(), exception.getError().name(), status.getCode()));
  }

  static HttpStatus statusFor(AccountError error) {
    if (error == AccountError.SUBSCRIPTION_INVALID) {
      return HttpStatus.NOT_FOUND;
    }
    return switch (error.category()) {
      case AUTHORIZATION -> HttpStatus.FORBIDDEN;
      case INPUT -> HttpStatus.BAD_REQUEST;
      case EXECUTION -> HttpStatus.BAD_GATEWAY;
    };
  }
}
