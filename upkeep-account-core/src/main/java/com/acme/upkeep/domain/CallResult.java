package com.acme.upkeep.domain;

/** Outcome of an outbound invocation. */
public record CallResult(boolean success, byte[] returnData) {

  private static final byte[] EMPTY = new byte[0];

  public CallResult {
    returnData = returnData == null ? EMPTY : returnData;
  }

  public static CallResult ok(byte[] returnData) {
    return new CallResult(true, returnData);
  }

  public static CallResult failure(byte[] returnData) {
    return new CallResult(false, returnData);
  }
}
