package com.acme.upkeep.core;

import java.util.HexFormat;

/** Raised by the generic execute entries; carries the callee's return data unchanged. */
public class TransferFailedException extends AccountException {
  private final byte[] returnData;

  public TransferFailedException(byte[] returnData) {
    super(
        AccountError.TRANSFER_FAILED,
        "Transfer failed: 0x" + HexFormat.of().formatHex(returnData == null ? new byte[0] : returnData));
    this.returnData = returnData == null ? new byte[0] : returnData.clone();
  }

  public byte[] getReturnData() {
    return returnData.clone();
  }
}
