package com.acme.upkeep.codec;

import java.math.BigInteger;
import java.util.Arrays;

/** 32-byte big-endian word helpers shared by the ABI codecs. */
final class AbiWords {
  static final int WORD = 32;
  static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);

  private AbiWords() {}

  static void writeUint(byte[] out, int offset, BigInteger value) {
    if (value.signum() < 0 || value.compareTo(UINT256_LIMIT) >= 0) {
      throw new IllegalArgumentException("Value does not fit in uint256: " + value);
    }
    byte[] raw = value.toByteArray();
    // toByteArray may carry a leading sign byte
    int start = raw.length > WORD ? raw.length - WORD : 0;
    int len = raw.length - start;
    System.arraycopy(raw, start, out, offset + WORD - len, len);
  }

  static BigInteger readUint(byte[] in, int offset) {
    if (offset < 0 || offset + WORD > in.length) {
      throw new IllegalArgumentException("Truncated ABI word at offset " + offset);
    }
    return new BigInteger(1, Arrays.copyOfRange(in, offset, offset + WORD));
  }
}
