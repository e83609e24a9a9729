package com.acme.upkeep.codec;

import com.acme.upkeep.core.Address;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/** Encodes and decodes ERC-20 {@code transfer(address,uint256)} calldata. */
public final class TransferCalldata {

  public static final byte[] SELECTOR = HexFormat.of().parseHex("a9059cbb");
  public static final int LENGTH = SELECTOR.length + 2 * AbiWords.WORD;

  /** Largest amount a transfer word can carry. */
  public static final BigInteger MAX_AMOUNT = AbiWords.UINT256_LIMIT.subtract(BigInteger.ONE);

  private TransferCalldata() {}

  public record Transfer(Address to, BigInteger amount) {}

  public static byte[] encode(Address to, BigInteger amount) {
    byte[] out = new byte[LENGTH];
    System.arraycopy(SELECTOR, 0, out, 0, SELECTOR.length);
    byte[] addr = to.toBytes();
    System.arraycopy(addr, 0, out, SELECTOR.length + AbiWords.WORD - addr.length, addr.length);
    AbiWords.writeUint(out, SELECTOR.length + AbiWords.WORD, amount);
    return out;
  }

  public static boolean isTransfer(byte[] payload) {
    return payload != null
        && payload.length == LENGTH
        && Arrays.equals(payload, 0, SELECTOR.length, SELECTOR, 0, SELECTOR.length);
  }

  public static Transfer decode(byte[] payload) {
    if (!isTransfer(payload)) {
      throw new IllegalArgumentException("Not an ERC-20 transfer payload");
    }
    int addrWord = SELECTOR.length;
    for (int i = addrWord; i < addrWord + AbiWords.WORD - Address.LENGTH; i++) {
      if (payload[i] != 0) {
        throw new IllegalArgumentException("Dirty address padding in transfer payload");
      }
    }
    Address to =
        Address.of(
            Arrays.copyOfRange(
                payload, addrWord + AbiWords.WORD - Address.LENGTH, addrWord + AbiWords.WORD));
    BigInteger amount = AbiWords.readUint(payload, addrWord + AbiWords.WORD);
    return new Transfer(to, amount);
  }
}
