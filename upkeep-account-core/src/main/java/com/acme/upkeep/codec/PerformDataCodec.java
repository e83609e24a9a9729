package com.acme.upkeep.codec;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * ABI codec for upkeep perform data: a single dynamic {@code uint256[]} of subscription ids.
 *
 * <p>Layout: head word holding the offset (0x20), a length word, then one word per id.
 */
public final class PerformDataCodec {

  private static final BigInteger HEAD_OFFSET = BigInteger.valueOf(AbiWords.WORD);
  private static final BigInteger MAX_ID = BigInteger.valueOf(Long.MAX_VALUE);

  private PerformDataCodec() {}

  public static byte[] encode(List<Long> ids) {
    byte[] out = new byte[(2 + ids.size()) * AbiWords.WORD];
    AbiWords.writeUint(out, 0, HEAD_OFFSET);
    AbiWords.writeUint(out, AbiWords.WORD, BigInteger.valueOf(ids.size()));
    for (int i = 0; i < ids.size(); i++) {
      long id = ids.get(i);
      if (id < 0) {
        throw new IllegalArgumentException("Subscription id cannot be negative: " + id);
      }
      AbiWords.writeUint(out, (2 + i) * AbiWords.WORD, BigInteger.valueOf(id));
    }
    return out;
  }

  public static List<Long> decode(byte[] performData) {
    if (performData == null || performData.length < 2 * AbiWords.WORD) {
      throw new IllegalArgumentException("Perform data too short");
    }
    if (performData.length % AbiWords.WORD != 0) {
      throw new IllegalArgumentException("Perform data is not word aligned");
    }
    BigInteger offset = AbiWords.readUint(performData, 0);
    if (!HEAD_OFFSET.equals(offset)) {
      throw new IllegalArgumentException("Unexpected array offset: " + offset);
    }
    BigInteger length = AbiWords.readUint(performData, AbiWords.WORD);
    int words = performData.length / AbiWords.WORD - 2;
    if (length.compareTo(BigInteger.valueOf(words)) != 0) {
      throw new IllegalArgumentException(
          "Array length " + length + " does not match " + words + " encoded elements");
    }

    List<Long> ids = new ArrayList<>(words);
    for (int i = 0; i < words; i++) {
      BigInteger id = AbiWords.readUint(performData, (2 + i) * AbiWords.WORD);
      if (id.compareTo(MAX_ID) > 0) {
        throw new IllegalArgumentException("Subscription id out of range: " + id);
      }
      ids.add(id.longValueExact());
    }
    return ids;
  }
}
