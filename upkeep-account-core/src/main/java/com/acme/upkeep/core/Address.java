package com.acme.upkeep.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte account identity rendered as {@code 0x}-prefixed lowercase hex. Immutable value object.
 */
public final class Address implements Comparable<Address> {

  public static final int LENGTH = 20;

  /** The null identity. Never a valid beneficiary, token, owner or dispatcher. */
  public static final Address ZERO = new Address("0x" + "0".repeat(LENGTH * 2));

  private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
  private static final HexFormat HEX = HexFormat.of();

  private final String value;

  private Address(String value) {
    this.value = value;
  }

  @JsonCreator
  public static Address of(String hex) {
    if (hex == null || !HEX_ADDRESS.matcher(hex).matches()) {
      throw new IllegalArgumentException("Invalid address: " + hex);
    }
    return new Address(hex.toLowerCase(Locale.ROOT));
  }

  public static Address of(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Address must be exactly " + LENGTH + " bytes");
    }
    return new Address("0x" + HEX.formatHex(bytes));
  }

  public boolean isZero() {
    return ZERO.equals(this);
  }

  public byte[] toBytes() {
    return HEX.parseHex(value, 2, value.length());
  }

  @JsonValue
  @Override
  public String toString() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Address other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public int compareTo(Address other) {
    return value.compareTo(other.value);
  }
}
