package com.acme.upkeep.domain;

/** Poll result in wire form: the due batch ABI-encoded as perform data. */
public record UpkeepCheck(boolean upkeepNeeded, byte[] performData) {}
