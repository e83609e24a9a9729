package com.acme.upkeep.config;

import com.acme.upkeep.core.Address;
import java.util.ArrayList;
import java.util.List;

/**
 * Identities the account is deployed with. Values are hex strings so the POJO binds directly from
 * configuration files. Pure POJO - no framework dependencies.
 */
public class AccountConfig {

  private String address;
  private String owner;
  private String dispatcher;
  private List<String> tokens = new ArrayList<>(); // Tokens the simulated ledger knows about

  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  public String getOwner() {
    return owner;
  }

  public void setOwner(String owner) {
    this.owner = owner;
  }

  public String getDispatcher() {
    return dispatcher;
  }

  public void setDispatcher(String dispatcher) {
    this.dispatcher = dispatcher;
  }

  public List<String> getTokens() {
    return tokens;
  }

  public void setTokens(List<String> tokens) {
    this.tokens = tokens;
  }

  public List<Address> tokenAddresses() {
    return tokens.stream().map(Address::of).toList();
  }

  public Address accountAddress() {
    return Address.of(address);
  }

  public Address ownerAddress() {
    return Address.of(owner);
  }

  public Address dispatcherAddress() {
    return Address.of(dispatcher);
  }
}
