package com.acme.upkeep.ledger;

import com.acme.upkeep.codec.TransferCalldata;
import com.acme.upkeep.core.Address;
import com.acme.upkeep.domain.CallResult;
import com.acme.upkeep.spi.CallExecutor;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulated value ledger standing in for the outbound call mechanism. Tracks native balances and
 * balances of registered ERC-20 style tokens; every invocation is made from the account address.
 *
 * <p>Only registered tokens accept calldata; any other target is a plain value recipient.
 *
 * <p>An invocation is all-or-nothing: value and token movement are both checked before either is
 * applied.
 */
@Slf4j
public class InMemoryLedger implements CallExecutor {
  static final byte[] TRUE_WORD = new byte[32];

  static {
    TRUE_WORD[31] = 1;
  }

  private final Address account;
  private final Map<Address, BigInteger> nativeBalances = new HashMap<>();
  private final Map<Address, Map<Address, BigInteger>> tokenBalances = new HashMap<>();
  private final Set<Address> tokens = new HashSet<>();

  public InMemoryLedger(Address account) {
    if (account == null || account.isZero()) {
      throw new IllegalArgumentException("Ledger account cannot be the zero address");
    }
    this.account = account;
  }

  public synchronized void registerToken(Address token) {
    tokens.add(token);
    tokenBalances.putIfAbsent(token, new HashMap<>());
  }

  public synchronized void mintNative(Address holder, BigInteger amount) {
    nativeBalances.merge(holder, amount, BigInteger::add);
  }

  public synchronized void mint(Address token, Address holder, BigInteger amount) {
    if (!tokens.contains(token)) {
      throw new IllegalArgumentException("Unknown token: " + token);
    }
    tokenBalances.get(token).merge(holder, amount, BigInteger::add);
  }

  public synchronized BigInteger nativeBalanceOf(Address holder) {
    return nativeBalances.getOrDefault(holder, BigInteger.ZERO);
  }

  public synchronized BigInteger balanceOf(Address token, Address holder) {
    return tokenBalances.getOrDefault(token, Map.of()).getOrDefault(holder, BigInteger.ZERO);
  }

  @Override
  public synchronized CallResult invoke(Address target, BigInteger value, byte[] payload) {
    BigInteger sent = value == null ? BigInteger.ZERO : value;
    byte[] data = payload == null ? new byte[0] : payload;

    if (sent.signum() < 0) {
      return revert("negative value");
    }
    if (nativeBalanceOf(account).compareTo(sent) < 0) {
      return revert("insufficient native balance");
    }

    TransferCalldata.Transfer transfer = null;
    if (!tokens.contains(target) && data.length > 0) {
      return revert("no contract at target");
    }
    if (tokens.contains(target)) {
      if (!TransferCalldata.isTransfer(data)) {
        return revert("unsupported token call");
      }
      try {
        transfer = TransferCalldata.decode(data);
      } catch (IllegalArgumentException e) {
        return revert("malformed transfer: " + e.getMessage());
      }
      if (balanceOf(target, account).compareTo(transfer.amount()) < 0) {
        return revert("ERC20: transfer amount exceeds balance");
      }
    }

    if (sent.signum() > 0) {
      nativeBalances.merge(account, sent.negate(), BigInteger::add);
      nativeBalances.merge(target, sent, BigInteger::add);
    }
    if (transfer != null) {
      Map<Address, BigInteger> balances = tokenBalances.get(target);
      balances.merge(account, transfer.amount().negate(), BigInteger::add);
      balances.merge(transfer.to(), transfer.amount(), BigInteger::add);
      log.debug("Token {} moved {} from {} to {}", target, transfer.amount(), account, transfer.to());
      return CallResult.ok(TRUE_WORD.clone());
    }
    return CallResult.ok(new byte[0]);
  }

  private CallResult revert(String reason) {
    log.debug("Ledger call reverted: {}", reason);
    return CallResult.failure(reason.getBytes(StandardCharsets.UTF_8));
  }
}
