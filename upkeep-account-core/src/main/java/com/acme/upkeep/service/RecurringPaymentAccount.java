package com.acme.upkeep.service;

import com.acme.upkeep.codec.PerformDataCodec;
import com.acme.upkeep.config.AccountConfig;
import com.acme.upkeep.config.SchedulerConfig;
import com.acme.upkeep.core.Address;
import com.acme.upkeep.core.TransferFailedException;
import com.acme.upkeep.domain.CallResult;
import com.acme.upkeep.domain.DueBatch;
import com.acme.upkeep.domain.Subscription;
import com.acme.upkeep.domain.UpkeepCheck;
import com.acme.upkeep.domain.UpkeepReport;
import com.acme.upkeep.domain.UserOperation;
import com.acme.upkeep.repository.SubscriptionRepository;
import com.acme.upkeep.spi.CallExecutor;
import com.acme.upkeep.spi.EventPublisher;
import com.acme.upkeep.spi.SignerRecovery;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * The account: every inbound entry point in one place.
 *
 * <p>Entry points are serialized on the account monitor, so each one runs to completion before the
 * next starts. Same-thread reentry from an outbound invocation passes the monitor and is stopped
 * by the shared {@link ReentrancyGuard} instead.
 */
@Slf4j
public class RecurringPaymentAccount {
  private final Address address;
  private final AccessGate accessGate;
  private final ReentrancyGuard reentrancyGuard;
  private final OperationValidator operationValidator;
  private final SubscriptionRegistry registry;
  private final UpkeepScheduler scheduler;
  private final CallExecutor callExecutor;

  public RecurringPaymentAccount(
      AccountConfig accountConfig,
      SchedulerConfig schedulerConfig,
      SubscriptionRepository repository,
      SignerRecovery signerRecovery,
      CallExecutor callExecutor,
      EventPublisher events,
      Clock clock) {
    this.address = accountConfig.accountAddress();
    this.accessGate =
        new AccessGate(accountConfig.ownerAddress(), accountConfig.dispatcherAddress());
    this.reentrancyGuard = new ReentrancyGuard();
    this.callExecutor = callExecutor;
    this.operationValidator =
        new OperationValidator(
            accessGate, new SignatureValidator(signerRecovery), callExecutor, reentrancyGuard);
    this.registry = new SubscriptionRegistry(repository, accessGate, reentrancyGuard, events, clock);
    this.scheduler =
        new UpkeepScheduler(repository, callExecutor, events, reentrancyGuard, clock, schedulerConfig);
    log.info(
        "Account {} ready: owner={} dispatcher={}",
        address,
        accessGate.owner(),
        accessGate.dispatcher());
  }

  public Address address() {
    return address;
  }

  public Address owner() {
    return accessGate.owner();
  }

  public Address dispatcher() {
    return accessGate.dispatcher();
  }

  public synchronized long validateOperation(
      Address caller, UserOperation op, byte[] opDigest, BigInteger missingFunds) {
    return operationValidator.validate(caller, op, opDigest, missingFunds);
  }

  public synchronized long createSubscription(
      Address caller,
      Address beneficiary,
      Address token,
      BigInteger amount,
      Duration initialDelay,
      Duration interval) {
    return registry.create(caller, beneficiary, token, amount, initialDelay, interval);
  }

  public synchronized void cancelSubscription(Address caller, long id) {
    registry.cancel(caller, id);
  }

  public synchronized Subscription getSubscription(long id) {
    return registry.get(id);
  }

  public synchronized List<Subscription> listSubscriptions() {
    return registry.list();
  }

  public synchronized long totalSubscriptions() {
    return registry.totalSubscriptions();
  }

  public synchronized DueBatch checkDue() {
    return scheduler.checkDue();
  }

  public synchronized UpkeepReport executeDue(List<Long> batch) {
    return scheduler.executeDue(batch);
  }

  public synchronized UpkeepCheck checkUpkeep() {
    DueBatch batch = scheduler.checkDue();
    return new UpkeepCheck(batch.dueExists(), PerformDataCodec.encode(batch.ids()));
  }

  public synchronized UpkeepReport performUpkeep(byte[] performData) {
    return scheduler.executeDue(PerformDataCodec.decode(performData));
  }

  /**
   * Generic outbound call on the owner's behalf.
   *
   * @return the callee's return data
   * @throws TransferFailedException carrying the callee's return data when the call fails
   */
  public synchronized byte[] execute(Address caller, Address target, BigInteger value, byte[] payload) {
    accessGate.requireDispatcherOrOwner(caller);
    return reentrancyGuard.guard(() -> call(target, value, payload));
  }

  /**
   * Runs calls in order and stops at the first failure. An empty {@code values} list sends no
   * value with any call.
   */
  public synchronized void executeBatch(
      Address caller, List<Address> targets, List<BigInteger> values, List<byte[]> payloads) {
    accessGate.requireDispatcherOrOwner(caller);
    if (targets.size() != payloads.size() || (!values.isEmpty() && values.size() != targets.size())) {
      throw new IllegalArgumentException(
          "Batch length mismatch: targets="
              + targets.size()
              + " values="
              + values.size()
              + " payloads="
              + payloads.size());
    }
    reentrancyGuard.guard(
        () -> {
          for (int i = 0; i < targets.size(); i++) {
            call(targets.get(i), values.isEmpty() ? BigInteger.ZERO : values.get(i), payloads.get(i));
          }
          return null;
        });
  }

  private byte[] call(Address target, BigInteger value, byte[] payload) {
    CallResult result = callExecutor.invoke(target, value, payload);
    if (!result.success()) {
      log.warn("Call to {} with value {} failed", target, value);
      throw new TransferFailedException(result.returnData());
    }
    return result.returnData();
  }
}
