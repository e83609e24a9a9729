package com.acme.upkeep.service;

import static com.acme.upkeep.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.acme.upkeep.codec.TransferCalldata;
import com.acme.upkeep.config.SchedulerConfig;
import com.acme.upkeep.domain.CallResult;
import com.acme.upkeep.domain.DueBatch;
import com.acme.upkeep.domain.Subscription;
import com.acme.upkeep.domain.SubscriptionEvent.SubscriptionExecuted;
import com.acme.upkeep.domain.SubscriptionEvent.SubscriptionFailed;
import com.acme.upkeep.domain.UpkeepReport;
import com.acme.upkeep.event.InMemoryEventLog;
import com.acme.upkeep.repository.InMemorySubscriptionRepository;
import com.acme.upkeep.spi.CallExecutor;
import com.acme.upkeep.spi.EventPublisher;
import com.acme.upkeep.support.MutableClock;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UpkeepSchedulerTest {

  private static final Duration HOUR = Duration.ofHours(1);

  @Mock private CallExecutor callExecutor;

  private MutableClock clock;
  private InMemorySubscriptionRepository repository;
  private InMemoryEventLog events;
  private SchedulerConfig config;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    repository = new InMemorySubscriptionRepository();
    events = new InMemoryEventLog();
    config = new SchedulerConfig();
    when(callExecutor.invoke(any(), any(), any())).thenReturn(CallResult.ok(new byte[0]));
  }

  private UpkeepScheduler scheduler() {
    return new UpkeepScheduler(
        repository, callExecutor, events, new ReentrancyGuard(), clock, config);
  }

  private void addSubscriptions(int count, Duration interval) {
    for (int i = 0; i < count; i++) {
      repository.append(
          new Subscription(
              repository.count() + 1,
              BENEFICIARY,
              TOKEN,
              BigInteger.valueOf(100),
              HOUR,
              interval,
              clock.instant()));
    }
  }

  private static List<Long> ids(long... values) {
    return Arrays.stream(values).boxed().collect(Collectors.toList());
  }

  @Nested
  @DisplayName("checkDue")
  class CheckDueTests {

    @Test
    @DisplayName("Nothing is due on an empty account")
    void testEmpty() {
      assertThat(scheduler().checkDue()).isEqualTo(DueBatch.empty());
    }

    @Test
    @DisplayName("Nothing is due before the initial delay elapses")
    void testNotYetDue() {
      addSubscriptions(3, HOUR);
      clock.advance(Duration.ofMinutes(59));

      assertThat(scheduler().checkDue().dueExists()).isFalse();
    }

    @Test
    @DisplayName("Due exactly at the boundary")
    void testBoundary() {
      addSubscriptions(1, HOUR);
      clock.advance(HOUR);

      assertThat(scheduler().checkDue()).isEqualTo(DueBatch.of(ids(1)));
    }

    @Test
    @DisplayName("Batch is capped and returned in ascending id order")
    void testCap() {
      addSubscriptions(11, HOUR);
      clock.advance(HOUR);
      UpkeepScheduler scheduler = scheduler();

      DueBatch first = scheduler.checkDue();
      assertThat(first.ids()).containsExactlyElementsOf(LongStream.rangeClosed(1, 10).boxed().toList());

      scheduler.executeDue(first.ids());

      assertThat(scheduler.checkDue().ids()).containsExactly(11L);
    }

    @Test
    @DisplayName("Cancelled records are never due")
    void testCancelledNeverDue() {
      addSubscriptions(2, HOUR);
      repository.findById(1).orElseThrow().cancel();
      clock.advance(Duration.ofDays(10));

      assertThat(scheduler().checkDue().ids()).containsExactly(2L);
    }

    @Test
    @DisplayName("Custom batch cap is honoured and a non-positive cap is rejected")
    void testCustomCap() {
      config.setBatchCap(2);
      addSubscriptions(5, HOUR);
      clock.advance(HOUR);

      assertThat(scheduler().checkDue().ids()).containsExactly(1L, 2L);

      config.setBatchCap(0);
      assertThatThrownBy(UpkeepSchedulerTest.this::scheduler)
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("executeDue")
  class ExecuteDueTests {

    @Test
    @DisplayName("Success transfers to the beneficiary, advances one interval and emits Executed")
    void testSuccess() {
      addSubscriptions(1, Duration.ofDays(30));
      clock.advance(HOUR);
      Subscription subscription = repository.findById(1).orElseThrow();
      Instant before = subscription.getNextExecuteAt();

      UpkeepReport report = scheduler().executeDue(ids(1));

      assertThat(report.executed()).containsExactly(1L);
      assertThat(subscription.getNextExecuteAt()).isEqualTo(before.plus(Duration.ofDays(30)));
      verify(callExecutor)
          .invoke(
              eq(TOKEN),
              eq(BigInteger.ZERO),
              eq(TransferCalldata.encode(BENEFICIARY, BigInteger.valueOf(100))));
      assertThat(events.events()).containsExactly(new SubscriptionExecuted(1, true));
    }

    @Test
    @DisplayName("Failure leaves the record due and emits Failed")
    void testFailure() {
      when(callExecutor.invoke(any(), any(), any())).thenReturn(CallResult.failure(new byte[0]));
      addSubscriptions(1, HOUR);
      clock.advance(HOUR);
      UpkeepScheduler scheduler = scheduler();

      UpkeepReport report = scheduler.executeDue(ids(1));

      assertThat(report.failed()).containsExactly(1L);
      assertThat(events.events()).containsExactly(new SubscriptionFailed(1, false));
      assertThat(scheduler.checkDue().ids()).containsExactly(1L);
    }

    @Test
    @DisplayName("A throwing token counts as a failure and does not abort the batch")
    void testThrowingToken() {
      addSubscriptions(2, HOUR);
      clock.advance(HOUR);
      when(callExecutor.invoke(any(), any(), any()))
          .thenThrow(new IllegalStateException("token exploded"))
          .thenReturn(CallResult.ok(null));

      UpkeepReport report = scheduler().executeDue(ids(1, 2));

      assertThat(report.failed()).containsExactly(1L);
      assertThat(report.executed()).containsExactly(2L);
    }

    @Test
    @DisplayName("An amount too large to encode fails its item and later ids still execute")
    void testOversizedAmount() {
      repository.append(
          new Subscription(
              1, BENEFICIARY, TOKEN, BigInteger.ONE.shiftLeft(256), HOUR, HOUR, clock.instant()));
      addSubscriptions(1, HOUR);
      clock.advance(HOUR);
      UpkeepScheduler scheduler = scheduler();

      UpkeepReport report = scheduler.executeDue(scheduler.checkDue().ids());

      assertThat(report.failed()).containsExactly(1L);
      assertThat(report.executed()).containsExactly(2L);
      verify(callExecutor, times(1)).invoke(any(), any(), any());
      assertThat(events.events())
          .containsExactly(new SubscriptionFailed(1, false), new SubscriptionExecuted(2, true));
    }

    @Test
    @DisplayName("A due time that cannot advance is never paid, on this poll or the next")
    void testUnadvanceableInterval() {
      repository.append(
          new Subscription(
              1,
              BENEFICIARY,
              TOKEN,
              BigInteger.TEN,
              HOUR,
              Duration.ofSeconds(Long.MAX_VALUE),
              clock.instant()));
      addSubscriptions(1, Duration.ofDays(1));
      clock.advance(HOUR);
      UpkeepScheduler scheduler = scheduler();

      UpkeepReport first = scheduler.executeDue(scheduler.checkDue().ids());
      UpkeepReport second = scheduler.executeDue(scheduler.checkDue().ids());

      assertThat(first.failed()).containsExactly(1L);
      assertThat(first.executed()).containsExactly(2L);
      assertThat(second.failed()).containsExactly(1L);
      assertThat(second.executed()).isEmpty();
      verify(callExecutor, never())
          .invoke(any(), any(), eq(TransferCalldata.encode(BENEFICIARY, BigInteger.TEN)));
      assertThat(events.events())
          .containsExactly(
              new SubscriptionFailed(1, false),
              new SubscriptionExecuted(2, true),
              new SubscriptionFailed(1, false));
    }

    @Test
    @DisplayName("A publisher that throws does not abort the batch")
    void testThrowingPublisher() {
      EventPublisher publisher = mock(EventPublisher.class);
      doThrow(new IllegalStateException("broker down"))
          .doNothing()
          .when(publisher)
          .publish(any());
      addSubscriptions(2, HOUR);
      clock.advance(HOUR);
      UpkeepScheduler scheduler =
          new UpkeepScheduler(
              repository, callExecutor, publisher, new ReentrancyGuard(), clock, config);

      UpkeepReport report = scheduler.executeDue(ids(1, 2));

      assertThat(report.executed()).containsExactly(1L, 2L);
      verify(publisher, times(2)).publish(any());
      assertThat(scheduler.checkDue().dueExists()).isFalse();
    }

    @Test
    @DisplayName("Mixed outcomes are reported per item")
    void testMixed() {
      addSubscriptions(3, HOUR);
      clock.advance(HOUR);
      when(callExecutor.invoke(any(), any(), any()))
          .thenReturn(CallResult.ok(null), CallResult.failure(null), CallResult.ok(null));

      UpkeepReport report = scheduler().executeDue(ids(1, 2, 3));

      assertThat(report.executed()).containsExactly(1L, 3L);
      assertThat(report.failed()).containsExactly(2L);
      assertThat(report.attempted()).isEqualTo(3);
      assertThat(events.events())
          .containsExactly(
              new SubscriptionExecuted(1, true),
              new SubscriptionFailed(2, false),
              new SubscriptionExecuted(3, true));
    }

    @Test
    @DisplayName("Unknown, cancelled, not-yet-due and repeated ids are skipped silently")
    void testSkips() {
      addSubscriptions(3, Duration.ofDays(1));
      repository.findById(2).orElseThrow().cancel();
      clock.advance(HOUR);
      repository.append(
          new Subscription(4, BENEFICIARY, TOKEN, BigInteger.ONE, HOUR, HOUR, clock.instant()));

      UpkeepReport report = scheduler().executeDue(Arrays.asList(1L, 1L, 2L, 4L, 99L, null));

      assertThat(report.executed()).containsExactly(1L);
      assertThat(report.skipped()).containsExactly(1L, 2L, 4L, 99L);
      verify(callExecutor, times(1)).invoke(any(), any(), any());
      assertThat(events.events()).containsExactly(new SubscriptionExecuted(1, true));
    }

    @Test
    @DisplayName("Replaying an executed batch does nothing until the next interval")
    void testReplay() {
      addSubscriptions(1, Duration.ofDays(1));
      clock.advance(HOUR);
      UpkeepScheduler scheduler = scheduler();
      scheduler.executeDue(ids(1));

      UpkeepReport replay = scheduler.executeDue(ids(1));

      assertThat(replay.attempted()).isZero();
      verify(callExecutor, times(1)).invoke(any(), any(), any());
    }

    @Test
    @DisplayName("An empty batch is a no-op")
    void testEmptyBatch() {
      UpkeepReport report = scheduler().executeDue(List.of());

      assertThat(report.attempted()).isZero();
      verifyNoInteractions(callExecutor);
    }
  }

  @Nested
  @DisplayName("Rotating scan start")
  class RotationTests {

    @Test
    @DisplayName("Permanently failing low ids do not starve higher ids")
    void testNoStarvation() {
      config.setBatchCap(2);
      config.setRotateScanStart(true);
      addSubscriptions(4, HOUR);
      clock.advance(HOUR);
      when(callExecutor.invoke(any(), any(), any())).thenReturn(CallResult.failure(null));
      UpkeepScheduler scheduler = scheduler();

      DueBatch first = scheduler.checkDue();
      scheduler.executeDue(first.ids());
      DueBatch second = scheduler.checkDue();
      scheduler.executeDue(second.ids());
      DueBatch third = scheduler.checkDue();

      assertThat(first.ids()).containsExactly(1L, 2L);
      assertThat(second.ids()).containsExactly(3L, 4L);
      assertThat(third.ids()).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Without rotation the scan always starts at id 1")
    void testFrontLoaded() {
      config.setBatchCap(2);
      addSubscriptions(4, HOUR);
      clock.advance(HOUR);
      when(callExecutor.invoke(any(), any(), any())).thenReturn(CallResult.failure(null));
      UpkeepScheduler scheduler = scheduler();

      scheduler.executeDue(scheduler.checkDue().ids());

      assertThat(scheduler.checkDue().ids()).containsExactly(1L, 2L);
    }
  }
}
