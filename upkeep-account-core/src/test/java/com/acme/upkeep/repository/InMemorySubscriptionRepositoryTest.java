package com.acme.upkeep.repository;

import static org.assertj.core.api.Assertions.*;

import com.acme.upkeep.domain.Subscription;
import com.acme.upkeep.support.TestAddresses;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemorySubscriptionRepositoryTest {

  private InMemorySubscriptionRepository repository;

  @BeforeEach
  void setUp() {
    repository = new InMemorySubscriptionRepository();
  }

  private Subscription subscription(long id) {
    return new Subscription(
        id,
        TestAddresses.BENEFICIARY,
        TestAddresses.TOKEN,
        BigInteger.TEN,
        Duration.ofHours(1),
        Duration.ofHours(1),
        Instant.EPOCH);
  }

  @Test
  @DisplayName("Should store records densely by id")
  void testAppendAndFind() {
    repository.append(subscription(1));
    repository.append(subscription(2));

    assertThat(repository.count()).isEqualTo(2);
    assertThat(repository.findById(2)).get().extracting(Subscription::getId).isEqualTo(2L);
    assertThat(repository.findAll()).extracting(Subscription::getId).containsExactly(1L, 2L);
  }

  @Test
  @DisplayName("Should reject ids that would leave a gap or overwrite")
  void testRejectsOutOfSequence() {
    repository.append(subscription(1));

    assertThatThrownBy(() -> repository.append(subscription(3)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Expected subscription id 2");
    assertThatThrownBy(() -> repository.append(subscription(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(repository.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should return empty for ids outside the arena")
  void testOutOfRange() {
    repository.append(subscription(1));

    assertThat(repository.findById(0)).isEmpty();
    assertThat(repository.findById(-1)).isEmpty();
    assertThat(repository.findById(2)).isEmpty();
  }

  @Test
  @DisplayName("Should keep cancelled records")
  void testTombstone() {
    repository.append(subscription(1));
    repository.findById(1).orElseThrow().cancel();

    assertThat(repository.count()).isEqualTo(1);
    assertThat(repository.findById(1)).get().extracting(Subscription::isActive).isEqualTo(false);
  }
}
