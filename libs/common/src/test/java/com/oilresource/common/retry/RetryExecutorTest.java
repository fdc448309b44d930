package com.oilresource.common.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

  private static final RetryPolicy POLICY =
      new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(10));

  private final List<Duration> sleeps = new ArrayList<>();

  @Test
  void executeReturnsFirstSuccessWithoutSleeping() {
    final RetryExecutor executor = new RetryExecutor(POLICY, sleeps::add, ex -> true);

    final String result = executor.execute("op", () -> "ok");

    assertThat(result).isEqualTo("ok");
    assertThat(sleeps).isEmpty();
  }

  @Test
  void executeRetriesUntilSuccess() {
    final RetryExecutor executor = new RetryExecutor(POLICY, sleeps::add, ex -> true);
    final AtomicInteger calls = new AtomicInteger();

    final String result =
        executor.execute(
            "op",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
  }

  @Test
  void executeRethrowsLastFailureWhenAttemptsExhausted() {
    final RetryExecutor executor = new RetryExecutor(POLICY, sleeps::add, ex -> true);
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    "op",
                    () -> {
                      throw new IllegalStateException("failure-" + calls.incrementAndGet());
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("failure-3");
    assertThat(sleeps).hasSize(2);
  }

  @Test
  void executeDoesNotRetryNonRetryableFailure() {
    final RetryExecutor executor =
        new RetryExecutor(POLICY, sleeps::add, ex -> !(ex instanceof IllegalArgumentException));
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    "op",
                    () -> {
                      calls.incrementAndGet();
                      throw new IllegalArgumentException("bad input");
                    }))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(calls).hasValue(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void backoffGrowsExponentiallyAndIsClamped() {
    final RetryPolicy policy =
        new RetryPolicy(6, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(10));

    assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(4));
    assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofSeconds(8));
    assertThat(policy.backoffAfter(5)).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void policyRejectsZeroAttempts() {
    assertThatThrownBy(() -> new RetryPolicy(0, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
