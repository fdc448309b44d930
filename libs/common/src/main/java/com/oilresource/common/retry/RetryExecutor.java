/*
 * どこで: 共通リトライ
 * 何を: 失敗し得る単一操作を回数上限付きの指数バックオフで再試行する
 * なぜ: ストレージ SDK や JWKS 取得など業務ロジックと無関係な再試行を一箇所に閉じ込めるため
 */
package com.oilresource.common.retry;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final Predicate<RuntimeException> retryable;

  public RetryExecutor(RetryPolicy policy) {
    this(policy, Sleeper.threadSleep(), ex -> true);
  }

  public RetryExecutor(RetryPolicy policy, Predicate<RuntimeException> retryable) {
    this(policy, Sleeper.threadSleep(), retryable);
  }

  @VisibleForTesting
  public RetryExecutor(
      RetryPolicy policy, Sleeper sleeper, Predicate<RuntimeException> retryable) {
    this.policy = policy;
    this.sleeper = sleeper;
    this.retryable = retryable;
  }

  /**
   * 成功するか試行回数を使い切るまで operation を呼ぶ。
   *
   * <p>最後の失敗はそのまま再送出する。リトライ対象外の例外は即座に再送出する。
   */
  public <T> T execute(String operationName, Supplier<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.get();
      } catch (RuntimeException ex) {
        if (attempt >= policy.maxAttempts() || !retryable.test(ex)) {
          throw ex;
        }
        final Duration backoff = policy.backoffAfter(attempt);
        attempt++;
        logger.warn(
            "retrying {} (attempt {}) after {}ms: {}",
            operationName,
            attempt,
            backoff.toMillis(),
            ex.getClass().getSimpleName());
        pause(backoff, ex);
      }
    }
  }

  public void run(String operationName, Runnable operation) {
    execute(
        operationName,
        () -> {
          operation.run();
          return null;
        });
  }

  public RetryPolicy policy() {
    return policy;
  }

  private void pause(Duration backoff, RuntimeException lastFailure) {
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      lastFailure.addSuppressed(interrupted);
      throw lastFailure;
    }
  }
}
