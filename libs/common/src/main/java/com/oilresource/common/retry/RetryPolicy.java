/*
 * どこで: 共通リトライ
 * 何を: 試行回数と指数バックオフの上下限を保持する
 * なぜ: 外部 SDK 呼び出しごとに同じ待機計算を書かないため
 */
package com.oilresource.common.retry;

import java.time.Duration;

public record RetryPolicy(
    int maxAttempts, Duration multiplier, Duration minBackoff, Duration maxBackoff) {

  private static final double EXPONENT_BASE = 2.0;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    multiplier = multiplier == null ? Duration.ofSeconds(1) : multiplier;
    minBackoff = minBackoff == null ? Duration.ZERO : minBackoff;
    maxBackoff = maxBackoff == null ? Duration.ofSeconds(10) : maxBackoff;
    if (minBackoff.compareTo(maxBackoff) > 0) {
      throw new IllegalArgumentException("minBackoff must not exceed maxBackoff");
    }
  }

  public static RetryPolicy singleAttempt() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, Duration.ZERO);
  }

  /**
   * attempt 回目の失敗後に待つ時間。multiplier * 2^(attempt-1) を [minBackoff, maxBackoff] に収める。
   */
  public Duration backoffAfter(int attempt) {
    final double exp = multiplier.toMillis() * Math.pow(EXPONENT_BASE, attempt - 1);
    final double capped = Math.min(exp, maxBackoff.toMillis());
    final long millis = Math.max(minBackoff.toMillis(), (long) Math.ceil(capped));
    return Duration.ofMillis(millis);
  }
}
