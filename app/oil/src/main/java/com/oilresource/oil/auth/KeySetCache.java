/*
 * どこで: Oil API 認証
 * 何を: JWKS をプロセス内で 1 つだけキャッシュし、TTL 経過後に取り直す
 * なぜ: リクエストごとの JWKS 取得を避けつつ、鍵ローテーションへの追従遅れを TTL 以内に抑えるため
 */
package com.oilresource.oil.auth;

import com.nimbusds.jose.jwk.JWKSet;
import com.oilresource.oil.config.JwksProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class KeySetCache {

  private static final Logger logger = LoggerFactory.getLogger(KeySetCache.class);

  private final KeySetFetcher fetcher;
  private final Clock clock;
  private final Duration ttl;
  // 更新は refreshLock の内側で丸ごと差し替える。読み取りはロックなし。
  private final ReentrantLock refreshLock = new ReentrantLock();
  private volatile KeySet current;
  // 取得試行ごとに増える。待機中に試行が終わったかどうかの判定に使う。
  private final AtomicLong attempts = new AtomicLong();
  private volatile KeySetUnavailableException lastFailure;

  @Autowired
  public KeySetCache(KeySetFetcher fetcher, Clock clock, JwksProperties properties) {
    this(fetcher, clock, properties.cacheTtl());
  }

  public KeySetCache(KeySetFetcher fetcher, Clock clock, Duration ttl) {
    this.fetcher = fetcher;
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * 新鮮なキャッシュがあればそれを返し、無ければ取得して差し替える。
   *
   * <p>同時に stale を観測した呼び出しは先行する取得の完了を待ち、その結果を共有する(single-flight)。
   * 取得に失敗した場合、既存のキャッシュがあればそれを返し続け、無ければ {@link
   * KeySetUnavailableException} を送出する。失敗時にキャッシュを消すことはない。
   */
  public KeySet getKeySet() {
    final long observedAttempts = attempts.get();
    final KeySet snapshot = current;
    if (snapshot != null && snapshot.isFreshAt(clock.instant(), ttl)) {
      return snapshot;
    }
    refreshLock.lock();
    try {
      final KeySet latest = current;
      if (latest != null && latest.isFreshAt(clock.instant(), ttl)) {
        // 待っている間に別スレッドが更新済み
        return latest;
      }
      if (attempts.get() != observedAttempts) {
        // 待っている間に終わった試行が失敗していれば、その結果をそのまま共有する
        return sharedFailureOutcome(latest);
      }
      return refresh(latest);
    } finally {
      refreshLock.unlock();
    }
  }

  public Optional<KeySet> peek() {
    return Optional.ofNullable(current);
  }

  private KeySet sharedFailureOutcome(KeySet previous) {
    if (previous != null) {
      return previous;
    }
    throw lastFailure;
  }

  private KeySet refresh(KeySet previous) {
    final JWKSet fetched;
    try {
      fetched = fetcher.fetch();
    } catch (KeySetUnavailableException ex) {
      lastFailure = ex;
      attempts.incrementAndGet();
      if (previous == null) {
        throw ex;
      }
      logger.warn(
          "jwks refresh failed; keeping stale key set fetchedAt={} keys={}",
          previous.fetchedAt(),
          previous.size());
      return previous;
    }
    final Instant fetchedAt = clock.instant();
    final KeySet refreshed = new KeySet(fetched, fetchedAt);
    current = refreshed;
    lastFailure = null;
    attempts.incrementAndGet();
    logger.debug("jwks cache replaced fetchedAt={} keys={}", fetchedAt, refreshed.size());
    return refreshed;
  }
}
