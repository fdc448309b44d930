/*
 * どこで: Oil API サービス層
 * 何を: 認証失敗とストレージ連携失敗を理由別に数える
 * なぜ: トークン期限切れの急増や JWKS 取得障害を Prometheus から観測できるようにするため
 */
package com.oilresource.oil.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class OilApiMetrics {

  private static final String METRIC_AUTH_FAILURE_TOTAL = "oil.auth.failure.total";
  private static final String METRIC_STORAGE_ERROR_TOTAL = "oil.storage.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> authFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> storageErrorCounters = new ConcurrentHashMap<>();

  public OilApiMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordAuthFailure(String reason) {
    authFailureCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_AUTH_FAILURE_TOTAL)
                    .description("Oil API authentication and authorization failures by reason")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStorageError(String code) {
    storageErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_STORAGE_ERROR_TOTAL)
                    .description("Oil API object storage failures")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}
