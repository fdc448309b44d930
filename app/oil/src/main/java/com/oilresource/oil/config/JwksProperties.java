/*
 * どこで: Oil API の設定バインド
 * 何を: JWKS エンドポイントとキャッシュ/通信の設定を保持する
 * なぜ: 鍵ローテーション頻度や Identity provider の所在を環境ごとに調整するため
 */
package com.oilresource.oil.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "oil.auth")
@Validated
public record JwksProperties(
    @NotBlank String jwksUri,
    Duration cacheTtl,
    Duration connectTimeout,
    Duration readTimeout,
    @Positive int fetchAttempts) {

  public JwksProperties {
    jwksUri =
        jwksUri == null || jwksUri.isBlank()
            ? "http://localhost:8080/realms/master/protocol/openid-connect/certs"
            : jwksUri;
    cacheTtl = cacheTtl == null ? Duration.ofHours(1) : cacheTtl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
    fetchAttempts = fetchAttempts == 0 ? 1 : fetchAttempts;
  }

  @AssertTrue(message = "oil.auth.cache-ttl must be positive")
  public boolean isCacheTtlPositive() {
    // Duration には @Positive が使えないため明示的に弾く。
    return !cacheTtl.isZero() && !cacheTtl.isNegative();
  }
}
