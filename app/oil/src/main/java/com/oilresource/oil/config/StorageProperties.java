/*
 * どこで: Oil API の設定バインド
 * 何を: S3 互換オブジェクトストレージ (Cloudflare R2) の接続情報と署名 URL/リトライ設定を保持する
 * なぜ: バケットや資格情報を環境変数から注入し、コードに埋め込まないため
 */
package com.oilresource.oil.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "oil.storage")
@Validated
public record StorageProperties(
    @NotBlank String accessKeyId,
    @NotBlank String secretAccessKey,
    @NotBlank String bucketName,
    String region,
    @NotBlank String endpointUrl,
    @NotBlank String publicUrl,
    Duration presignedUrlExpiration,
    @Valid Retry retry) {

  public StorageProperties {
    region = region == null || region.isBlank() ? "auto" : region;
    endpointUrl =
        endpointUrl == null || endpointUrl.isBlank()
            ? "https://r2.cloudflarestorage.com"
            : endpointUrl;
    presignedUrlExpiration =
        presignedUrlExpiration == null ? Duration.ofSeconds(20) : presignedUrlExpiration;
    retry = retry == null ? new Retry(0, null, null, null) : retry;
  }

  @AssertTrue(message = "oil.storage.presigned-url-expiration must be positive")
  public boolean isPresignedUrlExpirationPositive() {
    return !presignedUrlExpiration.isZero() && !presignedUrlExpiration.isNegative();
  }

  public record Retry(
      @Positive int maxAttempts, Duration multiplier, Duration minBackoff, Duration maxBackoff) {

    public Retry {
      maxAttempts = maxAttempts == 0 ? 3 : maxAttempts;
      multiplier = multiplier == null ? Duration.ofSeconds(1) : multiplier;
      minBackoff = minBackoff == null ? Duration.ofSeconds(2) : minBackoff;
      maxBackoff = maxBackoff == null ? Duration.ofSeconds(10) : maxBackoff;
    }
  }
}
