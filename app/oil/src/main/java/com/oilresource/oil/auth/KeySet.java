/*
 * どこで: Oil API 認証
 * 何を: Identity provider が公開する署名鍵集合と取得時刻を保持する
 * なぜ: 鍵集合を丸ごと差し替える単位として扱い、部分更新を起こさないため
 */
package com.oilresource.oil.auth;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;

public record KeySet(@NonNull JWKSet keys, @NonNull Instant fetchedAt) {

  public Optional<JWK> findKey(String keyId) {
    if (keyId == null || keyId.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(keys.getKeyByKeyId(keyId));
  }

  /** fetchedAt から ttl 未満なら新鮮。ちょうど ttl 経過した時点で stale とみなす。 */
  public boolean isFreshAt(Instant now, Duration ttl) {
    return now.isBefore(fetchedAt.plus(ttl));
  }

  public int size() {
    return keys.getKeys().size();
  }
}
