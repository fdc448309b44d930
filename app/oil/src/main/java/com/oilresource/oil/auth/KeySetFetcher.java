package com.oilresource.oil.auth;

import com.nimbusds.jose.jwk.JWKSet;

@FunctionalInterface
public interface KeySetFetcher {

  /**
   * JWKS エンドポイントから鍵集合を 1 回取得する。
   *
   * @throws KeySetUnavailableException 通信失敗、非 2xx 応答、JSON 不正のいずれか
   */
  JWKSet fetch();
}
