/*
 * どこで: Oil API 認可
 * 何を: 認証済み claims が要求ロールを持つか判定し、持たなければ 403 系の例外を送出する
 * なぜ: エンドポイントごとのロール要件をハンドラ側で宣言的に書けるようにするため
 */
package com.oilresource.oil.auth;

import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RoleAuthorizer {

  private static final Logger logger = LoggerFactory.getLogger(RoleAuthorizer.class);

  public AccessTokenClaims requireRole(AccessTokenClaims claims, String role) {
    if (!claims.hasRole(role)) {
      logger.info("access denied subject={} required={}", claims.subject(), role);
      throw new AuthException(AuthException.Reason.ACCESS_DENIED);
    }
    return claims;
  }

  public AccessTokenClaims requireAnyRole(AccessTokenClaims claims, Collection<String> roles) {
    if (!claims.hasAnyRole(roles)) {
      logger.info("access denied subject={} requiredAnyOf={}", claims.subject(), roles);
      throw new AuthException(AuthException.Reason.ACCESS_DENIED);
    }
    return claims;
  }
}
