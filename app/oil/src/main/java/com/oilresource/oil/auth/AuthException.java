/*
 * どこで: Oil API 認証/認可
 * 何を: トークン検証と権限判定の失敗理由を表す例外
 * なぜ: 401 と 403 を同じ型で扱いつつ、境界の外へは理由ごとの固定メッセージだけを出すため
 */
package com.oilresource.oil.auth;

public class AuthException extends RuntimeException {

  public enum Reason {
    MISSING_HEADER("Missing authorization header"),
    INVALID_HEADER_FORMAT("Invalid authorization header format"),
    MISSING_TOKEN("Missing authentication token"),
    KEY_NOT_FOUND("Invalid token signature: Key not found"),
    INVALID_TOKEN("Invalid authentication token"),
    INVALID_CLAIMS("Invalid authentication token"),
    EXPIRED_TOKEN("Token has expired"),
    VALIDATION_ERROR("Error validating authentication token"),
    ACCESS_DENIED("Access denied");

    private final String message;

    Reason(String message) {
      this.message = message;
    }

    public String message() {
      return message;
    }
  }

  private final Reason reason;

  public AuthException(Reason reason) {
    super(reason.message());
    this.reason = reason;
  }

  public AuthException(Reason reason, Throwable cause) {
    super(reason.message(), cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** 認証済みだがロール不足の場合のみ true。それ以外は未認証扱い。 */
  public boolean isForbidden() {
    return reason == Reason.ACCESS_DENIED;
  }
}
