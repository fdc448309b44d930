package com.oilresource.oil.auth;

/** Identity provider から JWKS を取得できなかったことを表す。トークン不正とは区別して 503 にする。 */
public class KeySetUnavailableException extends RuntimeException {

  public static final String MESSAGE = "Failed to fetch JWKS from authentication server";

  public KeySetUnavailableException(String detail) {
    super(MESSAGE + ": " + detail);
  }

  public KeySetUnavailableException(String detail, Throwable cause) {
    super(MESSAGE + ": " + detail, cause);
  }
}
