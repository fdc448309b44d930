package com.oilresource.oil.auth;

/** {@code Authorization: Bearer <token>} ヘッダからトークン部分を取り出す。 */
public final class BearerTokenHeader {

  private static final String SCHEME = "bearer";

  private BearerTokenHeader() {}

  public static String extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      throw new AuthException(AuthException.Reason.MISSING_HEADER);
    }
    final String[] parts = authorizationHeader.trim().split("\\s+");
    if (parts.length != 2 || !SCHEME.equalsIgnoreCase(parts[0])) {
      throw new AuthException(AuthException.Reason.INVALID_HEADER_FORMAT);
    }
    return parts[1];
  }
}
