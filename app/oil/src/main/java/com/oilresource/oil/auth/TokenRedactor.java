package com.oilresource.oil.auth;

// ログ出力用。トークン本体は先頭 10 文字までしか残さない。
public final class TokenRedactor {

  private static final int VISIBLE_PREFIX_LENGTH = 10;
  private static final int JWS_COMPACT_PARTS = 3;

  private TokenRedactor() {}

  public static String redact(String token) {
    if (token == null || token.isEmpty()) {
      return "<empty token>";
    }
    if (token.split("\\.", -1).length != JWS_COMPACT_PARTS) {
      return "<invalid token format>";
    }
    return token.substring(0, Math.min(VISIBLE_PREFIX_LENGTH, token.length())) + "...";
  }
}
