package com.oilresource.oil.service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

/** ページ末尾の id を URL セーフな不透明トークンへ変換する。 */
final class CursorCodec {

  private CursorCodec() {}

  static String encode(UUID lastId) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(lastId.toString().getBytes(StandardCharsets.UTF_8));
  }

  static UUID decode(String cursor) {
    try {
      final byte[] decoded = Base64.getUrlDecoder().decode(cursor);
      return UUID.fromString(new String(decoded, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      throw new InvalidOilRequestException("invalid cursor", ex);
    }
  }
}
