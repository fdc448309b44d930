package com.oilresource.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  private static final int MAX_LENGTH = 128;
  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]+");

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 受け取った id がログへ安全に載せられる形ならそのまま、そうでなければ新しい id を返す。 */
  public static String acceptOrNew(String incoming) {
    if (incoming == null || incoming.isBlank() || incoming.length() > MAX_LENGTH) {
      return newTraceId();
    }
    return SAFE_ID.matcher(incoming).matches() ? incoming : newTraceId();
  }
}
