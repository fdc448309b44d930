package com.oilresource.oil.storage;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "metadata は呼び出し元から受け取った値をそのまま返す値オブジェクトのため")
public record UploadUrl(
    String url,
    String method,
    String key,
    Map<String, String> metadata,
    long expiresIn,
    String publicUrl) {}
