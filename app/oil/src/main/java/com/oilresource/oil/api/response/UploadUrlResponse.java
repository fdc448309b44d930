package com.oilresource.oil.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oilresource.oil.storage.UploadUrl;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス専用であり、防御的コピーを行わないため")
public record UploadUrlResponse(
    String url,
    String method,
    String key,
    Map<String, String> metadata,
    long expiresIn,
    String publicUrl) {

  public static UploadUrlResponse from(UploadUrl uploadUrl) {
    return new UploadUrlResponse(
        uploadUrl.url(),
        uploadUrl.method(),
        uploadUrl.key(),
        uploadUrl.metadata(),
        uploadUrl.expiresIn(),
        uploadUrl.publicUrl());
  }
}
