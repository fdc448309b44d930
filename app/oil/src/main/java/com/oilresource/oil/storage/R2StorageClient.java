/*
 * どこで: Oil API ストレージ連携
 * 何を: Cloudflare R2 (S3 互換) へのアップロード用署名 URL 発行とオブジェクト削除を行う
 * なぜ: ファイル本体を API サーバー経由させず、クライアントから直接ストレージへ送らせるため
 */
package com.oilresource.oil.storage;

import com.oilresource.common.retry.RetryExecutor;
import com.oilresource.oil.config.StorageProperties;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

@Component
public class R2StorageClient implements StorageClient {

  private static final Logger logger = LoggerFactory.getLogger(R2StorageClient.class);
  private static final String UPLOAD_PREFIX = "uploads/";
  private static final String CONTENT_TYPE_KEY = "content-type";
  private static final String UPLOAD_METHOD = "PUT";

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final StorageProperties properties;
  private final RetryExecutor retryExecutor;

  public R2StorageClient(
      S3Client s3Client,
      S3Presigner s3Presigner,
      StorageProperties properties,
      @Qualifier("storageRetryExecutor") RetryExecutor retryExecutor) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.properties = properties;
    this.retryExecutor = retryExecutor;
  }

  @Override
  public UploadUrl getUploadUrl(String key, Map<String, String> metadata) {
    final String objectKey = resolveKey(key);
    final PutObjectRequest.Builder putObject =
        PutObjectRequest.builder().bucket(properties.bucketName()).key(objectKey);
    if (metadata != null && !metadata.isEmpty()) {
      if (metadata.containsKey(CONTENT_TYPE_KEY)) {
        putObject.contentType(metadata.get(CONTENT_TYPE_KEY));
      }
      putObject.metadata(metadata);
    }
    final PutObjectPresignRequest presignRequest =
        PutObjectPresignRequest.builder()
            .signatureDuration(properties.presignedUrlExpiration())
            .putObjectRequest(putObject.build())
            .build();
    final PresignedPutObjectRequest presigned;
    try {
      presigned =
          retryExecutor.execute(
              "get_upload_url", () -> s3Presigner.presignPutObject(presignRequest));
    } catch (SdkException ex) {
      logger.error("presigned upload url generation failed key={}", objectKey, ex);
      throw new StorageOperationException("failed to generate upload url", ex);
    }
    logger.info("presigned upload url generated key={}", objectKey);
    return new UploadUrl(
        presigned.url().toString(),
        UPLOAD_METHOD,
        objectKey,
        metadata,
        properties.presignedUrlExpiration().toSeconds(),
        publicUrlOf(objectKey));
  }

  @Override
  public void deleteFile(String key) {
    final DeleteObjectRequest request =
        DeleteObjectRequest.builder().bucket(properties.bucketName()).key(key).build();
    try {
      retryExecutor.run("delete_file", () -> s3Client.deleteObject(request));
    } catch (SdkException ex) {
      logger.error("object delete failed key={}", key, ex);
      throw new StorageOperationException("failed to delete stored document", ex);
    }
    logger.info("object deleted key={}", key);
  }

  private String resolveKey(String key) {
    if (key == null || key.isBlank()) {
      return UPLOAD_PREFIX + UUID.randomUUID();
    }
    return key.startsWith(UPLOAD_PREFIX) ? key : UPLOAD_PREFIX + key;
  }

  private String publicUrlOf(String objectKey) {
    final String base = properties.publicUrl();
    return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/" + objectKey;
  }
}
