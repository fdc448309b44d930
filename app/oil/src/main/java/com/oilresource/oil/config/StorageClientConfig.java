package com.oilresource.oil.config;

import com.oilresource.common.retry.RetryExecutor;
import com.oilresource.common.retry.RetryPolicy;
import java.net.URI;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

// R2 は S3 互換 API なので endpoint を上書きした AWS SDK クライアントで扱う。
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageClientConfig {

  @Bean(destroyMethod = "close")
  S3Client s3Client(StorageProperties properties) {
    return S3Client.builder()
        .endpointOverride(URI.create(properties.endpointUrl()))
        .region(Region.of(properties.region()))
        .credentialsProvider(credentials(properties))
        .serviceConfiguration(pathStyle())
        .build();
  }

  @Bean(destroyMethod = "close")
  S3Presigner s3Presigner(StorageProperties properties) {
    return S3Presigner.builder()
        .endpointOverride(URI.create(properties.endpointUrl()))
        .region(Region.of(properties.region()))
        .credentialsProvider(credentials(properties))
        .serviceConfiguration(pathStyle())
        .build();
  }

  @Bean
  RetryExecutor storageRetryExecutor(StorageProperties properties) {
    final StorageProperties.Retry retry = properties.retry();
    return new RetryExecutor(
        new RetryPolicy(
            retry.maxAttempts(), retry.multiplier(), retry.minBackoff(), retry.maxBackoff()));
  }

  private static StaticCredentialsProvider credentials(StorageProperties properties) {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(properties.accessKeyId(), properties.secretAccessKey()));
  }

  private static S3Configuration pathStyle() {
    return S3Configuration.builder().pathStyleAccessEnabled(true).build();
  }
}
