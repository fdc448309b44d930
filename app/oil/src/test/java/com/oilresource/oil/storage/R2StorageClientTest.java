package com.oilresource.oil.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.oilresource.common.retry.RetryExecutor;
import com.oilresource.common.retry.RetryPolicy;
import com.oilresource.oil.config.StorageProperties;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

class R2StorageClientTest {

  private static final String ENDPOINT = "http://localhost:9000";

  private final StorageProperties properties =
      new StorageProperties(
          "test-access-key",
          "test-secret-key",
          "test-bucket",
          "auto",
          ENDPOINT,
          "https://files.example.test/",
          null,
          null);
  private final List<Duration> sleeps = new ArrayList<>();
  private final S3Client s3Client = mock(S3Client.class);

  private S3Presigner presigner;
  private R2StorageClient client;

  @BeforeEach
  void setUp() {
    presigner =
        S3Presigner.builder()
            .endpointOverride(URI.create(ENDPOINT))
            .region(Region.of("auto"))
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create("test-access-key", "test-secret-key")))
            .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
            .build();
    client = new R2StorageClient(s3Client, presigner, properties, retryExecutor());
  }

  @AfterEach
  void tearDown() {
    presigner.close();
  }

  @Test
  void uploadUrlPrefixesKeyAndSignsForConfiguredExpiry() {
    final UploadUrl uploadUrl =
        client.getUploadUrl("report.pdf", Map.of("content-type", "application/pdf"));

    assertThat(uploadUrl.key()).isEqualTo("uploads/report.pdf");
    assertThat(uploadUrl.method()).isEqualTo("PUT");
    assertThat(uploadUrl.expiresIn()).isEqualTo(20L);
    assertThat(uploadUrl.metadata()).containsEntry("content-type", "application/pdf");
    assertThat(uploadUrl.publicUrl()).isEqualTo("https://files.example.test/uploads/report.pdf");
    assertThat(uploadUrl.url())
        .startsWith(ENDPOINT + "/test-bucket/uploads/report.pdf?")
        .contains("X-Amz-Expires=20");
    verifyNoInteractions(s3Client);
  }

  @Test
  void uploadUrlKeepsExistingPrefix() {
    final UploadUrl uploadUrl = client.getUploadUrl("uploads/a/b.csv", null);

    assertThat(uploadUrl.key()).isEqualTo("uploads/a/b.csv");
    assertThat(uploadUrl.metadata()).isNull();
  }

  @Test
  void blankKeyGetsGeneratedName() {
    final UploadUrl first = client.getUploadUrl("", Map.of());
    final UploadUrl second = client.getUploadUrl("  ", Map.of());

    assertThat(first.key()).startsWith("uploads/").hasSize("uploads/".length() + 36);
    assertThat(second.key()).isNotEqualTo(first.key());
  }

  @Test
  void presignFailureIsRetriedThenSurfaced() {
    final S3Presigner failing = mock(S3Presigner.class);
    when(failing.presignPutObject(any(PutObjectPresignRequest.class)))
        .thenThrow(SdkClientException.create("signer unavailable"));
    final R2StorageClient failingClient =
        new R2StorageClient(s3Client, failing, properties, retryExecutor());

    assertThatThrownBy(() -> failingClient.getUploadUrl("report.pdf", null))
        .isInstanceOf(StorageOperationException.class)
        .hasMessage("failed to generate upload url")
        .hasCauseInstanceOf(SdkClientException.class);
    verify(failing, times(3)).presignPutObject(any(PutObjectPresignRequest.class));
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
  }

  @Test
  void deleteRetriesTransientFailure() {
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(SdkClientException.create("connection reset"))
        .thenReturn(DeleteObjectResponse.builder().build());

    client.deleteFile("uploads/report.pdf");

    final ArgumentCaptor<DeleteObjectRequest> captor =
        ArgumentCaptor.forClass(DeleteObjectRequest.class);
    verify(s3Client, times(2)).deleteObject(captor.capture());
    assertThat(captor.getValue().bucket()).isEqualTo("test-bucket");
    assertThat(captor.getValue().key()).isEqualTo("uploads/report.pdf");
    assertThat(sleeps).hasSize(1);
  }

  @Test
  void deleteFailureAfterLastAttemptIsSurfaced() {
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(SdkClientException.create("connection reset"));

    assertThatThrownBy(() -> client.deleteFile("uploads/report.pdf"))
        .isInstanceOf(StorageOperationException.class)
        .hasMessage("failed to delete stored document");
    verify(s3Client, times(3)).deleteObject(any(DeleteObjectRequest.class));
  }

  private RetryExecutor retryExecutor() {
    final StorageProperties.Retry retry = properties.retry();
    return new RetryExecutor(
        new RetryPolicy(
            retry.maxAttempts(), retry.multiplier(), retry.minBackoff(), retry.maxBackoff()),
        sleeps::add,
        ex -> true);
  }
}
