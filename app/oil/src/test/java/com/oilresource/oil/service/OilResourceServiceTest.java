package com.oilresource.oil.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.oilresource.oil.api.request.OilResourceCreateRequest;
import com.oilresource.oil.api.request.OilResourceUpdateRequest;
import com.oilresource.oil.api.request.UploadUrlRequest;
import com.oilresource.oil.api.response.CursorPageResponse;
import com.oilresource.oil.api.response.OilResourceResponse;
import com.oilresource.oil.api.response.UploadUrlResponse;
import com.oilresource.oil.model.OilResourceRecord;
import com.oilresource.oil.model.OilType;
import com.oilresource.oil.repository.OilResourceRepository;
import com.oilresource.oil.storage.StorageClient;
import com.oilresource.oil.storage.StorageOperationException;
import com.oilresource.oil.storage.UploadUrl;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OilResourceServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final UUID ID_1 = UUID.fromString("00000000-0000-4000-8000-000000000001");
  private static final UUID ID_2 = UUID.fromString("00000000-0000-4000-8000-000000000002");
  private static final UUID ID_3 = UUID.fromString("00000000-0000-4000-8000-000000000003");

  @Mock private OilResourceRepository repository;
  @Mock private StorageClient storageClient;

  private OilResourceService service;

  @BeforeEach
  void setUp() {
    service = new OilResourceService(repository, storageClient, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createDefaultsTypeToPetrolAndStampsCreator() {
    when(repository.insert(any(OilResourceRecord.class))).thenAnswer(inv -> inv.getArgument(0));

    final OilResourceResponse response =
        service.createOil(
            new OilResourceCreateRequest(
                LocalDate.parse("2026-02-28"), new BigDecimal("1.5"), null, null),
            "user-123",
            "alice@example.com");

    final ArgumentCaptor<OilResourceRecord> captor =
        ArgumentCaptor.forClass(OilResourceRecord.class);
    verify(repository).insert(captor.capture());
    final OilResourceRecord inserted = captor.getValue();
    assertThat(inserted.id()).isNotNull();
    assertThat(inserted.type()).isEqualTo(OilType.PETROL);
    assertThat(inserted.userId()).isEqualTo("user-123");
    assertThat(inserted.email()).isEqualTo("alice@example.com");
    assertThat(inserted.createdAt()).isEqualTo(NOW);
    assertThat(inserted.updatedAt()).isEqualTo(NOW);
    assertThat(response.id()).isEqualTo(inserted.id());
  }

  @Test
  void getThrowsWhenMissing() {
    when(repository.findById(ID_1)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getOil(ID_1))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("Oil resource with ID " + ID_1 + " not found");
  }

  @Test
  void firstPageUsesDefaultSizeAndHasNoCurrentCursor() {
    when(repository.findPageAfter(null, OilResourceService.DEFAULT_PAGE_SIZE + 1))
        .thenReturn(List.of(record(ID_1, null)));

    final CursorPageResponse<OilResourceResponse> page = service.listOil(null, null);

    assertThat(page.items()).extracting(OilResourceResponse::id).containsExactly(ID_1);
    assertThat(page.currentPage()).isNull();
    assertThat(page.nextPage()).isNull();
    assertThat(page.size()).isEqualTo(OilResourceService.DEFAULT_PAGE_SIZE);
  }

  @Test
  void fullPageReturnsCursorThatResumesAfterLastItem() {
    when(repository.findPageAfter(null, 3))
        .thenReturn(List.of(record(ID_1, null), record(ID_2, null), record(ID_3, null)));

    final CursorPageResponse<OilResourceResponse> first = service.listOil(null, 2);

    assertThat(first.items()).extracting(OilResourceResponse::id).containsExactly(ID_1, ID_2);
    assertThat(first.nextPage()).isNotNull();

    when(repository.findPageAfter(ID_2, 3)).thenReturn(List.of(record(ID_3, null)));

    final CursorPageResponse<OilResourceResponse> second = service.listOil(first.nextPage(), 2);

    assertThat(second.items()).extracting(OilResourceResponse::id).containsExactly(ID_3);
    assertThat(second.currentPage()).isEqualTo(first.nextPage());
    assertThat(second.nextPage()).isNull();
  }

  @Test
  void malformedCursorIsRejected() {
    assertThatThrownBy(() -> service.listOil("%%not-base64%%", 10))
        .isInstanceOf(InvalidOilRequestException.class)
        .hasMessage("invalid cursor");
    verifyNoInteractions(repository);
  }

  @Test
  void sizeOutsideBoundsIsRejected() {
    assertThatThrownBy(() -> service.listOil(null, 0))
        .isInstanceOf(InvalidOilRequestException.class);
    assertThatThrownBy(() -> service.listOil(null, OilResourceService.MAX_PAGE_SIZE + 1))
        .isInstanceOf(InvalidOilRequestException.class);
    verify(repository, never()).findPageAfter(any(), anyInt());
  }

  @Test
  void updatePassesNullFieldsThroughAndStampsUpdatedAt() {
    when(repository.update(ID_1, null, new BigDecimal("2.25"), null, null, NOW))
        .thenReturn(Optional.of(record(ID_1, null)));

    final OilResourceResponse response =
        service.updateOil(
            ID_1, new OilResourceUpdateRequest(null, new BigDecimal("2.25"), null, null));

    assertThat(response.id()).isEqualTo(ID_1);
  }

  @Test
  void updateThrowsWhenMissing() {
    when(repository.update(eq(ID_1), any(), any(), any(), any(), eq(NOW)))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.updateOil(ID_1, new OilResourceUpdateRequest(null, null, null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void deleteRemovesStoredDocumentByUrlPath() {
    when(repository.findById(ID_1))
        .thenReturn(
            Optional.of(record(ID_1, "https://files.example.test/uploads/report-1.pdf")));
    when(repository.deleteById(ID_1)).thenReturn(true);

    service.deleteOil(ID_1);

    verify(repository).deleteById(ID_1);
    verify(storageClient).deleteFile("uploads/report-1.pdf");
  }

  @Test
  void deleteWithoutDocumentSkipsStorage() {
    when(repository.findById(ID_1)).thenReturn(Optional.of(record(ID_1, null)));
    when(repository.deleteById(ID_1)).thenReturn(true);

    service.deleteOil(ID_1);

    verifyNoInteractions(storageClient);
  }

  @Test
  void deleteThrowsWhenMissing() {
    when(repository.findById(ID_1)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteOil(ID_1))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(repository, never()).deleteById(any());
  }

  @Test
  void storageKeyStripsHostAndLeadingSlashes() {
    assertThat(OilResourceService.storageKeyOf("https://cdn.example.test//uploads/a/b.pdf"))
        .isEqualTo("uploads/a/b.pdf");
    assertThatThrownBy(() -> OilResourceService.storageKeyOf("http://bad host/x"))
        .isInstanceOf(StorageOperationException.class);
  }

  @Test
  void uploadUrlTreatsMissingKeyAsBlank() {
    when(storageClient.getUploadUrl(eq(""), isNull()))
        .thenReturn(
            new UploadUrl(
                "https://signed.example.test/uploads/generated",
                "PUT",
                "uploads/generated",
                null,
                20,
                "https://files.example.test/uploads/generated"));

    final UploadUrlResponse response = service.generateUploadUrl(new UploadUrlRequest(null, null));

    assertThat(response.key()).isEqualTo("uploads/generated");
    assertThat(response.expiresIn()).isEqualTo(20);
  }

  private static OilResourceRecord record(UUID id, String documentUrl) {
    return new OilResourceRecord(
        id,
        LocalDate.parse("2026-02-28"),
        new BigDecimal("1.5000"),
        OilType.DIESEL,
        documentUrl,
        "user-123",
        "alice@example.com",
        NOW,
        NOW);
  }
}
