/*
 * どこで: Oil API サービス層
 * 何を: 価格記録の作成/参照/更新/削除と、添付文書アップロード用 URL の発行を行う
 * なぜ: HTTP 層と永続化/ストレージを分離し、業務ルールをここへ集約するため
 */
package com.oilresource.oil.service;

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
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OilResourceService {

  private static final Logger logger = LoggerFactory.getLogger(OilResourceService.class);
  public static final int DEFAULT_PAGE_SIZE = 50;
  public static final int MAX_PAGE_SIZE = 100;

  private final OilResourceRepository repository;
  private final StorageClient storageClient;
  private final Clock clock;

  public OilResourceService(
      OilResourceRepository repository, StorageClient storageClient, Clock clock) {
    this.repository = repository;
    this.storageClient = storageClient;
    this.clock = clock;
  }

  public OilResourceResponse getOil(UUID id) {
    final OilResourceRecord record =
        repository.findById(id).orElseThrow(() -> new ResourceNotFoundException(id));
    logger.info("oil resource retrieved id={}", id);
    return OilResourceResponse.from(record);
  }

  public CursorPageResponse<OilResourceResponse> listOil(String cursor, Integer size) {
    final int pageSize = size == null ? DEFAULT_PAGE_SIZE : size;
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new InvalidOilRequestException("size must be between 1 and " + MAX_PAGE_SIZE);
    }
    final UUID afterId = cursor == null || cursor.isBlank() ? null : CursorCodec.decode(cursor);
    // 1 件多く読んで次ページの有無を判定する
    final List<OilResourceRecord> rows = repository.findPageAfter(afterId, pageSize + 1);
    final boolean hasNext = rows.size() > pageSize;
    final List<OilResourceRecord> page = hasNext ? rows.subList(0, pageSize) : rows;
    final String nextPage = hasNext ? CursorCodec.encode(page.get(page.size() - 1).id()) : null;
    logger.info("oil resources listed count={} hasNext={}", page.size(), hasNext);
    return new CursorPageResponse<>(
        page.stream().map(OilResourceResponse::from).toList(),
        afterId == null ? null : cursor,
        nextPage,
        pageSize);
  }

  public OilResourceResponse createOil(
      OilResourceCreateRequest request, String userId, String email) {
    final Instant now = clock.instant();
    final OilResourceRecord created =
        repository.insert(
            new OilResourceRecord(
                UUID.randomUUID(),
                request.date(),
                request.price(),
                request.type() == null ? OilType.PETROL : request.type(),
                request.oilDocumentUrl(),
                userId,
                email,
                now,
                now));
    logger.info(
        "oil resource created id={} date={} userId={}", created.id(), created.date(), userId);
    return OilResourceResponse.from(created);
  }

  public OilResourceResponse updateOil(UUID id, OilResourceUpdateRequest request) {
    final OilResourceRecord updated =
        repository
            .update(
                id,
                request.date(),
                request.price(),
                request.type(),
                request.oilDocumentUrl(),
                clock.instant())
            .orElseThrow(() -> new ResourceNotFoundException(id));
    logger.info("oil resource updated id={}", id);
    return OilResourceResponse.from(updated);
  }

  /** 行を削除し、添付文書があればストレージからも消す。ストレージ削除に失敗した場合は行の削除も戻す。 */
  @Transactional
  public void deleteOil(UUID id) {
    final OilResourceRecord existing =
        repository.findById(id).orElseThrow(() -> new ResourceNotFoundException(id));
    repository.deleteById(id);
    final String documentUrl = existing.oilDocumentUrl();
    if (documentUrl != null && !documentUrl.isBlank()) {
      final String key = storageKeyOf(documentUrl);
      storageClient.deleteFile(key);
      logger.info("associated document deleted id={} key={}", id, key);
    }
    logger.info("oil resource deleted id={}", id);
  }

  public UploadUrlResponse generateUploadUrl(UploadUrlRequest request) {
    final UploadUrl uploadUrl =
        storageClient.getUploadUrl(
            request.key() == null ? "" : request.key(), request.metadata());
    logger.info("upload url issued key={}", uploadUrl.key());
    return UploadUrlResponse.from(uploadUrl);
  }

  // 公開 URL のパス部分 (先頭スラッシュ除去) がオブジェクトキー
  static String storageKeyOf(String documentUrl) {
    final String path;
    try {
      path = URI.create(documentUrl).getPath();
    } catch (IllegalArgumentException ex) {
      throw new StorageOperationException("stored document url is malformed", ex);
    }
    if (path == null) {
      throw new StorageOperationException(
          "stored document url has no path", new IllegalArgumentException(documentUrl));
    }
    int start = 0;
    while (start < path.length() && path.charAt(start) == '/') {
      start++;
    }
    return path.substring(start);
  }
}
