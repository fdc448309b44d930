/*
 * どこで: Oil API
 * 何を: 価格記録の CRUD と添付文書アップロード URL 発行エンドポイントを公開する
 * なぜ: 参照は ROLE_USER、変更は ROLE_ADMIN というロール要件をエンドポイント単位で課すため
 */
package com.oilresource.oil.api;

import com.oilresource.oil.api.request.OilResourceCreateRequest;
import com.oilresource.oil.api.request.OilResourceUpdateRequest;
import com.oilresource.oil.api.request.UploadUrlRequest;
import com.oilresource.oil.api.response.CursorPageResponse;
import com.oilresource.oil.api.response.OilResourceResponse;
import com.oilresource.oil.api.response.UploadUrlResponse;
import com.oilresource.oil.auth.AccessTokenClaims;
import com.oilresource.oil.auth.RoleAuthorizer;
import com.oilresource.oil.service.OilResourceService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/oil")
@RequiredArgsConstructor
public class OilResourceController {

  static final String ROLE_ADMIN = "ROLE_ADMIN";
  static final String ROLE_USER = "ROLE_USER";

  private final OilResourceService oilResourceService;
  private final RoleAuthorizer roleAuthorizer;

  @PostMapping
  public ResponseEntity<OilResourceResponse> createOil(
      @AuthenticationPrincipal AccessTokenClaims claims,
      @Valid @RequestBody OilResourceCreateRequest request) {
    roleAuthorizer.requireRole(claims, ROLE_ADMIN);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(oilResourceService.createOil(request, claims.subject(), claims.email()));
  }

  @GetMapping
  public ResponseEntity<CursorPageResponse<OilResourceResponse>> listOil(
      @AuthenticationPrincipal AccessTokenClaims claims,
      @RequestParam(name = "cursor", required = false) String cursor,
      @RequestParam(name = "size", required = false) Integer size) {
    roleAuthorizer.requireRole(claims, ROLE_USER);
    return ResponseEntity.ok(oilResourceService.listOil(cursor, size));
  }

  @GetMapping("/{oilId}")
  public ResponseEntity<OilResourceResponse> getOil(
      @AuthenticationPrincipal AccessTokenClaims claims, @PathVariable("oilId") UUID oilId) {
    roleAuthorizer.requireRole(claims, ROLE_USER);
    return ResponseEntity.ok(oilResourceService.getOil(oilId));
  }

  @PutMapping("/{oilId}")
  public ResponseEntity<OilResourceResponse> updateOil(
      @AuthenticationPrincipal AccessTokenClaims claims,
      @PathVariable("oilId") UUID oilId,
      @Valid @RequestBody OilResourceUpdateRequest request) {
    roleAuthorizer.requireRole(claims, ROLE_ADMIN);
    return ResponseEntity.ok(oilResourceService.updateOil(oilId, request));
  }

  @DeleteMapping("/{oilId}")
  public ResponseEntity<Void> deleteOil(
      @AuthenticationPrincipal AccessTokenClaims claims, @PathVariable("oilId") UUID oilId) {
    roleAuthorizer.requireRole(claims, ROLE_ADMIN);
    oilResourceService.deleteOil(oilId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/upload-url")
  public ResponseEntity<UploadUrlResponse> generateUploadUrl(
      @AuthenticationPrincipal AccessTokenClaims claims,
      @RequestBody UploadUrlRequest request) {
    roleAuthorizer.requireRole(claims, ROLE_ADMIN);
    return ResponseEntity.ok(oilResourceService.generateUploadUrl(request));
  }
}
