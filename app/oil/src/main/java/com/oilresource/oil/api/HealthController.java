package com.oilresource.oil.api;

import com.oilresource.oil.api.response.HealthResponse;
import com.oilresource.oil.config.OilApiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

// 認証不要の生存確認。DB や JWKS には触れない。
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

  private final OilApiProperties apiProperties;

  @GetMapping
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse("ok", apiProperties.version()));
  }
}
