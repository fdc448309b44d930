/*
 * どこで: Oil API のエントリポイント
 * 何を: Spring Boot の起動と共通設定の取り込みを行う
 * なぜ: 共通 Clock と各設定クラスを 1 つのアプリケーションにまとめるため
 */
package com.oilresource.oil;

import com.oilresource.common.config.TimeConfig;
import com.oilresource.oil.config.OilApiProperties;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import(TimeConfig.class)
@RestController
public class OilApplication {

  private final OilApiProperties apiProperties;

  public OilApplication(OilApiProperties apiProperties) {
    this.apiProperties = apiProperties;
  }

  public static void main(String[] args) {
    SpringApplication.run(OilApplication.class, args);
  }

  @GetMapping("/")
  public Map<String, String> home() {
    return Map.of(
        "message",
        "Welcome to " + apiProperties.projectName() + ". Service status is at /api/v1/health.");
  }
}
