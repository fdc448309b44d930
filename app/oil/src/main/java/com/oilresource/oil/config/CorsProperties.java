/*
 * どこで: Oil API の設定バインド
 * 何を: ブラウザからの呼び出しを許可するオリジン一覧を保持する
 * なぜ: フロントエンドの配置先を環境ごとに切り替えるため
 */
package com.oilresource.oil.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "oil.cors")
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "コンストラクタで不変リストへ置き換えているため")
public record CorsProperties(List<String> allowedOrigins) {

  public CorsProperties {
    allowedOrigins =
        allowedOrigins == null || allowedOrigins.isEmpty()
            ? List.of("http://localhost:3000")
            : List.copyOf(allowedOrigins);
  }
}
