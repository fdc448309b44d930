package com.oilresource.oil.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(JwksProperties.class)
public class JwksClientConfig {

  @Bean
  RestClient jwksRestClient(RestClient.Builder builder, JwksProperties properties) {
    // JWKS 取得専用 RestClient。タイムアウトで取得の待ち時間を上限付きにする。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
