/*
 * どこで: Oil API Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: リクエスト単位のログへ request_id と利用者を載せるため (actuator のスクレイプは除外)
 */
package com.oilresource.oil.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).excludePathPatterns("/actuator/**");
  }
}
