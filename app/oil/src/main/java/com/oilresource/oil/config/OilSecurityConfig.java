package com.oilresource.oil.config;

import com.oilresource.oil.auth.AuthException;
import com.oilresource.oil.auth.JwtTokenValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.servlet.HandlerExceptionResolver;

@Configuration
@EnableConfigurationProperties({CorsProperties.class, OilApiProperties.class})
public class OilSecurityConfig {

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(
      JwtTokenValidator jwtTokenValidator,
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver handlerExceptionResolver) {
    return new BearerTokenAuthenticationFilter(jwtTokenValidator, handlerExceptionResolver);
  }

  // SecurityFilterChain の内側だけで動かす。サーブレットコンテナへの二重登録を止める。
  @Bean
  FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenAuthenticationFilterRegistration(
      BearerTokenAuthenticationFilter filter) {
    final FilterRegistrationBean<BearerTokenAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource(CorsProperties properties) {
    final CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedOrigins(properties.allowedOrigins());
    configuration.addAllowedMethod(CorsConfiguration.ALL);
    configuration.addAllowedHeader(CorsConfiguration.ALL);
    configuration.setAllowCredentials(true);
    final UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", configuration);
    return source;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      CorsConfigurationSource corsConfigurationSource,
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver handlerExceptionResolver)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .cors(cors -> cors.configurationSource(corsConfigurationSource))
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(
            exceptions ->
                exceptions
                    .authenticationEntryPoint(
                        (request, response, ex) ->
                            handlerExceptionResolver.resolveException(
                                request,
                                response,
                                null,
                                new AuthException(AuthException.Reason.MISSING_HEADER, ex)))
                    .accessDeniedHandler(
                        (request, response, ex) ->
                            handlerExceptionResolver.resolveException(
                                request,
                                response,
                                null,
                                new AuthException(AuthException.Reason.ACCESS_DENIED, ex))))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/api/v1/health",
                        "/api/v1/health/**",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
