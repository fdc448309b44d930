/*
 * どこで: Oil API のセキュリティフィルタ
 * 何を: /api/v1/oil 配下の Authorization ヘッダを検証し、claims を SecurityContext へ載せる
 * なぜ: ハンドラ到達前に未認証リクエストを止め、失敗を API 共通のエラー形式で返すため
 */
package com.oilresource.oil.config;

import com.oilresource.oil.auth.AccessTokenAuthentication;
import com.oilresource.oil.auth.AccessTokenClaims;
import com.oilresource.oil.auth.AuthException;
import com.oilresource.oil.auth.BearerTokenHeader;
import com.oilresource.oil.auth.JwtTokenValidator;
import com.oilresource.oil.auth.KeySetUnavailableException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  static final String PROTECTED_PATH_PREFIX = "/api/v1/oil";

  private final JwtTokenValidator tokenValidator;
  private final HandlerExceptionResolver handlerExceptionResolver;

  public BearerTokenAuthenticationFilter(
      JwtTokenValidator tokenValidator, HandlerExceptionResolver handlerExceptionResolver) {
    this.tokenValidator = tokenValidator;
    this.handlerExceptionResolver = handlerExceptionResolver;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String path = request.getRequestURI().substring(request.getContextPath().length());
    return !(path.equals(PROTECTED_PATH_PREFIX) || path.startsWith(PROTECTED_PATH_PREFIX + "/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final AccessTokenClaims claims;
    try {
      final String token = BearerTokenHeader.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
      claims = tokenValidator.validate(token);
    } catch (AuthException | KeySetUnavailableException ex) {
      logger.info(
          "bearer authentication rejected method={} path={} reason={}",
          request.getMethod(),
          request.getRequestURI(),
          ex instanceof AuthException authException
              ? authException.reason()
              : "KEY_SET_UNAVAILABLE");
      SecurityContextHolder.clearContext();
      handlerExceptionResolver.resolveException(request, response, null, ex);
      return;
    }
    final SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(new AccessTokenAuthentication(claims));
    SecurityContextHolder.setContext(context);
    logger.debug(
        "bearer authentication established subject={} roles={}",
        claims.subject(),
        claims.roles());
    filterChain.doFilter(request, response);
  }
}
