/*
 * どこで: Oil API 認証
 * 何を: Bearer トークンの署名を JWKS の公開鍵で検証し、claims を取り出して期限を判定する
 * なぜ: Identity provider 発行のトークンだけを受け付け、失敗理由を固定メッセージで返すため
 */
package com.oilresource.oil.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenValidator {

  private static final Logger logger = LoggerFactory.getLogger(JwtTokenValidator.class);
  private static final Set<JWSAlgorithm> ACCEPTED_ALGORITHMS =
      Set.of(JWSAlgorithm.RS256, JWSAlgorithm.RS384, JWSAlgorithm.RS512);

  private final KeySetCache keySetCache;
  private final AccessTokenClaimsMapper claimsMapper;
  private final Clock clock;

  public JwtTokenValidator(
      KeySetCache keySetCache, AccessTokenClaimsMapper claimsMapper, Clock clock) {
    this.keySetCache = keySetCache;
    this.claimsMapper = claimsMapper;
    this.clock = clock;
  }

  /**
   * トークンを検証して claims を返す。
   *
   * <p>JWKS を取得できない場合の {@link KeySetUnavailableException} はそのまま伝播する。それ以外の失敗はすべて
   * {@link AuthException} になり、メッセージにライブラリ由来の詳細は含まない。
   */
  public AccessTokenClaims validate(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthException(AuthException.Reason.MISSING_TOKEN);
    }
    final KeySet keySet = keySetCache.getKeySet();
    try {
      final SignedJWT jwt = parse(token);
      final RSAKey key = resolveKey(keySet, jwt.getHeader(), token);
      verifySignature(jwt, key, token);
      final AccessTokenClaims claims = claimsMapper.map(readClaims(jwt));
      final Instant now = clock.instant();
      if (claims.isExpiredAt(now)) {
        logger.debug(
            "token expired token={} exp={} now={}",
            TokenRedactor.redact(token),
            claims.expiresAt(),
            now.getEpochSecond());
        throw new AuthException(AuthException.Reason.EXPIRED_TOKEN);
      }
      return claims;
    } catch (AuthException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("unexpected token validation failure token={}", TokenRedactor.redact(token), ex);
      throw new AuthException(AuthException.Reason.VALIDATION_ERROR, ex);
    }
  }

  private SignedJWT parse(String token) {
    try {
      return SignedJWT.parse(token);
    } catch (ParseException ex) {
      logger.debug("token header unparsable token={}", TokenRedactor.redact(token));
      throw new AuthException(AuthException.Reason.KEY_NOT_FOUND, ex);
    }
  }

  private RSAKey resolveKey(KeySet keySet, JWSHeader header, String token) {
    final JWK jwk =
        keySet
            .findKey(header.getKeyID())
            .orElseThrow(
                () -> {
                  logger.debug(
                      "no matching signing key kid={} token={}",
                      header.getKeyID(),
                      TokenRedactor.redact(token));
                  return new AuthException(AuthException.Reason.KEY_NOT_FOUND);
                });
    if (!(jwk instanceof RSAKey rsaKey)) {
      logger.debug("signing key is not RSA kid={} kty={}", jwk.getKeyID(), jwk.getKeyType());
      throw new AuthException(AuthException.Reason.INVALID_TOKEN);
    }
    final JWSAlgorithm expected =
        jwk.getAlgorithm() == null
            ? JWSAlgorithm.RS256
            : JWSAlgorithm.parse(jwk.getAlgorithm().getName());
    if (!ACCEPTED_ALGORITHMS.contains(expected) || !expected.equals(header.getAlgorithm())) {
      logger.debug(
          "token algorithm rejected kid={} alg={} expected={}",
          jwk.getKeyID(),
          header.getAlgorithm(),
          expected);
      throw new AuthException(AuthException.Reason.INVALID_TOKEN);
    }
    return rsaKey;
  }

  private void verifySignature(SignedJWT jwt, RSAKey key, String token) {
    final boolean verified;
    try {
      verified = jwt.verify(new RSASSAVerifier(key));
    } catch (JOSEException ex) {
      logger.debug("token signature check failed token={}", TokenRedactor.redact(token));
      throw new AuthException(AuthException.Reason.INVALID_TOKEN, ex);
    }
    if (!verified) {
      logger.debug("token signature mismatch token={}", TokenRedactor.redact(token));
      throw new AuthException(AuthException.Reason.INVALID_TOKEN);
    }
  }

  private JWTClaimsSet readClaims(SignedJWT jwt) {
    try {
      return jwt.getJWTClaimsSet();
    } catch (ParseException ex) {
      throw new AuthException(AuthException.Reason.INVALID_CLAIMS, ex);
    }
  }
}
