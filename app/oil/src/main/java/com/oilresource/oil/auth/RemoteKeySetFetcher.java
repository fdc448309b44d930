package com.oilresource.oil.auth;

import com.google.common.annotations.VisibleForTesting;
import com.nimbusds.jose.jwk.JWKSet;
import com.oilresource.common.retry.RetryExecutor;
import com.oilresource.common.retry.RetryPolicy;
import com.oilresource.oil.config.JwksProperties;
import java.text.ParseException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class RemoteKeySetFetcher implements KeySetFetcher {

  private static final Logger logger = LoggerFactory.getLogger(RemoteKeySetFetcher.class);

  private final RestClient jwksRestClient;
  private final JwksProperties properties;
  private final RetryExecutor retryExecutor;

  @Autowired
  public RemoteKeySetFetcher(RestClient jwksRestClient, JwksProperties properties) {
    this(
        jwksRestClient,
        properties,
        new RetryExecutor(
            new RetryPolicy(
                properties.fetchAttempts(),
                Duration.ofSeconds(1),
                Duration.ofSeconds(1),
                Duration.ofSeconds(5)),
            RemoteKeySetFetcher::isTransient));
  }

  @VisibleForTesting
  RemoteKeySetFetcher(
      RestClient jwksRestClient, JwksProperties properties, RetryExecutor retryExecutor) {
    this.jwksRestClient = jwksRestClient;
    this.properties = properties;
    this.retryExecutor = retryExecutor;
  }

  @Override
  public JWKSet fetch() {
    final String body = retryExecutor.execute("fetch_jwks", this::download);
    try {
      final JWKSet keySet = JWKSet.parse(body);
      logger.info("jwks fetched uri={} keys={}", properties.jwksUri(), keySet.getKeys().size());
      return keySet;
    } catch (ParseException ex) {
      logger.warn("jwks response parse failed uri={}", properties.jwksUri());
      throw new KeySetUnavailableException("malformed key set document", ex);
    }
  }

  private String download() {
    try {
      final String body =
          jwksRestClient.get().uri(properties.jwksUri()).retrieve().body(String.class);
      if (body == null || body.isBlank()) {
        logger.warn("jwks endpoint returned empty body uri={}", properties.jwksUri());
        throw new KeySetUnavailableException("empty key set document");
      }
      return body;
    } catch (RestClientResponseException ex) {
      logger.warn(
          "jwks fetch failed with http status={} uri={}",
          ex.getStatusCode().value(),
          properties.jwksUri());
      throw new KeySetUnavailableException("http status " + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      logger.warn("jwks fetch connection failed uri={}", properties.jwksUri(), ex);
      throw new KeySetUnavailableException("connection failed", ex);
    } catch (RestClientException ex) {
      logger.warn("jwks fetch failed uri={}", properties.jwksUri(), ex);
      throw new KeySetUnavailableException("request failed", ex);
    }
  }

  @VisibleForTesting
  static boolean isTransient(RuntimeException ex) {
    if (!(ex instanceof KeySetUnavailableException) || ex.getCause() == null) {
      return false;
    }
    if (ex.getCause() instanceof RestClientResponseException responseException) {
      return responseException.getStatusCode().is5xxServerError();
    }
    return ex.getCause() instanceof ResourceAccessException;
  }
}
