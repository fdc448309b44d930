package com.oilresource.oil.auth;

import com.nimbusds.jwt.JWTClaimsSet;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

// 検証済み JWT payload をアプリ内 AccessTokenClaims へ正規化する。必須項目の欠落・型違いは拒否する。
@Component
public class AccessTokenClaimsMapper {

  private static final String ROLES = "roles";

  public AccessTokenClaims map(JWTClaimsSet claimsSet) {
    try {
      return AccessTokenClaims.builder()
          .subject(requireText(claimsSet.getSubject(), "sub"))
          .expiresAt(requireEpochSeconds(claimsSet.getExpirationTime(), "exp"))
          .issuedAt(requireEpochSeconds(claimsSet.getIssueTime(), "iat"))
          .tokenId(requireText(claimsSet.getJWTID(), "jti"))
          .issuer(requireText(claimsSet.getIssuer(), "iss"))
          .tokenType(requireText(claimsSet.getStringClaim("typ"), "typ"))
          .authorizedParty(requireText(claimsSet.getStringClaim("azp"), "azp"))
          .sessionId(requireText(claimsSet.getStringClaim("sid"), "sid"))
          .realmRoles(requireRoles(claimsSet.getJSONObjectClaim("realm_access"), "realm_access"))
          .scope(requireString(claimsSet.getStringClaim("scope"), "scope"))
          .username(requireText(claimsSet.getStringClaim("preferred_username"), "preferred_username"))
          .email(requireText(claimsSet.getStringClaim("email"), "email"))
          .audience(claimsSet.getClaim("aud") == null ? null : claimsSet.getAudience())
          .resourceRoles(resolveResourceRoles(claimsSet.getJSONObjectClaim("resource_access")))
          .build();
    } catch (ParseException | ClassCastException ex) {
      throw new AuthException(AuthException.Reason.INVALID_CLAIMS, ex);
    }
  }

  private Map<String, List<String>> resolveResourceRoles(Map<String, Object> resourceAccess) {
    if (resourceAccess == null) {
      return null;
    }
    final Map<String, List<String>> resourceRoles = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : resourceAccess.entrySet()) {
      if (!(entry.getValue() instanceof Map<?, ?> access)) {
        throw invalid("resource_access." + entry.getKey());
      }
      resourceRoles.put(
          entry.getKey(), requireRoles(access, "resource_access." + entry.getKey()));
    }
    return resourceRoles;
  }

  private List<String> requireRoles(Map<?, ?> access, String claimName) {
    if (access == null) {
      throw invalid(claimName);
    }
    // roles キーが無いエントリはロールを持たないものとして扱う
    if (!access.containsKey(ROLES)) {
      return List.of();
    }
    if (!(access.get(ROLES) instanceof List<?> values)) {
      throw invalid(claimName + ".roles");
    }
    final List<String> roles = new ArrayList<>(values.size());
    for (Object value : values) {
      if (!(value instanceof String role)) {
        throw invalid(claimName + ".roles");
      }
      roles.add(role);
    }
    return roles;
  }

  private static String requireText(String value, String claimName) {
    if (value == null || value.isBlank()) {
      throw invalid(claimName);
    }
    return value;
  }

  // scope は空文字列を許容する
  private static String requireString(String value, String claimName) {
    if (value == null) {
      throw invalid(claimName);
    }
    return value;
  }

  private static long requireEpochSeconds(Date value, String claimName) {
    if (value == null) {
      throw invalid(claimName);
    }
    return value.toInstant().getEpochSecond();
  }

  private static AuthException invalid(String claimName) {
    return new AuthException(
        AuthException.Reason.INVALID_CLAIMS,
        new IllegalArgumentException(claimName + " is missing or malformed"));
  }
}
