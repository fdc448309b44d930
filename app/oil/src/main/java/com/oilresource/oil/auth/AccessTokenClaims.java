/*
 * どこで: Oil API 認証
 * 何を: 署名検証済みアクセストークンの claims を型付きで保持する
 * なぜ: 下流のハンドラへ認証済み ID 情報を渡し、ロール判定を 1 箇所の集合演算に寄せるため
 */
package com.oilresource.oil.auth;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class AccessTokenClaims {

  private final String subject;
  private final long expiresAt;
  private final long issuedAt;
  private final String tokenId;
  private final String issuer;
  private final String tokenType;
  private final String authorizedParty;
  private final String sessionId;
  private final List<String> realmRoles;
  private final String scope;
  private final String username;
  private final String email;
  private final List<String> audience;
  private final Map<String, List<String>> resourceRoles;
  private final Set<String> roles;

  private AccessTokenClaims(Builder builder) {
    this.subject = Objects.requireNonNull(builder.subject, "subject");
    this.expiresAt = builder.expiresAt;
    this.issuedAt = builder.issuedAt;
    this.tokenId = Objects.requireNonNull(builder.tokenId, "tokenId");
    this.issuer = Objects.requireNonNull(builder.issuer, "issuer");
    this.tokenType = Objects.requireNonNull(builder.tokenType, "tokenType");
    this.authorizedParty = Objects.requireNonNull(builder.authorizedParty, "authorizedParty");
    this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId");
    this.realmRoles = List.copyOf(builder.realmRoles);
    this.scope = Objects.requireNonNull(builder.scope, "scope");
    this.username = Objects.requireNonNull(builder.username, "username");
    this.email = Objects.requireNonNull(builder.email, "email");
    this.audience = builder.audience == null ? null : List.copyOf(builder.audience);
    this.resourceRoles = copyResourceRoles(builder.resourceRoles);
    this.roles = unionRoles(this.realmRoles, this.resourceRoles);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String subject() {
    return subject;
  }

  /** exp (epoch seconds). */
  public long expiresAt() {
    return expiresAt;
  }

  /** iat (epoch seconds). */
  public long issuedAt() {
    return issuedAt;
  }

  public String tokenId() {
    return tokenId;
  }

  public String issuer() {
    return issuer;
  }

  public String tokenType() {
    return tokenType;
  }

  public String authorizedParty() {
    return authorizedParty;
  }

  public String sessionId() {
    return sessionId;
  }

  public List<String> realmRoles() {
    return realmRoles;
  }

  public String scope() {
    return scope;
  }

  public String username() {
    return username;
  }

  public String email() {
    return email;
  }

  /** aud が無いトークンでは null。 */
  public List<String> audience() {
    return audience;
  }

  /** resource_access が無いトークンでは null。 */
  public Map<String, List<String>> resourceRoles() {
    return resourceRoles;
  }

  /** realm ロールと全リソースのロールの和集合。 */
  public Set<String> roles() {
    return roles;
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  public boolean hasAnyRole(Collection<String> required) {
    return required.stream().anyMatch(roles::contains);
  }

  public boolean hasAllRoles(Collection<String> required) {
    return roles.containsAll(required);
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt <= now.getEpochSecond();
  }

  @Override
  public String toString() {
    return "AccessTokenClaims{subject="
        + subject
        + ", username="
        + username
        + ", expiresAt="
        + expiresAt
        + ", roles="
        + roles
        + "}";
  }

  private static Map<String, List<String>> copyResourceRoles(
      Map<String, List<String>> resourceRoles) {
    if (resourceRoles == null) {
      return null;
    }
    final Map<String, List<String>> copy = new LinkedHashMap<>();
    resourceRoles.forEach((resource, values) -> copy.put(resource, List.copyOf(values)));
    return Collections.unmodifiableMap(copy);
  }

  private static Set<String> unionRoles(
      List<String> realmRoles, Map<String, List<String>> resourceRoles) {
    final Set<String> union = new LinkedHashSet<>(realmRoles);
    if (resourceRoles != null) {
      resourceRoles.values().forEach(union::addAll);
    }
    return Collections.unmodifiableSet(union);
  }

  public static final class Builder {
    private String subject;
    private long expiresAt;
    private long issuedAt;
    private String tokenId;
    private String issuer;
    private String tokenType;
    private String authorizedParty;
    private String sessionId;
    private List<String> realmRoles = List.of();
    private String scope;
    private String username;
    private String email;
    private List<String> audience;
    private Map<String, List<String>> resourceRoles;

    private Builder() {}

    public Builder subject(String subject) {
      this.subject = subject;
      return this;
    }

    public Builder expiresAt(long expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public Builder issuedAt(long issuedAt) {
      this.issuedAt = issuedAt;
      return this;
    }

    public Builder tokenId(String tokenId) {
      this.tokenId = tokenId;
      return this;
    }

    public Builder issuer(String issuer) {
      this.issuer = issuer;
      return this;
    }

    public Builder tokenType(String tokenType) {
      this.tokenType = tokenType;
      return this;
    }

    public Builder authorizedParty(String authorizedParty) {
      this.authorizedParty = authorizedParty;
      return this;
    }

    public Builder sessionId(String sessionId) {
      this.sessionId = sessionId;
      return this;
    }

    public Builder realmRoles(List<String> realmRoles) {
      this.realmRoles = realmRoles == null ? List.of() : realmRoles;
      return this;
    }

    public Builder scope(String scope) {
      this.scope = scope;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder email(String email) {
      this.email = email;
      return this;
    }

    public Builder audience(List<String> audience) {
      this.audience = audience;
      return this;
    }

    public Builder resourceRoles(Map<String, List<String>> resourceRoles) {
      this.resourceRoles = resourceRoles;
      return this;
    }

    public AccessTokenClaims build() {
      return new AccessTokenClaims(this);
    }
  }
}
