package com.oilresource.oil.auth;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** 検証済みアクセストークンを SecurityContext に載せるための Authentication。principal は claims。 */
public class AccessTokenAuthentication extends AbstractAuthenticationToken {

  private final transient AccessTokenClaims claims;

  public AccessTokenAuthentication(AccessTokenClaims claims) {
    super(claims.roles().stream().map(SimpleGrantedAuthority::new).toList());
    this.claims = claims;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return "N/A";
  }

  @Override
  public AccessTokenClaims getPrincipal() {
    return claims;
  }

  @Override
  public String getName() {
    return claims.subject();
  }
}
