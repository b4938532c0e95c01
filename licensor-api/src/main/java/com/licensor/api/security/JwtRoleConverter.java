package com.licensor.api.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;
import java.util.Locale;

/**
 * Maps the operator token claim "role" (e.g. "ADMIN") to "ROLE_ADMIN".
 * A token without a role gets no authorities.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    String role = jwt.getClaimAsString("role");
    if (role == null || role.isBlank()) {
      return new JwtAuthenticationToken(jwt, List.of(), jwt.getSubject());
    }
    var authority = new SimpleGrantedAuthority("ROLE_" + role.trim().toUpperCase(Locale.ROOT));
    return new JwtAuthenticationToken(jwt, List.of(authority), jwt.getSubject());
  }
}
