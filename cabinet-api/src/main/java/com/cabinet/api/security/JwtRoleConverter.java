package com.cabinet.api.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Locale;

/**
 * Maps JWT claim "role" ("USER", "ADMIN") to "ROLE_USER" / "ROLE_ADMIN". No claim means USER.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<SimpleGrantedAuthority> authorities = new ArrayList<>();
    String role = jwt.getClaimAsString("role");
    if (role != null && !role.isBlank()) {
      authorities.add(new SimpleGrantedAuthority("ROLE_" + role.trim().toUpperCase(Locale.ROOT)));
    } else {
      authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
    }
    return new JwtAuthenticationToken(jwt, authorities);
  }
}
