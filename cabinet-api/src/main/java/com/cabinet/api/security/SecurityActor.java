package com.cabinet.api.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Who is acting on the current request.
 *
 * The JWT subject is the numeric cabinet user id. A token carrying role ADMIN acts as ADMIN,
 * anything else as USER; no authentication at all (Telegram callbacks, background work) is SYSTEM.
 */
public final class SecurityActor {

  private SecurityActor() {}

  public static ActorInfo current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      return new ActorInfo("SYSTEM", null);
    }
    Long userId = parseIdOrNull(jat.getToken().getSubject());
    boolean admin = false;
    for (GrantedAuthority a : jat.getAuthorities()) {
      if ("ROLE_ADMIN".equals(a.getAuthority())) admin = true;
    }
    return new ActorInfo(admin ? "ADMIN" : "USER", userId);
  }

  /** User id from a verified token; a token whose subject is not an id is rejected as a bad request. */
  public static Long userId(Jwt jwt) {
    Long id = jwt == null ? null : parseIdOrNull(jwt.getSubject());
    if (id == null) {
      throw new IllegalArgumentException("Token subject is not a user id");
    }
    return id;
  }

  private static Long parseIdOrNull(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return Long.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public record ActorInfo(String actorType, Long actorId) {}
}
