package com.cabinet.api.security;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Configuration
public class JwtBeans {

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  /** Shares the HS256 key with the cabinet front-end that issues tokens. */
  @Bean
  @ConditionalOnMissingBean(name = "jwtEncoder")
  public JwtEncoder jwtEncoder(@Value("${cabinet.auth.jwt-secret:}") String secret) {
    var jwk = new OctetSequenceKey.Builder(normalizeSecret(secret))
        .algorithm(JWSAlgorithm.HS256)
        .keyID("cabinet-hs256")
        .build();

    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(@Value("${cabinet.auth.jwt-secret:}") String secret) {
    var key = new SecretKeySpec(normalizeSecret(secret), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }

  /**
   * Any configured secret string is hashed down to a fixed 32-byte HS256 key.
   * "${ENV:default}" does not fall back when ENV is set but blank, so blank is handled here.
   */
  private byte[] normalizeSecret(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev", "test"))) {
        s = "dev-secret-change-me";
      } else {
        throw new IllegalStateException("cabinet.auth.jwt-secret is empty. Set CABINET_JWT_SECRET.");
      }
    }

    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
