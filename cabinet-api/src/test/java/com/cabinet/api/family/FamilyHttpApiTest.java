package com.cabinet.api.family;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class FamilyHttpApiTest {

  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;
  @Autowired JwtEncoder encoder;

  @Test
  void familyNeedsBearerToken() {
    var r = rest.getForEntity(url("/api/v1/family"), String.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
  }

  @Test
  void overviewForUserWithoutSubscriptionIsDisabled() {
    var r = rest.exchange(url("/api/v1/family"), HttpMethod.GET, new HttpEntity<>(headers(token("424242", null))), String.class);

    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(r.getBody()).contains("\"family_enabled\":false");
  }

  @Test
  void blankInviteeIsRejected() {
    HttpHeaders h = headers(token("424242", null));
    h.setContentType(MediaType.APPLICATION_JSON);

    var r = rest.exchange(url("/api/v1/family/invite"), HttpMethod.POST,
        new HttpEntity<>("{\"tg_username\":\"\"}", h), String.class);

    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void effectiveSubscriptionIsInactiveWithoutAnySubscription() {
    var r = rest.exchange(url("/api/v1/subscription/effective"), HttpMethod.GET,
        new HttpEntity<>(headers(token("424242", null))), String.class);

    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(r.getBody()).contains("\"active\":false");
  }

  @Test
  void adminEndpointsNeedAdminRole() {
    var asUser = rest.exchange(url("/api/v1/admin/personal-vpn/nodes"), HttpMethod.GET,
        new HttpEntity<>(headers(token("424242", "USER"))), String.class);
    assertThat(asUser.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  @Test
  void nonNumericSubjectIsBadRequest() {
    var r = rest.exchange(url("/api/v1/family"), HttpMethod.GET,
        new HttpEntity<>(headers(token("not-a-number", null))), String.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  private String url(String path) {
    return "http://localhost:" + port + path;
  }

  private String token(String subject, String role) {
    Instant now = Instant.now();
    JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
        .subject(subject)
        .issuedAt(now)
        .expiresAt(now.plus(Duration.ofMinutes(10)));
    if (role != null) claims.claim("role", role);
    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    return encoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
  }

  private static HttpHeaders headers(String token) {
    HttpHeaders h = new HttpHeaders();
    h.setBearerAuth(token);
    return h;
  }
}
