package com.cabinet.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless JWT security for the cabinet API.
 *
 * Tokens are minted by the cabinet login front-end; this service only verifies them.
 */
@Configuration
public class SecurityConfig {

    /**
     * Public endpoints: health and the error page.
     */
    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher("/api/v1/health", "/error")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .anyRequest().permitAll()
            )
            .build();
    }

    /**
     * Everything else under /api/** needs a bearer token; /api/v1/admin/** needs role ADMIN.
     */
    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher("/api/**")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/api/v1/admin/**").hasRole("ADMIN")
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth -> oauth
                .jwt(jwt -> jwt.jwtAuthenticationConverter(new JwtRoleConverter()))
            )
            .build();
    }
}
