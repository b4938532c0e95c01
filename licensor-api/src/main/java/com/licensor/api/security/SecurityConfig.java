package com.licensor.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security configuration for the licensing API.
 *
 * - Stateless, no sessions
 * - License endpoints are public: the license key is the credential
 * - Operator endpoints need an HS256 operator token with role ADMIN
 */
@Configuration
public class SecurityConfig {

    /**
     * Public endpoints (no resource server):
     * - health and error
     * - client license operations
     * - operator login
     */
    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(
                "/api/v1/health",
                "/error",
                "/api/v1/licenses/**",
                "/api/v1/operator/login"
            )
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/api/v1/health", "/error").permitAll()
                .requestMatchers(HttpMethod.POST,
                    "/api/v1/licenses/activate",
                    "/api/v1/licenses/validate",
                    "/api/v1/licenses/deactivate",
                    "/api/v1/licenses/check-feature",
                    "/api/v1/licenses/verify-token",
                    "/api/v1/operator/login"
                ).permitAll()
                .anyRequest().denyAll() // fail-closed
            )
            .build();
    }

    /**
     * Everything else under /api/** needs an operator token.
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
