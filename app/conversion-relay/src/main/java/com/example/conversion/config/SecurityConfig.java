/*
 * どこで: Conversion Relay セキュリティ設定
 * 何を: 受信/cron を permitAll、/internal/** を ROLE_INTERNAL に制限するフィルタチェーンを組む
 * なぜ: 受信と cron は HMAC/Bearer を自前で検証し、独自の応答形式を返す必要があるため
 */
package com.example.conversion.config;

import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
public class SecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(InternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource(IngestProperties ingestProperties) {
    // オリジンの許否は RequestAuthenticator が判定するので、CORS は全オリジンに開く
    final CorsConfiguration ingest = new CorsConfiguration();
    ingest.setAllowedOriginPatterns(List.of("*"));
    ingest.setAllowedMethods(List.of("POST", "OPTIONS"));
    ingest.setAllowedHeaders(
        List.of(
            "Content-Type",
            ingestProperties.signatureHeader(),
            ingestProperties.timestampHeader(),
            ingestProperties.shopDomainHeader()));
    ingest.setMaxAge(86_400L);
    final UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/ingest", ingest);
    return source;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, InternalApiAuthenticationFilter internalApiAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .cors(Customizer.withDefaults())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/ingest",
                        "/api/cron",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .hasRole("INTERNAL")
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
