package com.company.incidentrisk.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.security.web.SecurityFilterChain;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JWT resource server. Roles come from the "roles" claim:
 * TELEMETRY_WRITER ingests, ML_OPERATOR runs the pipeline, UI_READER reads.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session ->
                        session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .authorizeHttpRequests(authz -> authz
                        .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                        .requestMatchers("/actuator/prometheus").permitAll()
                        .requestMatchers("/v3/api-docs/**", "/swagger-ui/**").permitAll()

                        .requestMatchers(HttpMethod.POST, "/api/v1/incident-risk/telemetry").hasRole("TELEMETRY_WRITER")
                        .requestMatchers(HttpMethod.POST, "/api/v1/incident-risk/incidents")
                        .hasAnyRole("ML_OPERATOR", "TELEMETRY_WRITER")
                        .requestMatchers(HttpMethod.POST,
                                "/api/v1/incident-risk/etl/run",
                                "/api/v1/incident-risk/models/**",
                                "/api/v1/incident-risk/infer/batch",
                                "/api/v1/incident-risk/alerts/evaluate",
                                "/api/v1/incident-risk/backtest").hasRole("ML_OPERATOR")
                        .requestMatchers(HttpMethod.POST, "/api/v1/incident-risk/alerts/*/*")
                        .hasAnyRole("ML_OPERATOR", "UI_READER")
                        .requestMatchers(HttpMethod.GET, "/api/v1/incident-risk/**")
                        .hasAnyRole("ML_OPERATOR", "UI_READER")

                        .requestMatchers("/actuator/**").hasRole("ADMIN")
                        .anyRequest().authenticated()
                )

                .oauth2ResourceServer(oauth2 -> oauth2
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter()))
                );

        return http.build();
    }

    @Bean
    public JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setJwtGrantedAuthoritiesConverter(jwt -> {
            Collection<String> roles = jwt.getClaimAsStringList("roles");
            if (roles == null) {
                roles = List.of();
            }

            Stream<GrantedAuthority> roleAuthorities = roles.stream()
                    .map(role -> new SimpleGrantedAuthority("ROLE_" + role));

            JwtGrantedAuthoritiesConverter scopesConverter = new JwtGrantedAuthoritiesConverter();
            Collection<GrantedAuthority> scopeAuthorities = scopesConverter.convert(jwt);

            return Stream.concat(
                    roleAuthorities,
                    scopeAuthorities != null ? scopeAuthorities.stream() : Stream.empty()
            ).collect(Collectors.toList());
        });

        return converter;
    }
}
