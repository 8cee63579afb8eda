package io.b2mash.b2b.fmcore.security;

import io.b2mash.b2b.fmcore.multitenancy.TenantFilter;
import io.b2mash.b2b.fmcore.multitenancy.TenantLoggingFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless bearer-token security for the work order API. Spring Security only authenticates; the
 * tenant filter then binds the actor and every operation asks the ability oracle.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final OrgRoleAuthenticationConverter jwtAuthConverter;
  private final TenantFilter tenantFilter;
  private final TenantLoggingFilter tenantLoggingFilter;

  public SecurityConfig(
      OrgRoleAuthenticationConverter jwtAuthConverter,
      TenantFilter tenantFilter,
      TenantLoggingFilter tenantLoggingFilter) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.tenantFilter = tenantFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 -> oauth2.jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter)))
        .addFilterAfter(tenantFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(tenantLoggingFilter, TenantFilter.class);

    return http.build();
  }
}
