package io.b2mash.b2b.fmcore.multitenancy;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.actor.ActorRole;
import io.b2mash.b2b.fmcore.security.OrgClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the {@link ActorContext} for authenticated API requests. The optional {@code X-Tenant-Id}
 * header names the organization a request targets; whether that is permitted is decided later by
 * the {@link TenantResolver}.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  public static final String TENANT_HEADER = "X-Tenant-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      Optional<ActorRole> role = ActorRole.fromClaim(OrgClaims.extractOrgRole(jwt));

      if (role.isPresent()) {
        String requestedTenant = request.getHeader(TENANT_HEADER);
        var actor =
            new ActorContext(
                jwt.getSubject(),
                role.get(),
                OrgClaims.extractOrgId(jwt),
                requestedTenant != null && !requestedTenant.isBlank() ? requestedTenant : null);
        RequestScopes.bind(actor);
        try {
          filterChain.doFilter(request, response);
        } finally {
          RequestScopes.clear();
        }
        return;
      }
    }

    // No JWT or no recognised role: continue unbound, controllers reject with 401
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }
}
