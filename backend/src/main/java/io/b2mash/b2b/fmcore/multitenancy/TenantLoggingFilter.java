package io.b2mash.b2b.fmcore.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_TENANT_ID = "tenantId";
  private static final String MDC_ACTOR_ID = "actorId";
  private static final String MDC_ROLE = "role";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      var actor = RequestScopes.getActorOrNull();
      if (actor != null) {
        MDC.put(MDC_ACTOR_ID, actor.actorId());
        MDC.put(MDC_ROLE, actor.role().name());
        String tenantId =
            actor.requestedTenantId() != null ? actor.requestedTenantId() : actor.tenantId();
        if (tenantId != null) {
          MDC.put(MDC_TENANT_ID, tenantId);
        }
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_ACTOR_ID);
      MDC.remove(MDC_ROLE);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
