package io.b2mash.b2b.fmcore.multitenancy;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.actor.ActorRole;
import io.b2mash.b2b.fmcore.exception.ForbiddenException;
import io.b2mash.b2b.fmcore.exception.MissingOrganizationContextException;
import org.springframework.stereotype.Component;

/**
 * Resolves the tenant from the actor's org claim. Platform administrators ({@code SUPER_ADMIN}) run
 * in cross-tenant mode, optionally narrowed to the organization named by the request.
 */
@Component
public class ActorTenantResolver implements TenantResolver {

  @Override
  public TenantScope resolve(ActorContext actor) {
    if (actor.role() == ActorRole.SUPER_ADMIN) {
      return new TenantScope(actor.requestedTenantId(), true);
    }
    if (actor.tenantId() == null) {
      throw new MissingOrganizationContextException();
    }
    if (actor.requestedTenantId() != null && !actor.requestedTenantId().equals(actor.tenantId())) {
      throw new ForbiddenException(
          "Cross-tenant access denied",
          "Actor "
              + actor.actorId()
              + " does not belong to organization "
              + actor.requestedTenantId());
    }
    return TenantScope.of(actor.tenantId());
  }
}
