package io.b2mash.b2b.fmcore.multitenancy;

import io.b2mash.b2b.fmcore.actor.ActorContext;

/** Derives the organization an actor's request runs against. */
public interface TenantResolver {

  /**
   * Resolves the tenant scope for the actor.
   *
   * @throws io.b2mash.b2b.fmcore.exception.MissingOrganizationContextException if no tenant can be
   *     derived
   * @throws io.b2mash.b2b.fmcore.exception.ForbiddenException if the actor targets an organization
   *     they do not belong to
   */
  TenantScope resolve(ActorContext actor);
}
