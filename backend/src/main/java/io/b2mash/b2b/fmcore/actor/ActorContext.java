package io.b2mash.b2b.fmcore.actor;

/**
 * The authenticated caller of a work order operation.
 *
 * @param actorId subject of the bearer token; for technicians this is also their assignee id
 * @param role facility-management role
 * @param tenantId organization the caller belongs to, may be null for platform administrators
 * @param requestedTenantId organization explicitly targeted by the request, or null
 */
public record ActorContext(
    String actorId, ActorRole role, String tenantId, String requestedTenantId) {

  public ActorContext(String actorId, ActorRole role, String tenantId) {
    this(actorId, role, tenantId, null);
  }
}
