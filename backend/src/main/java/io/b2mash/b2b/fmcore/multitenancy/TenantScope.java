package io.b2mash.b2b.fmcore.multitenancy;

/**
 * The organization an operation runs against.
 *
 * @param tenantId target organization; null only in cross-tenant mode without a target
 * @param crossTenant true when a platform administrator is acting outside their own organization
 */
public record TenantScope(String tenantId, boolean crossTenant) {

  public static TenantScope of(String tenantId) {
    return new TenantScope(tenantId, false);
  }

  /** Returns true if an entity owned by {@code ownerTenantId} is visible within this scope. */
  public boolean covers(String ownerTenantId) {
    if (crossTenant && tenantId == null) {
      return true;
    }
    return tenantId != null && tenantId.equals(ownerTenantId);
  }
}
