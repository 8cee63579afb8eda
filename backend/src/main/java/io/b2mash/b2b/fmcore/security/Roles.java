package io.b2mash.b2b.fmcore.security;

/**
 * Spring Security authority naming for the org role claim. Work order permissions are decided by
 * the ability oracle; authorities only describe the caller to Spring Security.
 */
public final class Roles {

  public static final String AUTHORITY_PREFIX = "ROLE_";

  private Roles() {}
}
