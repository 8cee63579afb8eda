package io.b2mash.b2b.fmcore.actor;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Facility-management roles as carried in the org role claim. */
public enum ActorRole {
  SUPER_ADMIN,
  ADMIN,
  PROPERTY_MANAGER,
  TEAM_MEMBER,
  CORPORATE_OWNER,
  TECHNICIAN,
  VENDOR,
  TENANT;

  // Legacy role names still issued by older identity providers
  private static final Map<String, ActorRole> ALIASES =
      Map.of(
          "MANAGER", TEAM_MEMBER,
          "DISPATCHER", TEAM_MEMBER,
          "FM_MANAGER", PROPERTY_MANAGER,
          "OWNER", CORPORATE_OWNER,
          "CUSTOMER", TENANT,
          "SUPERADMIN", SUPER_ADMIN);

  /**
   * Parses a role claim, case-insensitively, accepting both canonical names and legacy aliases.
   * Returns empty for blank or unknown values.
   */
  public static Optional<ActorRole> fromClaim(String claim) {
    if (claim == null || claim.isBlank()) {
      return Optional.empty();
    }
    String normalized = claim.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (ActorRole role : values()) {
      if (role.name().equals(normalized)) {
        return Optional.of(role);
      }
    }
    return Optional.ofNullable(ALIASES.get(normalized));
  }

  /** Roles that only ever act on work orders assigned to them. */
  public boolean isFieldRole() {
    return this == TECHNICIAN || this == VENDOR;
  }
}
