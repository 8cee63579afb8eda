package io.b2mash.b2b.fmcore.assignment;

/**
 * How auto-assignment behaves for one call. Resolved once per call; new routing strategies become
 * new variants.
 */
public sealed interface RoutingMode permits RoutingMode.Disabled, RoutingMode.Heuristic {

  /** Name reported to callers, or null when routing is off. */
  String wireName();

  /** Auto-assignment is switched off; callers fall back to manual assignment. */
  record Disabled() implements RoutingMode {

    @Override
    public String wireName() {
      return null;
    }
  }

  /** Scored ranking over the tenant's candidate pool. */
  record Heuristic(AssignmentStrategy strategy) implements RoutingMode {

    @Override
    public String wireName() {
      return strategy.name();
    }
  }
}
