package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.featureflag.FeatureFlagSource;
import io.b2mash.b2b.fmcore.featureflag.FeatureFlags;
import org.springframework.stereotype.Component;

@Component
public class RoutingModeResolver {

  private final FeatureFlagSource featureFlagSource;
  private final HeuristicAssignmentStrategy heuristicStrategy;

  public RoutingModeResolver(
      FeatureFlagSource featureFlagSource, HeuristicAssignmentStrategy heuristicStrategy) {
    this.featureFlagSource = featureFlagSource;
    this.heuristicStrategy = heuristicStrategy;
  }

  /** Reads the auto-assign flag exactly once. */
  public RoutingMode resolve() {
    if (featureFlagSource.isEnabled(FeatureFlags.WORK_ORDER_AUTO_ASSIGN)) {
      return new RoutingMode.Heuristic(heuristicStrategy);
    }
    return new RoutingMode.Disabled();
  }
}
