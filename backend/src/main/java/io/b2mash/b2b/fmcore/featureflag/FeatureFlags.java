package io.b2mash.b2b.fmcore.featureflag;

public final class FeatureFlags {

  /** Enables heuristic auto-assignment of technicians and vendors. */
  public static final String WORK_ORDER_AUTO_ASSIGN = "work_order_auto_assign";

  private FeatureFlags() {}
}
