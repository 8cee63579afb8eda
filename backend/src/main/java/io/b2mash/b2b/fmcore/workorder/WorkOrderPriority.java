package io.b2mash.b2b.fmcore.workorder;

/** Work order priority, ordered from least to most urgent. */
public enum WorkOrderPriority {
  LOW(72),
  MEDIUM(24),
  HIGH(8),
  CRITICAL(4);

  private final int defaultSlaHours;

  WorkOrderPriority(int defaultSlaHours) {
    this.defaultSlaHours = defaultSlaHours;
  }

  /** Resolution window used when no override is configured. */
  public int defaultSlaHours() {
    return defaultSlaHours;
  }

  /** Returns the next more urgent priority, or null if already {@link #CRITICAL}. */
  public WorkOrderPriority next() {
    int ordinal = ordinal() + 1;
    return ordinal < values().length ? values()[ordinal] : null;
  }

  public boolean isAbove(WorkOrderPriority other) {
    return compareTo(other) > 0;
  }
}
