package io.b2mash.b2b.fmcore.workorder;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Authorization-relevant actions on a work order, identified on the wire by snake_case names. */
public enum WorkOrderAction {
  START_ASSESSMENT("start_assessment"),
  SUBMIT_ESTIMATE("submit_estimate"),
  APPROVE("approve"),
  START_WORK("start_work"),
  COMPLETE_WORK("complete_work"),
  PUT_ON_HOLD("put_on_hold"),
  RESUME("resume"),
  CANCEL("cancel"),
  ATTACH_MEDIA("attach_media"),
  AUTO_ASSIGN("auto_assign"),
  ASSIGN("assign"),
  ESCALATE("escalate"),
  VIEW("view"),
  VIEW_STATS("view_stats");

  private final String wireName;

  WorkOrderAction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Returns the action bound to the edge {@code from -> to}, or empty when no edge of the lifecycle
   * graph could ever lead there (for example back to {@code REPORTED} from an active state).
   */
  public static Optional<WorkOrderAction> forTransition(
      WorkOrderStatus from, WorkOrderStatus to) {
    if (to == WorkOrderStatus.CANCELLED) {
      return Optional.of(CANCEL);
    }
    if (to == WorkOrderStatus.ON_HOLD) {
      return Optional.of(PUT_ON_HOLD);
    }
    if (from == WorkOrderStatus.ON_HOLD) {
      return Optional.of(RESUME);
    }
    return switch (to) {
      case ASSESSMENT -> Optional.of(START_ASSESSMENT);
      case ESTIMATE_PENDING -> Optional.of(SUBMIT_ESTIMATE);
      case APPROVED -> Optional.of(APPROVE);
      case IN_PROGRESS -> Optional.of(START_WORK);
      case COMPLETED -> Optional.of(COMPLETE_WORK);
      default -> Optional.empty();
    };
  }

  @Override
  public String toString() {
    return wireName;
  }
}
