package io.b2mash.b2b.fmcore.assignment;

import io.b2mash.b2b.fmcore.workorder.WorkOrder;
import java.util.List;

/** Produces a ranked candidate list for a work order; the first element is the pick. */
public interface AssignmentStrategy {

  /** Name reported to callers as the routing mode, e.g. {@code heuristic}. */
  String name();

  /** Returns eligible candidates best first. Never contains OFFLINE assignees. */
  List<AssignmentCandidate> rank(WorkOrder workOrder);
}
