package io.b2mash.b2b.fmcore.stats;

import io.b2mash.b2b.fmcore.workorder.WorkOrderPriority;
import io.b2mash.b2b.fmcore.workorder.WorkOrderStatus;
import java.time.Instant;

/** The columns KPI aggregation reads from one work order. */
public record WorkOrderStatsRow(
    WorkOrderStatus status,
    WorkOrderPriority priority,
    Instant createdAt,
    Instant completedAt,
    Instant slaDueAt) {}
