package io.b2mash.b2b.fmcore.stats.dto;

import java.util.Map;

/**
 * Work order KPIs for a tenant. Ratios with an empty denominator are null.
 *
 * @param total work orders in the window
 * @param statusCounts count per status, every status present
 * @param priorityCounts count per priority, every priority present
 * @param overdueCount open work orders whose SLA deadline has passed
 * @param avgCompletionHours mean hours from creation to completion over completed work orders
 * @param slaComplianceRate share of completed work orders with a deadline that finished by it
 * @param completedLast7Days work orders completed within the last 7 days
 * @param completedLast30Days work orders completed within the last 30 days
 */
public record WorkOrderStats(
    long total,
    Map<String, Long> statusCounts,
    Map<String, Long> priorityCounts,
    long overdueCount,
    Double avgCompletionHours,
    Double slaComplianceRate,
    long completedLast7Days,
    long completedLast30Days) {}
