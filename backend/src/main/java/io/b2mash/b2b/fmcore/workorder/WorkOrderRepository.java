package io.b2mash.b2b.fmcore.workorder;

import io.b2mash.b2b.fmcore.stats.WorkOrderStatsRow;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkOrderRepository extends JpaRepository<WorkOrder, UUID> {

  Optional<WorkOrder> findByIdAndTenantId(UUID id, String tenantId);

  @Query(
      """
      SELECT new io.b2mash.b2b.fmcore.stats.WorkOrderStatsRow(
          w.status, w.priority, w.createdAt, w.completedAt, w.slaDueAt)
      FROM WorkOrder w
      WHERE w.tenantId = :tenantId
        AND w.createdAt >= :from
        AND w.createdAt < :to
      """)
  List<WorkOrderStatsRow> findStatsRows(
      @Param("tenantId") String tenantId, @Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT new io.b2mash.b2b.fmcore.stats.WorkOrderStatsRow(
          w.status, w.priority, w.createdAt, w.completedAt, w.slaDueAt)
      FROM WorkOrder w
      WHERE w.createdAt >= :from
        AND w.createdAt < :to
      """)
  List<WorkOrderStatsRow> findStatsRowsAcrossTenants(
      @Param("from") Instant from, @Param("to") Instant to);
}
