package io.b2mash.b2b.fmcore.stats;

import io.b2mash.b2b.fmcore.multitenancy.RequestScopes;
import io.b2mash.b2b.fmcore.stats.dto.WorkOrderStats;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkOrderStatsController {

  private final WorkOrderStatsService statsService;

  public WorkOrderStatsController(WorkOrderStatsService statsService) {
    this.statsService = statsService;
  }

  @GetMapping("/api/work-orders/stats")
  public ResponseEntity<WorkOrderStats> getStats(
      @RequestParam(required = false) Instant from, @RequestParam(required = false) Instant to) {
    return ResponseEntity.ok(statsService.getStats(RequestScopes.requireActor(), from, to));
  }
}
