package io.b2mash.b2b.fmcore.workorder;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Resolution windows per priority, in hours. Priorities without an entry fall back to {@link
 * WorkOrderPriority#defaultSlaHours()}.
 *
 * @param resolutionHours hours allowed from creation to completion
 */
@ConfigurationProperties(prefix = "fm.sla")
public record SlaProperties(Map<WorkOrderPriority, Integer> resolutionHours) {

  public SlaProperties {
    resolutionHours = resolutionHours != null ? Map.copyOf(resolutionHours) : Map.of();
  }
}
