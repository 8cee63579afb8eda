package io.b2mash.b2b.fmcore.featureflag;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Feature switches from configuration, e.g. {@code fm.features.flags.work_order_auto_assign=true}.
 * Flags absent from the map are off.
 *
 * @param flags flag name to enabled
 */
@ConfigurationProperties(prefix = "fm.features")
public record FeatureFlagProperties(Map<String, Boolean> flags) {

  public FeatureFlagProperties {
    flags = flags != null ? Map.copyOf(flags) : Map.of();
  }
}
