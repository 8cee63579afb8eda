package io.b2mash.b2b.fmcore.featureflag;

import org.springframework.stereotype.Component;

@Component
public class PropertiesFeatureFlagSource implements FeatureFlagSource {

  private final FeatureFlagProperties properties;

  public PropertiesFeatureFlagSource(FeatureFlagProperties properties) {
    this.properties = properties;
  }

  @Override
  public boolean isEnabled(String flagName) {
    return Boolean.TRUE.equals(properties.flags().get(flagName));
  }
}
