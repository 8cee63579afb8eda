package io.b2mash.b2b.fmcore.featureflag;

/** Answers whether a named feature is switched on. */
public interface FeatureFlagSource {

  boolean isEnabled(String flagName);
}
