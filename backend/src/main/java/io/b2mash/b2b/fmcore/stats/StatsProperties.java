package io.b2mash.b2b.fmcore.stats;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param cacheTtl how long computed KPIs are served from cache per tenant and window
 */
@ConfigurationProperties(prefix = "fm.stats")
public record StatsProperties(@DefaultValue("30s") Duration cacheTtl) {}
