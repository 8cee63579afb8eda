package io.b2mash.b2b.fmcore.assignment;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Weights of the auto-assignment score terms. The defaults sum to 1.0, so scores stay in [0, 1].
 *
 * @param skill weight of the share of required skills the candidate has
 * @param availability weight of the availability bonus (AVAILABLE 1.0, BUSY 0.3)
 * @param capacity weight of the spare capacity ratio, {@code 1 - current/max} clamped to [0, 1]
 * @param rating weight of the external rating divided by 5
 */
@ConfigurationProperties(prefix = "fm.assignment.weights")
public record AssignmentWeights(
    @DefaultValue("0.40") double skill,
    @DefaultValue("0.25") double availability,
    @DefaultValue("0.25") double capacity,
    @DefaultValue("0.10") double rating) {

  public static final AssignmentWeights DEFAULTS = new AssignmentWeights(0.40, 0.25, 0.25, 0.10);
}
