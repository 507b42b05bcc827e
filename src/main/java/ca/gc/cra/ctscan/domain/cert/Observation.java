package ca.gc.cra.ctscan.domain.cert;

import java.util.Objects;

/**
 * Outcome of a single certificate check.
 *
 * @param checkName name of the check that produced the observation
 * @param description human readable summary
 * @param details optional detail text; empty when absent
 * @since 0.1.0
 */
public record Observation(String checkName, String description, String details) {
  /**
   * Validates the observation.
   */
  public Observation {
    Objects.requireNonNull(checkName, "checkName");
    description = description == null ? "" : description;
    details = details == null ? "" : details;
  }
}
