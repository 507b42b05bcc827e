package ca.gc.cra.ctscan.domain.cert;

import java.util.List;
import java.util.Objects;

/**
 * Per-certificate output of the external scan pipeline.
 * <p>Observations are produced by certificate analysis and are not persisted by the report; only the
 * descriptor and index reach the store.</p>
 *
 * @param descriptor serialized certificate identifier
 * @param index zero-based log position
 * @param observations check outcomes for the certificate; copied into an unmodifiable list
 * @since 0.1.0
 */
public record ScanResult(CertificateDescriptor descriptor, long index, List<Observation> observations) {
  /**
   * Validates the result and normalizes {@code null} observations to an empty list.
   */
  public ScanResult {
    Objects.requireNonNull(descriptor, "descriptor");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative (was " + index + ")");
    }
    observations = observations == null ? List.of() : List.copyOf(observations);
  }

  /**
   * Creates a result with no observations.
   *
   * @param descriptor serialized certificate identifier
   * @param index zero-based log position
   * @return result without observations
   */
  public static ScanResult of(CertificateDescriptor descriptor, long index) {
    return new ScanResult(descriptor, index, List.of());
  }
}
