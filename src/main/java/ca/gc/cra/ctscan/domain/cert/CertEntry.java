package ca.gc.cra.ctscan.domain.cert;

import java.util.Objects;

/**
 * Certificate descriptor paired with its position in the source log.
 *
 * @param descriptor serialized certificate identifier
 * @param index zero-based position of the entry in the log
 * @since 0.1.0
 */
public record CertEntry(CertificateDescriptor descriptor, long index) {
  /**
   * Validates the entry.
   *
   * @throws NullPointerException if {@code descriptor} is {@code null}
   * @throws IllegalArgumentException if {@code index} is negative
   */
  public CertEntry {
    Objects.requireNonNull(descriptor, "descriptor");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative (was " + index + ")");
    }
  }
}
