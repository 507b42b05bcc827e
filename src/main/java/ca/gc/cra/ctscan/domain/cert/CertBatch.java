package ca.gc.cra.ctscan.domain.cert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered group of certificate entries produced by one scan callback.
 * <p><strong>Why:</strong> The unit handed from the scanning thread to the store writer.</p>
 * <p><strong>Role:</strong> Domain value queued by {@code CertDbReportUseCase} and consumed by
 * {@link ca.gc.cra.ctscan.application.port.CertStorePort}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; ownership moves from producer to writer without sharing.</p>
 *
 * @param entries entries in scan order; copied into an unmodifiable list
 * @since 0.1.0
 */
public record CertBatch(List<CertEntry> entries) {
  /**
   * Copies the entries into an unmodifiable list.
   *
   * @throws NullPointerException if {@code entries} or any element is {@code null}
   */
  public CertBatch {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
  }

  /**
   * Builds a batch from scan results, keeping only descriptor and index of each result.
   *
   * @param results results delivered by a scan callback; may be empty
   * @return batch with one entry per result in the same order
   */
  public static CertBatch fromResults(List<ScanResult> results) {
    Objects.requireNonNull(results, "results");
    List<CertEntry> entries = new ArrayList<>(results.size());
    for (ScanResult result : results) {
      entries.add(new CertEntry(result.descriptor(), result.index()));
    }
    return new CertBatch(entries);
  }

  /**
   * Returns the number of entries in the batch.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Indicates whether the batch carries no entries.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
