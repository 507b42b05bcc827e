package ca.gc.cra.ctscan.infrastructure.persistence;

import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.domain.cert.CertBatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps stored batches in memory in arrival order.
 * <p>Used for {@code storeMode=MEMORY} dry runs and as a recording store in tests. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryCertStore implements CertStorePort {
  private final List<StoredBatch> batches = new ArrayList<>();
  private boolean closed;

  @Override
  public synchronized void storeBatch(CertBatch batch, String logKey) {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(logKey, "logKey");
    if (closed) {
      throw new IllegalStateException("Store closed");
    }
    batches.add(new StoredBatch(logKey, batch));
  }

  /**
   * Returns a snapshot of the batches stored so far.
   *
   * @return stored batches in arrival order
   */
  public synchronized List<StoredBatch> batches() {
    return List.copyOf(batches);
  }

  @Override
  public synchronized void close() {
    closed = true;
  }

  /**
   * A batch together with the log key it was stored under.
   *
   * @param logKey log identifier supplied by the report
   * @param batch stored batch
   */
  public record StoredBatch(String logKey, CertBatch batch) {}
}
