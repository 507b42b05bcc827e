package ca.gc.cra.ctscan.application.port;

import ca.gc.cra.ctscan.domain.cert.CertBatch;

/**
 * <strong>What:</strong> Output port persisting scanned certificate batches.
 * <p><strong>Why:</strong> Lets the report hand batches to a durable store without binding to its schema.</p>
 * <p><strong>Role:</strong> Sink side of the report's hexagonal architecture.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist each batch synchronously; return only once the batch is durable.</li>
 *   <li>Signal failure by throwing; the report treats any failure as fatal to the cycle.</li>
 *   <li>Release underlying resources cleanly during shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The report calls {@link #storeBatch(CertBatch, String)} from a single
 * writer thread at a time; implementations need not be reentrant.</p>
 * <p><strong>Observability:</strong> Implementations should log failures; the report records
 * {@code certdb.store.*} metrics around each call.</p>
 *
 * @since 0.1.0
 */
public interface CertStorePort extends AutoCloseable {
  /**
   * Stores one batch of certificate entries for the given log.
   *
   * @param batch batch to persist; never {@code null}, may be empty
   * @param logKey identifier of the log the entries were read from
   * @throws Exception if the store rejects the write or encounters an IO error
   */
  void storeBatch(CertBatch batch, String logKey) throws Exception;

  /**
   * Flushes buffered state to the underlying store.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  /**
   * Closes the store.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
