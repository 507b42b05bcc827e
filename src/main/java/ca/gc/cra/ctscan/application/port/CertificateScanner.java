package ca.gc.cra.ctscan.application.port;

import ca.gc.cra.ctscan.domain.cert.ScanResult;
import java.util.List;

/**
 * <strong>What:</strong> Input port for the external certificate scan pipeline.
 * <p><strong>Why:</strong> Keeps certificate analysis out of the report core; the report only needs batch callbacks.</p>
 * <p><strong>Role:</strong> Source side of the report's hexagonal architecture.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Invoke the listener zero or more times, once per scanned batch.</li>
 *   <li>Return from {@link #scan(BatchListener)} only after every callback has fired.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations may invoke the listener from several threads; the report
 * serializes writer start-up and relies on the channel for the rest.</p>
 *
 * @since 0.1.0
 */
public interface CertificateScanner {
  /**
   * Runs one scan, delivering results through {@code listener}.
   *
   * @param listener callback receiving each scanned batch; must not be {@code null}
   * @throws Exception if scanning fails or a listener invocation throws
   */
  void scan(BatchListener listener) throws Exception;

  /**
   * Callback invoked once per scanned batch.
   */
  @FunctionalInterface
  interface BatchListener {
    /**
     * Receives the results of one scanned batch.
     *
     * @param results scan results in log order; may be empty
     * @throws Exception if the batch cannot be accepted; {@link InterruptedException} when the
     *     caller is interrupted while blocked on backpressure
     */
    void onBatch(List<ScanResult> results) throws Exception;
  }
}
