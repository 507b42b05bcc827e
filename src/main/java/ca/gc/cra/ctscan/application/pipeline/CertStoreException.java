package ca.gc.cra.ctscan.application.pipeline;

/**
 * Signals that the certificate store rejected a batch and the reporting cycle was abandoned.
 * <p>The cause carries the exception thrown by the store. Batches still queued when the failure
 * occurred were discarded and are not retried.</p>
 *
 * @since 0.1.0
 */
public final class CertStoreException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description including the affected log
   * @param cause failure raised by the store
   */
  public CertStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
