package ca.gc.cra.ctscan.application.pipeline;

/**
 * Raised by {@link BoundedChannel} operations once the channel has been aborted.
 * <p>The cause is the failure passed to {@link BoundedChannel#abort(Throwable)}.</p>
 *
 * @since 0.1.0
 */
public final class ChannelAbortedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the rejected operation
   * @param cause failure that aborted the channel; may be {@code null}
   */
  public ChannelAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}
