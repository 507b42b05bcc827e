package ca.gc.cra.ctscan.application.pipeline;

import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.domain.cert.CertBatch;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writer loop run on the report's dedicated thread.
 * <p>Takes items from the channel in order, stores each batch and acknowledges it. The end-of-cycle
 * marker is acknowledged and ends the loop without another {@code get()}. A store failure is handed
 * to {@link Callbacks#storeFailed(CertBatch, Exception)} and ends the loop without acknowledging the
 * batch. An interrupt, while waiting or inside the store, goes to
 * {@link Callbacks#writerFailed(Exception)} with the thread's interrupt flag restored.</p>
 */
final class CertStoreWriter implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(CertStoreWriter.class);

  private final BoundedChannel<ChannelItem> channel;
  private final CertStorePort store;
  private final String logKey;
  private final Callbacks callbacks;

  CertStoreWriter(
      BoundedChannel<ChannelItem> channel, CertStorePort store, String logKey, Callbacks callbacks) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.store = Objects.requireNonNull(store, "store");
    this.logKey = Objects.requireNonNull(logKey, "logKey");
    this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
  }

  @Override
  public void run() {
    MDC.put("pipeline", "certdb");
    MDC.put("logKey", logKey);
    long stored = 0;
    try {
      while (true) {
        ChannelItem item = channel.get();
        if (item instanceof ChannelItem.Batch batch) {
          if (!store(batch.batch())) {
            return;
          }
          stored++;
          channel.markDone();
        } else {
          channel.markDone();
          log.debug("Writer reached end of cycle after {} batches", stored);
          return;
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      callbacks.writerFailed(interrupted);
    } catch (ChannelAbortedException aborted) {
      log.debug("Writer stopping after {} batches; channel aborted", stored);
    } finally {
      MDC.remove("logKey");
      MDC.remove("pipeline");
    }
  }

  private boolean store(CertBatch batch) {
    long startNanos = System.nanoTime();
    try {
      store.storeBatch(batch, logKey);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      callbacks.writerFailed(interrupted);
      return false;
    } catch (Exception ex) {
      callbacks.storeFailed(batch, ex);
      return false;
    }
    callbacks.batchStored(batch, System.nanoTime() - startNanos);
    return true;
  }

  /** Receives writer progress and failures. */
  interface Callbacks {
    void batchStored(CertBatch batch, long durationNanos);

    void storeFailed(CertBatch batch, Exception failure);

    void writerFailed(Exception failure);
  }
}
