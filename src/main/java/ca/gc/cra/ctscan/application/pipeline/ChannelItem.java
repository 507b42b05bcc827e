package ca.gc.cra.ctscan.application.pipeline;

import ca.gc.cra.ctscan.domain.cert.CertBatch;
import java.util.Objects;

/**
 * Item travelling through the report channel: either a real batch or the end-of-cycle marker.
 * <p>The marker is a separate variant rather than a reserved batch value, so no scanned data can be
 * mistaken for it.</p>
 */
sealed interface ChannelItem permits ChannelItem.Batch, ChannelItem.EndOfCycle {

  /**
   * Wraps a scanned batch.
   *
   * @param batch batch to store
   */
  record Batch(CertBatch batch) implements ChannelItem {
    public Batch {
      Objects.requireNonNull(batch, "batch");
    }
  }

  /** Sent once per cycle after every real batch has been acknowledged; stops the writer. */
  enum EndOfCycle implements ChannelItem {
    INSTANCE
  }
}
