package ca.gc.cra.ctscan.application.pipeline;

import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.application.port.CertificateScanner;
import ca.gc.cra.ctscan.application.port.MetricsPort;
import ca.gc.cra.ctscan.domain.cert.CertBatch;
import ca.gc.cra.ctscan.domain.cert.ScanResult;
import ca.gc.cra.ctscan.infrastructure.exec.WorkerThreads;
import ca.gc.cra.ctscan.validation.Strings;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs certificate report cycles, writing scanned batches to the certificate store from a background writer.
 * <p>Each {@link #report()} call drives the scanner; every batch callback is queued on a bounded channel so
 * scanning only waits on the store when the channel is full. The writer thread is started by the first
 * batch of a cycle. When the scan returns, the report waits until every queued batch has been stored,
 * sends the end-of-cycle marker and joins the writer, so no writer outlives its cycle.</p>
 * <p>A store failure is fatal to the cycle: the writer records it, aborts the channel (discarding queued
 * batches and releasing a blocked scanner) and exits; {@code report()} then joins it and throws
 * {@link CertStoreException}. Instances are reusable across cycles but not across concurrent callers.</p>
 *
 * @since 0.1.0
 */
public final class CertDbReportUseCase {
  private static final Logger log = LoggerFactory.getLogger(CertDbReportUseCase.class);

  private static final int DEFAULT_QUEUE_CAPACITY = 10;

  private final CertificateScanner scanner;
  private final CertStorePort store;
  private final String logKey;
  private final MetricsPort metrics;
  private final ReportSettings settings;
  private final String writerThreadPrefix;
  private final UncaughtExceptionHandler writerUncaughtHandler;
  private final CertStoreWriter.Callbacks writerCallbacks = new WriterCallbacks();

  private final Object writerLock = new Object();
  private BoundedChannel<ChannelItem> channel;
  private Thread writer;

  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final AtomicReference<Exception> writerFailure = new AtomicReference<>();
  private final AtomicInteger queueHighWaterMark = new AtomicInteger();
  private final AtomicLong cycleCount = new AtomicLong();
  private final LongAdder batchesEnqueued = new LongAdder();
  private final LongAdder certificatesEnqueued = new LongAdder();
  private final LongAdder batchesStored = new LongAdder();

  /**
   * Creates a report with the default channel capacity.
   *
   * @param scanner scan pipeline producing certificate batches
   * @param store store receiving every scanned batch
   * @param logKey identifier of the scanned log, passed to the store with each batch
   * @param metrics metrics sink for queue and store observations
   */
  public CertDbReportUseCase(
      CertificateScanner scanner, CertStorePort store, String logKey, MetricsPort metrics) {
    this(scanner, store, logKey, metrics, ReportSettings.defaults());
  }

  /**
   * Creates a report with explicit settings.
   *
   * @param scanner scan pipeline producing certificate batches
   * @param store store receiving every scanned batch
   * @param logKey identifier of the scanned log, passed to the store with each batch
   * @param metrics metrics sink for queue and store observations
   * @param settings channel tuning, read once here
   */
  public CertDbReportUseCase(
      CertificateScanner scanner,
      CertStorePort store,
      String logKey,
      MetricsPort metrics,
      ReportSettings settings) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.store = Objects.requireNonNull(store, "store");
    this.logKey = Strings.requireNonBlank("logKey", logKey);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.channel = new BoundedChannel<>(this.settings.queueCapacity());
    this.writerThreadPrefix = "certdb-writer-" + Integer.toHexString(System.identityHashCode(this));
    this.writerUncaughtHandler = this::handleWriterCrash;
  }

  /**
   * Runs one report cycle: scans, hands every batch to the store and joins the writer.
   *
   * @return counts and timing for the completed cycle
   * @throws CertStoreException if the store failed; queued batches after the failing one were discarded
   * @throws InterruptedException if the calling thread was interrupted; the writer is still joined
   * @throws IllegalStateException if another thread is already running a cycle on this instance
   * @throws Exception any failure raised by the scanner, after the writer has been shut down
   */
  public CycleSummary report() throws Exception {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Report already running");
    }
    MDC.put("pipeline", "certdb");
    MDC.put("logKey", logKey);
    try {
      return runCycle();
    } finally {
      runThread.set(null);
      MDC.remove("logKey");
      MDC.remove("pipeline");
    }
  }

  /**
   * Joins the writer of the current cycle, if one was started, and clears it.
   * <p>No-op when no writer exists, e.g. after a cycle that scanned nothing. Only call once the
   * end-of-cycle marker was sent or the channel was aborted; otherwise the writer never exits.
   * Interrupts received while joining are deferred until the writer has exited.</p>
   */
  public void reset() {
    Thread activeWriter;
    synchronized (writerLock) {
      activeWriter = writer;
    }
    if (activeWriter != null) {
      joinUninterruptibly(activeWriter);
      log.debug("Cert store writer {} joined", activeWriter.getName());
      metrics.observe("certdb.queue.highWater", queueHighWaterMark.get());
    }
    synchronized (writerLock) {
      writer = null;
      if (channel.isAborted()) {
        channel = new BoundedChannel<>(settings.queueCapacity());
      }
    }
  }

  private CycleSummary runCycle() throws Exception {
    long cycle = cycleCount.incrementAndGet();
    long startNanos = System.nanoTime();
    beginCycle();
    log.info("Report cycle {} started (queue capacity {})", cycle, currentChannel().capacity());

    Exception primaryFailure = null;
    try {
      scanner.scan(this::onBatchScanned);
    } catch (Exception scanFailure) {
      primaryFailure = scanFailure;
    }

    if (primaryFailure == null || canDrainAfter(primaryFailure)) {
      if (primaryFailure != null) {
        log.warn("Scan failed; storing {} batches already queued before surfacing the failure",
            batchesEnqueued.sum() - batchesStored.sum());
      }
      try {
        completeCycle();
      } catch (Exception completionFailure) {
        if (primaryFailure == null) {
          primaryFailure = completionFailure;
        } else {
          primaryFailure.addSuppressed(completionFailure);
        }
      }
    }
    if (primaryFailure != null) {
      abortChannel(primaryFailure);
    }
    reset();

    CycleSummary summary = new CycleSummary(
        cycle,
        batchesEnqueued.sum(),
        certificatesEnqueued.sum(),
        batchesStored.sum(),
        Duration.ofNanos(System.nanoTime() - startNanos));
    metrics.observe("certdb.cycle.durationNanos", summary.elapsed().toNanos());

    Exception storeFailure = writerFailure.get();
    if (storeFailure != null) {
      metrics.increment("certdb.cycle.failed");
      log.error(
          "Report cycle {} failed after storing {} of {} batches",
          cycle,
          summary.batchesStored(),
          summary.batchesEnqueued());
      throw new CertStoreException("Certificate store failed for log " + logKey, storeFailure);
    }
    if (primaryFailure != null) {
      metrics.increment("certdb.cycle.failed");
      if (primaryFailure instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.error("Report cycle {} failed after storing {} batches", cycle, summary.batchesStored(), primaryFailure);
      throw primaryFailure;
    }

    metrics.increment("certdb.cycle.completed");
    log.info(
        "Report cycle {} stored {} batches ({} certificates) in {} ms",
        cycle,
        summary.batchesStored(),
        summary.certificatesEnqueued(),
        TimeUnit.NANOSECONDS.toMillis(summary.elapsed().toNanos()));
    return summary;
  }

  private void beginCycle() {
    writerFailure.set(null);
    queueHighWaterMark.set(0);
    batchesEnqueued.reset();
    certificatesEnqueued.reset();
    batchesStored.reset();
    synchronized (writerLock) {
      if (writer != null) {
        throw new IllegalStateException("Writer from a previous cycle is still registered");
      }
      if (channel.isAborted()) {
        channel = new BoundedChannel<>(settings.queueCapacity());
      }
    }
  }

  private void onBatchScanned(List<ScanResult> results) throws InterruptedException {
    Exception failure = writerFailure.get();
    if (failure != null) {
      throw new ChannelAbortedException("Certificate store already failed", failure);
    }
    CertBatch batch = CertBatch.fromResults(results);
    BoundedChannel<ChannelItem> target = ensureWriterStarted();
    long startNanos = System.nanoTime();
    target.put(new ChannelItem.Batch(batch));
    batchesEnqueued.increment();
    certificatesEnqueued.add(batch.size());
    recordEnqueueMetrics(target, System.nanoTime() - startNanos);
  }

  private BoundedChannel<ChannelItem> ensureWriterStarted() {
    synchronized (writerLock) {
      if (writer == null) {
        Thread thread = WorkerThreads.newWorkerThread(
            writerThreadPrefix + "-" + cycleCount.get(),
            new CertStoreWriter(channel, store, logKey, writerCallbacks),
            writerUncaughtHandler);
        writer = thread;
        thread.start();
        metrics.increment("certdb.writer.started");
        log.debug("Started cert store writer {}", thread.getName());
      }
      return channel;
    }
  }

  private void completeCycle() throws InterruptedException {
    BoundedChannel<ChannelItem> active;
    boolean writerStarted;
    synchronized (writerLock) {
      active = channel;
      writerStarted = writer != null;
    }
    active.awaitDrained();
    if (!writerStarted) {
      log.debug("No batches scanned; writer was never started");
      return;
    }
    log.info("Finished scheduled writing to cert store");
    active.put(ChannelItem.EndOfCycle.INSTANCE);
  }

  private boolean canDrainAfter(Exception scanFailure) {
    return !(scanFailure instanceof InterruptedException)
        && !(scanFailure instanceof ChannelAbortedException)
        && writerFailure.get() == null;
  }

  private void abortChannel(Throwable cause) {
    BoundedChannel<ChannelItem> active;
    synchronized (writerLock) {
      if (writer == null) {
        return;
      }
      active = channel;
    }
    int discarded = active.abort(cause);
    if (discarded > 0) {
      metrics.observe("certdb.batch.discarded", discarded);
      log.warn("Discarded {} queued items after failure", discarded);
    }
  }

  private void recordEnqueueMetrics(BoundedChannel<ChannelItem> target, long waitNanos) {
    metrics.increment("certdb.batch.enqueued");
    metrics.observe("certdb.enqueue.waitNanos", waitNanos);
    int depth = target.size();
    metrics.observe("certdb.queue.depth", depth);
    updateQueueHighWater(depth);
  }

  private void updateQueueHighWater(int depth) {
    int previous;
    do {
      previous = queueHighWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!queueHighWaterMark.compareAndSet(previous, depth));
  }

  private void handleWriterCrash(Thread thread, Throwable throwable) {
    metrics.increment("certdb.writer.uncaught");
    Exception failure =
        throwable instanceof Exception ex ? ex : new RuntimeException("Cert store writer crash", throwable);
    log.error("Cert store writer {} threw an uncaught exception", thread.getName(), throwable);
    signalWriterFailure(failure);
  }

  private void signalWriterFailure(Exception failure) {
    if (writerFailure.compareAndSet(null, failure)) {
      log.error("Cert store writer {} failed", Thread.currentThread().getName(), failure);
      abortChannel(failure);
    }
  }

  private static void joinUninterruptibly(Thread thread) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          thread.join();
          return;
        } catch (InterruptedException ie) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  Optional<Thread> currentWriter() {
    synchronized (writerLock) {
      return Optional.ofNullable(writer);
    }
  }

  BoundedChannel<ChannelItem> currentChannel() {
    synchronized (writerLock) {
      return channel;
    }
  }

  private final class WriterCallbacks implements CertStoreWriter.Callbacks {
    @Override
    public void batchStored(CertBatch batch, long durationNanos) {
      batchesStored.increment();
      metrics.increment("certdb.batch.stored");
      metrics.observe("certdb.store.latencyNanos", durationNanos);
    }

    @Override
    public void storeFailed(CertBatch batch, Exception failure) {
      metrics.increment("certdb.store.error");
      signalWriterFailure(failure);
    }

    @Override
    public void writerFailed(Exception failure) {
      metrics.increment("certdb.writer.interrupted");
      signalWriterFailure(failure);
    }
  }

  /** Report tuning parameters. */
  public record ReportSettings(int queueCapacity) {
    /**
     * Validates the settings.
     *
     * @param queueCapacity maximum number of batches buffered between scanner and writer; must be positive
     */
    public ReportSettings {
      if (queueCapacity <= 0) {
        throw new IllegalArgumentException("queueCapacity must be positive (was " + queueCapacity + ")");
      }
    }

    /**
     * Returns the default settings (queue capacity 10).
     *
     * @return default report settings
     */
    public static ReportSettings defaults() {
      return new ReportSettings(DEFAULT_QUEUE_CAPACITY);
    }
  }

  /**
   * Outcome of one report cycle.
   *
   * @param cycle sequence number of the cycle on this instance, starting at 1
   * @param batchesEnqueued batches received from the scanner
   * @param certificatesEnqueued certificates contained in those batches
   * @param batchesStored batches the store accepted
   * @param elapsed wall-clock duration of the cycle
   */
  public record CycleSummary(
      long cycle,
      long batchesEnqueued,
      long certificatesEnqueued,
      long batchesStored,
      Duration elapsed) {}
}
