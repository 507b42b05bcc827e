package ca.gc.cra.ctscan.application.pipeline;

import static ca.gc.cra.ctscan.application.pipeline.CertDbReportUseCaseTest.emitting;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ctscan.application.port.CertificateScanner;
import ca.gc.cra.ctscan.application.port.MetricsPort;
import ca.gc.cra.ctscan.testutil.RecordingMetricsPort;
import ca.gc.cra.ctscan.testutil.ScanFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class CertDbReportUseCaseFailureTest {
  private static final Duration DEADLINE = Duration.ofSeconds(10);

  @Test
  void storeFailureEndsCycleWithCertStoreException() {
    IOException boom = new IOException("store rejected batch");
    RecordingCertStore store = new RecordingCertStore().failOn(2, boom);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(5, 2)), store, "log-a", metrics);

    CertStoreException ex = assertTimeoutPreemptively(
        DEADLINE, () -> assertThrows(CertStoreException.class, useCase::report));

    assertSame(boom, ex.getCause());
    assertTrue(ex.getMessage().contains("log-a"));
    assertEquals(1, store.batches().size(), "only the batch before the failure is stored");
    assertEquals(2, store.calls(), "no batch after the failing one reaches the store");
    assertFalse(store.writerThreads().get(0).isAlive());
    assertTrue(useCase.currentWriter().isEmpty());
    assertEquals(1, metrics.count("certdb.store.error"));
    assertEquals(1, metrics.count("certdb.cycle.failed"));
    assertEquals(0, metrics.count("certdb.cycle.completed"));
  }

  @Test
  void storeFailureReleasesScannerBlockedOnFullChannel() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    RecordingCertStore store =
        new RecordingCertStore().gatedBy(gate).failOn(1, new IOException("connection reset"));
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(10, 1)), store, "log-a", metrics,
        new CertDbReportUseCase.ReportSettings(1));

    Thread opener = new Thread(() -> {
      try {
        if (store.awaitFirstCall(5, TimeUnit.SECONDS)) {
          awaitQueued(useCase, 1);
          Thread.sleep(100);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      } finally {
        gate.countDown();
      }
    });
    opener.start();

    CertStoreException ex = assertTimeoutPreemptively(
        DEADLINE, () -> assertThrows(CertStoreException.class, useCase::report));
    opener.join(2_000);

    assertInstanceOf(IOException.class, ex.getCause());
    assertEquals(1, store.calls());
    assertTrue(store.batches().isEmpty());
    assertEquals(List.of(1L), metrics.observed("certdb.batch.discarded"));
  }

  @Test
  void useCaseIsReusableAfterStoreFailure() throws Exception {
    RecordingCertStore store = new RecordingCertStore().failOn(1, new IOException("transient"));
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(3, 1)), store, "log-a", MetricsPort.NO_OP);

    assertThrows(CertStoreException.class, useCase::report);
    CertDbReportUseCase.CycleSummary summary = useCase.report();

    assertEquals(2, summary.cycle());
    assertEquals(3, summary.batchesStored());
    assertEquals(3, store.batches().size());
    assertFalse(useCase.currentChannel().isAborted());
  }

  @Test
  void scanFailureStillStoresQueuedBatchesThenRethrows() {
    IOException scanFailure = new IOException("scan source vanished");
    RecordingCertStore store = new RecordingCertStore().delayEachWrite(10);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CertificateScanner scanner = listener -> {
      for (var results : ScanFixtures.batches(3, 2)) {
        listener.onBatch(results);
      }
      throw scanFailure;
    };
    CertDbReportUseCase useCase = new CertDbReportUseCase(scanner, store, "log-a", metrics);

    IOException ex = assertTimeoutPreemptively(
        DEADLINE, () -> assertThrows(IOException.class, useCase::report));

    assertSame(scanFailure, ex);
    assertEquals(3, store.batches().size());
    assertFalse(store.writerThreads().get(0).isAlive());
    assertEquals(1, metrics.count("certdb.cycle.failed"));
    assertEquals(0, metrics.count("certdb.store.error"));
  }

  @Test
  void scanFailureBeforeFirstBatchLeavesNoWriter() {
    IllegalStateException scanFailure = new IllegalStateException("bad log");
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        listener -> {
          throw scanFailure;
        },
        new RecordingCertStore(), "log-a", metrics);

    IllegalStateException ex = assertThrows(IllegalStateException.class, useCase::report);

    assertSame(scanFailure, ex);
    assertEquals(0, metrics.count("certdb.writer.started"));
    assertTrue(useCase.currentWriter().isEmpty());
  }

  @Test
  void storeFailureTakesPrecedenceOverScanFailure() {
    RecordingCertStore store = new RecordingCertStore().failOn(1, new IOException("store down"));
    CertificateScanner scanner = listener -> {
      listener.onBatch(ScanFixtures.batch(0, 1));
      store.awaitFirstCall(5, TimeUnit.SECONDS);
      throw new IOException("scan failed too");
    };
    CertDbReportUseCase useCase = new CertDbReportUseCase(scanner, store, "log-a", MetricsPort.NO_OP);

    CertStoreException ex = assertTimeoutPreemptively(
        DEADLINE, () -> assertThrows(CertStoreException.class, useCase::report));

    assertEquals("store down", ex.getCause().getMessage());
  }

  @Test
  void interruptAbortsCycleButWaitsForWriter() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    RecordingCertStore store = new RecordingCertStore().gatedBy(gate);
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(6, 1)), store, "log-a", MetricsPort.NO_OP,
        new CertDbReportUseCase.ReportSettings(1));

    AtomicReference<Exception> failure = new AtomicReference<>();
    AtomicBoolean interruptRestored = new AtomicBoolean();
    Thread reporter = new Thread(() -> {
      try {
        useCase.report();
      } catch (Exception ex) {
        failure.set(ex);
        interruptRestored.set(Thread.currentThread().isInterrupted());
      }
    });
    reporter.start();

    assertTrue(store.awaitFirstCall(5, TimeUnit.SECONDS));
    awaitQueued(useCase, 1);
    Thread writer = store.writerThreads().get(0);
    reporter.interrupt();
    Thread.sleep(150);
    assertTrue(reporter.isAlive(), "report must not return while the writer is still storing");

    gate.countDown();
    reporter.join(5_000);

    assertFalse(reporter.isAlive());
    assertFalse(writer.isAlive());
    assertInstanceOf(InterruptedException.class, failure.get());
    assertTrue(interruptRestored.get());
    assertTrue(useCase.currentWriter().isEmpty());
  }

  @Test
  void secondConcurrentReportIsRejected() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    RecordingCertStore store = new RecordingCertStore().gatedBy(gate);
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(2, 1)), store, "log-a", MetricsPort.NO_OP);

    AtomicReference<Exception> failure = new AtomicReference<>();
    Thread reporter = new Thread(() -> {
      try {
        useCase.report();
      } catch (Exception ex) {
        failure.set(ex);
      }
    });
    reporter.start();
    assertTrue(store.awaitFirstCall(5, TimeUnit.SECONDS));

    IllegalStateException ex = assertThrows(IllegalStateException.class, useCase::report);
    assertEquals("Report already running", ex.getMessage());

    gate.countDown();
    reporter.join(5_000);
    assertFalse(reporter.isAlive());
    assertNull(failure.get());
    assertEquals(2, store.batches().size());
  }

  @Test
  void writerErrorIsSurfacedAsStoreFailure() {
    LinkageError crash = new LinkageError("codec missing");
    RecordingCertStore store = new RecordingCertStore().crashOn(1, crash);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(3, 1)), store, "log-a", metrics);

    CertStoreException ex = assertTimeoutPreemptively(
        DEADLINE, () -> assertThrows(CertStoreException.class, useCase::report));

    assertNotNull(ex.getCause());
    assertSame(crash, ex.getCause().getCause());
    assertEquals(1, metrics.count("certdb.writer.uncaught"));
    assertEquals(0, metrics.count("certdb.store.error"));
    assertTrue(useCase.currentWriter().isEmpty());
  }

  @Test
  void storeInterruptedIsCountedApartFromStoreErrors() {
    InterruptedException cancelled = new InterruptedException("send cancelled");
    RecordingCertStore store = new RecordingCertStore().failOn(1, cancelled);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CertDbReportUseCase useCase = new CertDbReportUseCase(
        emitting(ScanFixtures.batches(3, 1)), store, "log-a", metrics);

    CertStoreException ex = assertTimeoutPreemptively(
        DEADLINE, () -> assertThrows(CertStoreException.class, useCase::report));

    assertSame(cancelled, ex.getCause());
    assertEquals(1, metrics.count("certdb.writer.interrupted"));
    assertEquals(0, metrics.count("certdb.store.error"));
    assertFalse(store.writerThreads().get(0).isAlive());
    assertTrue(useCase.currentWriter().isEmpty());
  }

  @Test
  void storeFailureLogCarriesLogKey() {
    Logger logger = (Logger) LoggerFactory.getLogger(CertDbReportUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      CertDbReportUseCase useCase = new CertDbReportUseCase(
          emitting(ScanFixtures.batches(1, 1)),
          new RecordingCertStore().failOn(1, new IOException("nope")),
          "log-logged",
          MetricsPort.NO_OP);
      assertThrows(CertStoreException.class, useCase::report);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    ILoggingEvent writerFailure = appender.list.stream()
        .filter(event -> event.getLevel() == Level.ERROR)
        .filter(event -> event.getMessage().startsWith("Cert store writer"))
        .findFirst()
        .orElseThrow();
    assertEquals("log-logged", writerFailure.getMDCPropertyMap().get("logKey"));
    assertTrue(writerFailure.getThreadName().startsWith("certdb-writer-"));
  }

  private static void awaitQueued(CertDbReportUseCase useCase, int depth) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (useCase.currentChannel().size() < depth && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
  }
}
