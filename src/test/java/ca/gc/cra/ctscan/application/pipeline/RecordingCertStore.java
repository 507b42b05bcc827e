package ca.gc.cra.ctscan.application.pipeline;

import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.domain.cert.CertBatch;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Store double recording batches and the threads that wrote them. Can fail on a chosen call, hold
 * each write on a gate or slow each write down.
 */
final class RecordingCertStore implements CertStorePort {
  private final List<CertBatch> batches = new ArrayList<>();
  private final List<String> logKeys = new ArrayList<>();
  private final List<Thread> writerThreads = new ArrayList<>();
  private final CountDownLatch firstCall = new CountDownLatch(1);

  private volatile int failOnCall = -1;
  private volatile Exception failure;
  private volatile Error crash;
  private volatile CountDownLatch gate;
  private volatile long delayMillis;
  private int calls;

  RecordingCertStore failOn(int call, Exception failure) {
    this.failOnCall = call;
    this.failure = failure;
    return this;
  }

  RecordingCertStore crashOn(int call, Error crash) {
    this.failOnCall = call;
    this.crash = crash;
    return this;
  }

  RecordingCertStore gatedBy(CountDownLatch gate) {
    this.gate = gate;
    return this;
  }

  RecordingCertStore delayEachWrite(long millis) {
    this.delayMillis = millis;
    return this;
  }

  @Override
  public void storeBatch(CertBatch batch, String logKey) throws Exception {
    int call;
    synchronized (this) {
      call = ++calls;
      writerThreads.add(Thread.currentThread());
    }
    firstCall.countDown();
    CountDownLatch currentGate = gate;
    if (currentGate != null && !currentGate.await(10, TimeUnit.SECONDS)) {
      throw new IllegalStateException("gate never opened");
    }
    if (delayMillis > 0) {
      Thread.sleep(delayMillis);
    }
    if (call == failOnCall) {
      if (crash != null) {
        throw crash;
      }
      throw failure;
    }
    synchronized (this) {
      batches.add(batch);
      logKeys.add(logKey);
    }
  }

  boolean awaitFirstCall(long timeout, TimeUnit unit) throws InterruptedException {
    return firstCall.await(timeout, unit);
  }

  synchronized List<CertBatch> batches() {
    return List.copyOf(batches);
  }

  synchronized List<String> logKeys() {
    return List.copyOf(logKeys);
  }

  synchronized List<Thread> writerThreads() {
    return List.copyOf(writerThreads);
  }

  synchronized int calls() {
    return calls;
  }
}
