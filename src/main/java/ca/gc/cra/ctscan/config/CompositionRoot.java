package ca.gc.cra.ctscan.config;

import ca.gc.cra.ctscan.adapter.kafka.KafkaCertStore;
import ca.gc.cra.ctscan.application.pipeline.CertDbReportUseCase;
import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.application.port.CertificateScanner;
import ca.gc.cra.ctscan.application.port.MetricsPort;
import ca.gc.cra.ctscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.ctscan.infrastructure.persistence.InMemoryCertStore;
import ca.gc.cra.ctscan.infrastructure.persistence.NdjsonFileCertStore;
import ca.gc.cra.ctscan.infrastructure.scan.NdjsonCertificateScanner;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the report use case to the scanner, store and metrics adapters selected by
 * {@link ReportConfig}.
 * <p><strong>Role:</strong> Composition root for the {@code report} CLI.</p>
 * <p><strong>Thread-safety:</strong> Factory methods create fresh adapters; call them from the start-up thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ReportConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a root using the environment-configured OpenTelemetry metrics adapter.
   *
   * @param config validated report configuration
   */
  public CompositionRoot(ReportConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a root with an explicit metrics adapter.
   *
   * @param config validated report configuration
   * @param metrics metrics adapter shared by the constructed use case
   */
  public CompositionRoot(ReportConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Creates the scanner reading {@code in} in batches of {@code scanBatchSize}.
   *
   * @return certificate scanner
   */
  public CertificateScanner certificateScanner() {
    return new NdjsonCertificateScanner(config.input(), config.scanBatchSize());
  }

  /**
   * Creates the store for the configured {@link StoreMode}. The caller owns and closes it.
   *
   * @return certificate store
   */
  public CertStorePort certStore() {
    switch (config.storeMode()) {
      case MEMORY:
        return new InMemoryCertStore();
      case KAFKA:
        return new KafkaCertStore(config.kafkaBootstrap().orElseThrow(), config.kafkaTopic());
      case FILE:
      default:
        return new NdjsonFileCertStore(config.output());
    }
  }

  /**
   * Creates a report use case writing to {@code store}.
   *
   * @param store store receiving batches; owned by the caller
   * @return report use case
   */
  public CertDbReportUseCase reportUseCase(CertStorePort store) {
    return new CertDbReportUseCase(
        certificateScanner(),
        store,
        config.logKey(),
        metrics,
        new CertDbReportUseCase.ReportSettings(config.queueCapacity()));
  }
}
