package ca.gc.cra.ctscan.api;

import ca.gc.cra.ctscan.application.pipeline.CertDbReportUseCase;
import ca.gc.cra.ctscan.application.pipeline.CertStoreException;
import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.config.CompositionRoot;
import ca.gc.cra.ctscan.config.ConfigMerger;
import ca.gc.cra.ctscan.config.DefaultsForMode;
import ca.gc.cra.ctscan.config.ReportConfig;
import ca.gc.cra.ctscan.config.StoreMode;
import ca.gc.cra.ctscan.config.YamlConfigLoader;
import ca.gc.cra.ctscan.logging.LoggingConfigurator;
import ca.gc.cra.ctscan.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one certificate report cycle from CLI {@code key=value} arguments.
 *
 * @since 0.1.0
 */
public final class ReportCli {
  private static final Logger log = LoggerFactory.getLogger(ReportCli.class);
  private static final String MODE = "report";
  private static final String SUMMARY_USAGE =
      "usage: report logKey=NAME in=PATH [config=PATH] [queueCapacity=1-65536] "
          + "[scanBatchSize=1-100000] [storeMode=MEMORY|FILE|KAFKA] [out=PATH] "
          + "[kafkaBootstrap=HOST:PORT,...] [kafkaTopic=NAME] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      ctscan certificate report

      Usage:
        report logKey=NAME in=PATH [options]

      Required:
        logKey=NAME                 Identifier of the scanned log, stored with every certificate
        in=PATH                     NDJSON scan results ({"index":..,"descriptor":"<base64>",...} per line)

      Optional (validated):
        config=PATH                 YAML file; 'common' and 'report' sections, overridden by CLI keys
        queueCapacity=1-65536       Batches buffered between scanning and the store writer (default 10)
        scanBatchSize=1-100000      Certificates per batch (default 1000)
        storeMode=MEMORY|FILE|KAFKA Certificate store backend (default FILE)
        out=PATH                    NDJSON output file for FILE mode (default ~/.ctscan/out/certs.ndjson)
        kafkaBootstrap=HOST:PORT    Bootstrap servers, required when storeMode=KAFKA
        kafkaTopic=NAME             Topic receiving batches (default ctscan.certs)
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate inputs and print the plan without scanning
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ReportCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Function<ReportConfig, CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml;
    String configPath = ConfigCliUtils.extractConfigPath(cli);
    try {
      yaml = loadYaml(configPath);
    } catch (IOException ex) {
      log.error("Unable to read config file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid config file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ReportConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yaml, cli, DefaultsForMode.asFlatMap(MODE), log::warn);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = ReportConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid report configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!Files.isRegularFile(config.input()) || !Files.isReadable(config.input())) {
      log.error("Scan input {} is not a readable file", config.input());
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root = rootFactory.apply(config);
    try {
      return runReport(root, config);
    } finally {
      closeMetrics(root);
    }
  }

  private static ExitCode runReport(CompositionRoot root, ReportConfig config) {
    String logKey = Logs.truncate(config.logKey(), 128);
    try (CertStorePort store = root.certStore()) {
      log.info("Starting certificate report for log {} ({} store)", logKey, config.storeMode());
      CertDbReportUseCase.CycleSummary summary = root.reportUseCase(store).report();
      store.flush();
      CliPrinter.printLines(
          "Report complete for log " + logKey,
          " Batches stored   : " + summary.batchesStored(),
          " Certificates     : " + summary.certificatesEnqueued(),
          " Elapsed (ms)     : " + TimeUnit.NANOSECONDS.toMillis(summary.elapsed().toNanos()));
      return ExitCode.SUCCESS;
    } catch (CertStoreException ex) {
      log.error("Certificate store failed for log {}", logKey, ex);
      return ExitCode.STORE_FAILURE;
    } catch (IOException ex) {
      log.error("Report I/O failure for log {}", logKey, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Report configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Report interrupted for log {}", logKey, ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in report", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in report", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path path;
    try {
      path = Path.of(configPath);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config is not a valid path: " + configPath, ex);
    }
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("config file not found: " + configPath);
    }
    return YamlConfigLoader.load(path, MODE);
  }

  private static void closeMetrics(CompositionRoot root) {
    if (root.metrics() instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static void printDryRunPlan(ReportConfig config) {
    CliPrinter.printLines(
        "Report dry-run: no certificates will be scanned or stored.",
        " Log key          : " + Logs.truncate(config.logKey(), 128),
        " Scan input       : " + config.input(),
        " Scan batch size  : " + config.scanBatchSize(),
        " Queue capacity   : " + config.queueCapacity(),
        " Store mode       : " + config.storeMode(),
        " Output file      : " + (config.storeMode() == StoreMode.FILE ? config.output() : "<unused>"),
        " Kafka bootstrap  : " + config.kafkaBootstrap().orElse("<none>"),
        " Kafka topic      : " + (config.storeMode() == StoreMode.KAFKA ? config.kafkaTopic() : "<unused>"),
        " Re-run without --dry-run to start the report.");
  }
}
