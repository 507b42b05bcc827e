package ca.gc.cra.ctscan.infrastructure.persistence;

import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.domain.cert.CertBatch;
import ca.gc.cra.ctscan.domain.cert.CertEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends stored certificates to an NDJSON file, one object per certificate:
 * {@code {"log":"<logKey>","index":<n>,"descriptor":"<base64>"}}.
 * <p>The file is opened on the first batch with CREATE+APPEND, so earlier cycles are preserved. Each
 * batch is rendered in memory, written in one call and flushed before
 * {@link #storeBatch(CertBatch, String)} returns. A failed write closes the file; the next batch
 * reopens it and starts on a new line, so a torn batch never merges with the next one.</p>
 * <p>Thread-safe via synchronization; the report calls it from a single writer thread.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonFileCertStore implements CertStorePort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonFileCertStore.class);

  private final Path file;
  private final JsonFactory jsonFactory = new JsonFactory();
  private final WriterOpener opener;
  private Writer writer;
  private long linesWritten;

  /**
   * Creates a store writing to {@code file}; parent directories are created on first write.
   *
   * @param file target NDJSON file
   */
  public NdjsonFileCertStore(Path file) {
    this(file, target -> Files.newBufferedWriter(
        target, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND));
  }

  NdjsonFileCertStore(Path file, WriterOpener opener) {
    this.file = Objects.requireNonNull(file, "file");
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  @Override
  public synchronized void storeBatch(CertBatch batch, String logKey) throws IOException {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(logKey, "logKey");
    String lines = render(batch, logKey);
    boolean torn = writer == null && endsMidLine();
    Writer out = open();
    try {
      if (torn) {
        out.write('\n');
        log.warn("Terminated a partial line left in {} by an earlier failed write", file);
      }
      out.write(lines);
      out.flush();
    } catch (IOException ex) {
      discardWriter(ex);
      throw ex;
    }
    linesWritten += batch.size();
  }

  @Override
  public synchronized void flush() throws IOException {
    if (writer != null) {
      writer.flush();
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
      log.info("Closed {} after writing {} certificates", file, linesWritten);
    } finally {
      writer = null;
    }
  }

  /**
   * Returns the output file.
   *
   * @return NDJSON path
   */
  public Path file() {
    return file;
  }

  private String render(CertBatch batch, String logKey) throws IOException {
    StringWriter buffer = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(buffer)) {
      gen.setRootValueSeparator(null);
      for (CertEntry entry : batch.entries()) {
        gen.writeStartObject();
        gen.writeStringField("log", logKey);
        gen.writeNumberField("index", entry.index());
        gen.writeStringField("descriptor", entry.descriptor().toBase64());
        gen.writeEndObject();
        gen.writeRaw('\n');
      }
    }
    return buffer.toString();
  }

  private Writer open() throws IOException {
    if (writer == null) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = opener.open(file);
      log.debug("Opened certificate output {}", file);
    }
    return writer;
  }

  private boolean endsMidLine() throws IOException {
    if (!Files.isRegularFile(file) || Files.size(file) == 0) {
      return false;
    }
    try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
      ByteBuffer last = ByteBuffer.allocate(1);
      channel.position(channel.size() - 1);
      channel.read(last);
      return last.get(0) != '\n';
    }
  }

  private void discardWriter(IOException failure) {
    Writer broken = writer;
    writer = null;
    try {
      broken.close();
    } catch (IOException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
    log.warn("Write to {} failed; the file will be reopened for the next batch", file);
  }

  /** Opens the append writer for the output file. */
  @FunctionalInterface
  interface WriterOpener {
    Writer open(Path file) throws IOException;
  }
}
