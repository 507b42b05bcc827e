package ca.gc.cra.ctscan.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ctscan.domain.cert.CertBatch;
import ca.gc.cra.ctscan.testutil.ScanFixtures;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonFileCertStoreTest {
  @TempDir Path tempDir;

  @Test
  void writesOneLinePerCertificate() throws Exception {
    Path out = tempDir.resolve("nested/dir/certs.ndjson");
    try (NdjsonFileCertStore store = new NdjsonFileCertStore(out)) {
      store.storeBatch(CertBatch.fromResults(ScanFixtures.batch(7, 2)), "log-a");
    }

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    String descriptor = Base64.getEncoder().encodeToString("cert-7".getBytes(StandardCharsets.UTF_8));
    assertEquals(2, lines.size());
    assertEquals("{\"log\":\"log-a\",\"index\":7,\"descriptor\":\"" + descriptor + "\"}", lines.get(0));
    assertTrue(lines.get(1).contains("\"index\":8"));
  }

  @Test
  void batchIsVisibleOnDiskBeforeClose() throws Exception {
    Path out = tempDir.resolve("certs.ndjson");
    NdjsonFileCertStore store = new NdjsonFileCertStore(out);
    try {
      store.storeBatch(CertBatch.fromResults(ScanFixtures.batch(0, 3)), "log-a");
      assertEquals(3, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    } finally {
      store.close();
    }
  }

  @Test
  void appendsAcrossStoreInstances() throws Exception {
    Path out = tempDir.resolve("certs.ndjson");
    try (NdjsonFileCertStore first = new NdjsonFileCertStore(out)) {
      first.storeBatch(CertBatch.fromResults(ScanFixtures.batch(0, 1)), "log-a");
    }
    try (NdjsonFileCertStore second = new NdjsonFileCertStore(out)) {
      second.storeBatch(CertBatch.fromResults(ScanFixtures.batch(1, 1)), "log-b");
    }

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).startsWith("{\"log\":\"log-a\""));
    assertTrue(lines.get(1).startsWith("{\"log\":\"log-b\""));
  }

  @Test
  void closeWithoutWritesCreatesNothing() throws Exception {
    Path out = tempDir.resolve("untouched.ndjson");
    new NdjsonFileCertStore(out).close();

    assertFalse(Files.exists(out));
  }

  @Test
  void failedWriteReopensFileAndStartsOnFreshLine() throws Exception {
    Path out = tempDir.resolve("certs.ndjson");
    AtomicInteger opens = new AtomicInteger();
    NdjsonFileCertStore store = new NdjsonFileCertStore(out, target ->
        opens.incrementAndGet() == 1 ? tearingWriter(target) : appendWriter(target));

    try {
      IOException ex = assertThrows(IOException.class,
          () -> store.storeBatch(CertBatch.fromResults(ScanFixtures.batch(0, 1)), "log-a"));
      assertEquals("device full", ex.getMessage());

      store.storeBatch(CertBatch.fromResults(ScanFixtures.batch(1, 2)), "log-a");
    } finally {
      store.close();
    }

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(2, opens.get());
    assertEquals(3, lines.size());
    assertFalse(lines.get(0).endsWith("}"), "first line is the torn record");
    assertTrue(lines.get(1).startsWith("{\"log\":\"log-a\",\"index\":1,"));
    assertTrue(lines.get(2).startsWith("{\"log\":\"log-a\",\"index\":2,"));
    assertTrue(lines.get(2).endsWith("}"));
  }

  private static Writer appendWriter(Path target) throws IOException {
    return Files.newBufferedWriter(
        target, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  /** Writes half of each chunk to disk, then fails. */
  private static Writer tearingWriter(Path target) throws IOException {
    Writer delegate = appendWriter(target);
    return new Writer() {
      @Override
      public void write(char[] cbuf, int off, int len) throws IOException {
        delegate.write(cbuf, off, len / 2);
        delegate.flush();
        throw new IOException("device full");
      }

      @Override
      public void flush() throws IOException {
        delegate.flush();
      }

      @Override
      public void close() throws IOException {
        delegate.close();
      }
    };
  }
}
