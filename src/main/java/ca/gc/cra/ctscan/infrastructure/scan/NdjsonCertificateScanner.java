package ca.gc.cra.ctscan.infrastructure.scan;

import ca.gc.cra.ctscan.application.port.CertificateScanner;
import ca.gc.cra.ctscan.domain.cert.CertificateDescriptor;
import ca.gc.cra.ctscan.domain.cert.Observation;
import ca.gc.cra.ctscan.domain.cert.ScanResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scanner reading pre-scanned certificates from an NDJSON file and delivering them in fixed-size batches.
 * <p>Each non-blank line is an object
 * {@code {"index":<n>,"descriptor":"<base64>","observations":[{"check":..,"description":..,"details":..}]}};
 * {@code observations} is optional and unknown fields are skipped. The last batch may be smaller than
 * the batch size; an empty file produces no callbacks.</p>
 * <p>Listener calls happen on the thread invoking {@link #scan(BatchListener)}.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonCertificateScanner implements CertificateScanner {
  private static final Logger log = LoggerFactory.getLogger(NdjsonCertificateScanner.class);

  private final Path input;
  private final int batchSize;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a scanner over {@code input}.
   *
   * @param input NDJSON file of scan results
   * @param batchSize maximum results per listener call; must be positive
   */
  public NdjsonCertificateScanner(Path input, int batchSize) {
    this.input = Objects.requireNonNull(input, "input");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive (was " + batchSize + ")");
    }
    this.batchSize = batchSize;
  }

  /**
   * Reads the file and hands results to {@code listener} in batches.
   *
   * @throws IOException if the file cannot be read or a line is not a valid scan record
   * @throws Exception whatever the listener throws, unchanged
   */
  @Override
  public void scan(BatchListener listener) throws Exception {
    Objects.requireNonNull(listener, "listener");
    List<ScanResult> pending = new ArrayList<>(batchSize);
    long lineNumber = 0;
    long batches = 0;
    try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        pending.add(parseLine(line, lineNumber));
        if (pending.size() == batchSize) {
          listener.onBatch(List.copyOf(pending));
          pending.clear();
          batches++;
        }
      }
    }
    if (!pending.isEmpty()) {
      listener.onBatch(List.copyOf(pending));
      batches++;
    }
    log.info("Scanned {} lines from {} into {} batches", lineNumber, input, batches);
  }

  private ScanResult parseLine(String line, long lineNumber) throws IOException {
    try (JsonParser parser = jsonFactory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw malformed(lineNumber, "expected JSON object");
      }
      Long index = null;
      String descriptor = null;
      List<Observation> observations = List.of();
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "index":
            if (value != JsonToken.VALUE_NUMBER_INT) {
              throw malformed(lineNumber, "index must be an integer");
            }
            index = parser.getLongValue();
            break;
          case "descriptor":
            if (value != JsonToken.VALUE_STRING) {
              throw malformed(lineNumber, "descriptor must be a base64 string");
            }
            descriptor = parser.getText();
            break;
          case "observations":
            observations = readObservations(parser, value, lineNumber);
            break;
          default:
            parser.skipChildren();
        }
      }
      if (index == null || descriptor == null) {
        throw malformed(lineNumber, "index and descriptor are required");
      }
      return new ScanResult(CertificateDescriptor.fromBase64(descriptor), index, observations);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new IOException("Malformed scan record at " + input + ":" + lineNumber, ex);
    }
  }

  private List<Observation> readObservations(JsonParser parser, JsonToken start, long lineNumber)
      throws IOException {
    if (start == JsonToken.VALUE_NULL) {
      return List.of();
    }
    if (start != JsonToken.START_ARRAY) {
      throw malformed(lineNumber, "observations must be an array");
    }
    List<Observation> observations = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token != JsonToken.START_OBJECT) {
        throw malformed(lineNumber, "observation must be an object");
      }
      String check = null;
      String description = null;
      String details = null;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        parser.nextToken();
        switch (field) {
          case "check":
            check = valueAsText(parser);
            break;
          case "description":
            description = valueAsText(parser);
            break;
          case "details":
            details = valueAsText(parser);
            break;
          default:
            parser.skipChildren();
        }
      }
      if (check == null) {
        throw malformed(lineNumber, "observation check is required");
      }
      observations.add(new Observation(check, description, details));
    }
    return observations;
  }

  /** Scalars as their text; objects and arrays as compact JSON. The parser ends on the value's last token. */
  private String valueAsText(JsonParser parser) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (!token.isStructStart()) {
      return parser.getValueAsString();
    }
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = jsonFactory.createGenerator(out)) {
      generator.copyCurrentStructure(parser);
    }
    return out.toString();
  }

  private IOException malformed(long lineNumber, String reason) {
    return new IOException("Malformed scan record at " + input + ":" + lineNumber + ": " + reason);
  }
}
