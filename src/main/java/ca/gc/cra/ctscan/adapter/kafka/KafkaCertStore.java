package ca.gc.cra.ctscan.adapter.kafka;

import ca.gc.cra.ctscan.application.port.CertStorePort;
import ca.gc.cra.ctscan.domain.cert.CertBatch;
import ca.gc.cra.ctscan.domain.cert.CertEntry;
import ca.gc.cra.ctscan.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CertStorePort} publishing each certificate batch as one Kafka message.
 * <p><strong>Why:</strong> Lets a remote certificate database ingest report output.</p>
 * <p><strong>Role:</strong> Infrastructure adapter on the sink side of the report.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize the batch as {@code {"log":..,"count":n,"entries":[{"index":..,"descriptor":"<base64>"}]}}.</li>
 *   <li>Key messages by log so batches of one log stay ordered within a partition.</li>
 *   <li>Wait for the broker acknowledgement so a failed send fails {@code storeBatch}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KafkaCertStore implements CertStorePort {
  private static final Logger log = LoggerFactory.getLogger(KafkaCertStore.class);
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(30);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a store publishing to {@code topic} on the given cluster.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic destination topic; must be a valid Kafka topic name
   * @throws IllegalArgumentException if either argument is blank or the topic is invalid
   */
  public KafkaCertStore(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaCertStore(Producer<String, byte[]> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
  }

  /**
   * Publishes the batch and waits for the acknowledgement.
   *
   * @throws Exception the send failure reported by the producer, or a timeout after 30 seconds
   */
  @Override
  public void storeBatch(CertBatch batch, String logKey) throws Exception {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(logKey, "logKey");
    ProducerRecord<String, byte[]> message = new ProducerRecord<>(topic, logKey, serialize(batch, logKey));
    try {
      RecordMetadata metadata = producer.send(message).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Published {} certificates to {}-{}@{}",
          batch.size(), metadata.topic(), metadata.partition(), metadata.offset());
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof Exception failure) {
        throw failure;
      }
      throw ex;
    }
  }

  @Override
  public void flush() {
    producer.flush();
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  byte[] serialize(CertBatch batch, String logKey) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(64 + batch.size() * 96);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("log", logKey);
      gen.writeNumberField("count", batch.size());
      gen.writeArrayFieldStart("entries");
      for (CertEntry entry : batch.entries()) {
        gen.writeStartObject();
        gen.writeNumberField("index", entry.index());
        gen.writeStringField("descriptor", entry.descriptor().toBase64());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("kafkaBootstrap", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
