/**
 * Kafka adapters for publishing report output.
 * <p>Producers are created with {@code acks=all}; tests substitute {@code MockProducer} through the
 * package-private constructors.</p>
 */
package ca.gc.cra.ctscan.adapter.kafka;
