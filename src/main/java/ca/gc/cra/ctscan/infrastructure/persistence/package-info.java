/**
 * Certificate store adapters backed by memory and local NDJSON files.
 * <p>Kafka publishing lives in {@code ca.gc.cra.ctscan.adapter.kafka}.</p>
 */
package ca.gc.cra.ctscan.infrastructure.persistence;
