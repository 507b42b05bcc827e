/**
 * OpenTelemetry-backed metrics for the report pipeline.
 */
package ca.gc.cra.ctscan.infrastructure.metrics;
