/**
 * Report pipeline: bounded hand-off channel, store writer loop and the cycle coordinator.
 * <p>{@link ca.gc.cra.ctscan.application.pipeline.CertDbReportUseCase} is the entry point; the channel
 * and writer are internal to one report instance.</p>
 */
package ca.gc.cra.ctscan.application.pipeline;
