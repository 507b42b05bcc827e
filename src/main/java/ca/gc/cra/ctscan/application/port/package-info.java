/**
 * Ports connecting the certificate report to its external collaborators.
 * <p>The scan pipeline feeds batches in through {@link ca.gc.cra.ctscan.application.port.CertificateScanner};
 * stores receive them through {@link ca.gc.cra.ctscan.application.port.CertStorePort}; metrics flow out through
 * {@link ca.gc.cra.ctscan.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ctscan.application.port;
