/**
 * Domain types describing scanned certificates and the batches handed to certificate stores.
 * <p><strong>Role:</strong> Values flowing from the scan pipeline through the report channel into store adapters.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Descriptors are opaque certificate encodings; adapters must not log them verbatim.</p>
 */
package ca.gc.cra.ctscan.domain.cert;
