/**
 * Thread construction helpers shared by application pipelines.
 * <p>Report writer threads follow the {@code certdb-writer-*} naming convention and are always joined by
 * the use case that started them.</p>
 */
package ca.gc.cra.ctscan.infrastructure.exec;
