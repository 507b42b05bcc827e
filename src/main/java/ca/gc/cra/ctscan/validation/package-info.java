/**
 * <strong>Purpose:</strong> Validation helpers used while parsing CLI arguments and configuration.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> No logging; failures surface as {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ctscan.validation;
