/**
 * File-based scan sources feeding the report pipeline.
 */
package ca.gc.cra.ctscan.infrastructure.scan;
