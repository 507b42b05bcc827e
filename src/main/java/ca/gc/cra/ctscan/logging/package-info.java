/**
 * Logging helpers shared by the CLI and adapters.
 */
package ca.gc.cra.ctscan.logging;
