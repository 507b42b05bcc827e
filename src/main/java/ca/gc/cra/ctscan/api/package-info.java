/**
 * Command-line entry points: {@link ca.gc.cra.ctscan.api.Main} dispatches to
 * {@link ca.gc.cra.ctscan.api.ReportCli}.
 */
package ca.gc.cra.ctscan.api;
