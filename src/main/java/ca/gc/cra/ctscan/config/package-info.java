/**
 * Configuration model, loaders and the composition root for the reporter CLI.
 * <p>Sources are merged with precedence CLI &gt; YAML &gt; defaults, then validated by
 * {@link ca.gc.cra.ctscan.config.ReportConfig}.</p>
 */
package ca.gc.cra.ctscan.config;
