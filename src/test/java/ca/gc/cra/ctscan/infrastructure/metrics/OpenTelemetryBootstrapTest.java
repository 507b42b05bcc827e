package ca.gc.cra.ctscan.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.resources.Resource;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=prod, team = pki ,broken,=x,y=");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("pki", attributes.get(AttributeKey.stringKey("team")));
    assertNull(attributes.get(AttributeKey.stringKey("broken")));
  }

  @Test
  void blankResourceAttributesAreEmpty() {
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes("  ").isEmpty());
  }

  @Test
  void resourceCarriesServiceIdentityAndExtraAttributes() {
    Resource resource = OpenTelemetryBootstrap.buildResource(
        "1.2.3", Attributes.of(AttributeKey.stringKey("deployment.environment"), "test"));

    assertEquals("ctscan", resource.getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", resource.getAttribute(AttributeKey.stringKey("service.namespace")));
    assertEquals("1.2.3", resource.getAttribute(AttributeKey.stringKey("service.version")));
    assertEquals("test", resource.getAttribute(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void exporterModeDefaultsToOtlp() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(" None "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(""));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("zipkin"));
  }
}
