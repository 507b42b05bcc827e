package ca.gc.cra.ctscan.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for Kafka bootstrap lists.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {}

  /**
   * Validates a comma-separated list of {@code host:port} endpoints.
   *
   * @param name parameter name for diagnostics
   * @param value endpoints such as {@code broker1:9092,[::1]:9093}
   * @return normalized list joined by commas, without whitespace
   * @throws IllegalArgumentException if the list is empty or any endpoint is invalid
   */
  public static String validateBootstrapServers(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    List<String> endpoints = new ArrayList<>();
    for (String part : sanitized.split(",")) {
      if (!part.isBlank()) {
        endpoints.add(validateHostPort(part));
      }
    }
    if (endpoints.isEmpty()) {
      throw new IllegalArgumentException(name + " must list at least one host:port");
    }
    return String.join(",", endpoints);
  }

  /**
   * Validates a single {@code host:port}; IPv6 literals must be bracketed.
   *
   * @param value candidate endpoint
   * @return normalized endpoint
   * @throws IllegalArgumentException if host or port is invalid
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      if (close + 2 > sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      host = sanitized.substring(1, close);
      portPart = sanitized.substring(close + 2);
      validateIpv6(host);
      host = '[' + host + ']';
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      portPart = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        validateIpv4(host);
      } else {
        validateHostname(host);
      }
    }
    int port = Numbers.parseIntInRange("port", portPart, 1, 65535);
    return host + ':' + port;
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!isAsciiAlnum(c) && c != '-') {
          throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
        }
      }
    }
  }

  private static void validateIpv4(String host) {
    for (String octet : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
