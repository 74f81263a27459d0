package ca.gc.cra.filedrop.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for the {@code server=HOST:PORT} and {@code bind=ADDR} options.
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Host and port parsed from a {@code HOST:PORT} string. IPv6 hosts are stored without brackets.
   *
   * @param host hostname or address literal
   * @param port TCP port in {@code [1, 65535]}
   */
  public record HostPort(String host, int port) {
    @Override
    public String toString() {
      return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ':' + port;
    }
  }

  /**
   * Parses a host:port string supporting hostnames, IPv4, and bracketed IPv6 literals.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @return parsed endpoint
   * @throws IllegalArgumentException on malformed input
   */
  public static HostPort parseHostPort(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException(name + " must close IPv6 literal with ']'");
      }
      host = sanitized.substring(1, idx);
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException(name + " must include :<port> after IPv6 literal");
      }
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException(name + " must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
    }
    int port = Numbers.parseInt(name + " port", portPart, 1, 65535);
    return new HostPort(host, port);
  }

  /**
   * Validates a listen address: a hostname, an IPv4 literal, or an IPv6 literal with or without brackets.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate address
   * @return address with any IPv6 brackets removed
   * @throws IllegalArgumentException on malformed input
   */
  public static String validateBindAddress(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
    } else {
      validateHost(sanitized);
    }
    return sanitized;
  }

  /**
   * Validates an {@code http} or {@code https} endpoint URI such as an OTLP collector address.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate URI
   * @return trimmed URI text
   * @throws IllegalArgumentException if the URI is malformed, has another scheme, or has no host
   */
  public static String requireHttpEndpoint(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    try {
      URI uri = new URI(sanitized);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(name + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(name + " must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    return sanitized;
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return;
    }
    validateHostname(host);
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  // JDK parsing of a literal never performs a DNS lookup.
  private static void validateIpv6(String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
