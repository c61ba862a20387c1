package io.hookline.registry;

import io.hookline.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Validates subscription target URLs.
 *
 * <p>A target must be an absolute {@code http} or {@code https} URL with a host. Unless
 * private targets are allowed, hosts naming loopback, link-local or RFC 1918 addresses are
 * rejected. The check is lexical; host names are not resolved.
 */
public final class TargetUrlValidator {
  static final int MAX_URL_LENGTH = 2048;

  private final boolean allowPrivateTargets;

  public TargetUrlValidator(boolean allowPrivateTargets) {
    this.allowPrivateTargets = allowPrivateTargets;
  }

  /**
   * @param url candidate target URL
   * @return the trimmed URL
   * @throws ValidationException if the URL is missing, malformed or blocked
   */
  public String validate(String url) {
    if (url == null || url.isBlank()) {
      throw new ValidationException("url is required");
    }
    String trimmed = url.trim();
    if (trimmed.length() > MAX_URL_LENGTH) {
      throw new ValidationException("url must be at most " + MAX_URL_LENGTH + " characters");
    }
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      throw new ValidationException("Invalid URL format: " + trimmed);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new ValidationException("url must use http or https");
    }
    String host = uri.getHost();
    if (host == null || host.isEmpty()) {
      throw new ValidationException("Invalid URL format: " + trimmed);
    }
    if (!allowPrivateTargets && isPrivateHost(host)) {
      throw new ValidationException("Cannot use localhost or private IP addresses");
    }
    return trimmed;
  }

  public boolean allowPrivateTargets() {
    return allowPrivateTargets;
  }

  static boolean isPrivateHost(String rawHost) {
    String host = rawHost.toLowerCase(Locale.ROOT);
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    if (host.equals("localhost") || host.endsWith(".localhost")) {
      return true;
    }
    if (host.equals("::1") || host.equals("::") || host.startsWith("fe80:")
        || host.startsWith("fc") || host.startsWith("fd")) {
      return host.contains(":");
    }
    int[] octets = ipv4Octets(host);
    if (octets == null) {
      return false;
    }
    int a = octets[0];
    int b = octets[1];
    return a == 127
        || a == 10
        || a == 0
        || (a == 192 && b == 168)
        || (a == 172 && b >= 16 && b <= 31)
        || (a == 169 && b == 254);
  }

  private static int[] ipv4Octets(String host) {
    String[] parts = host.split("\\.", -1);
    if (parts.length != 4) {
      return null;
    }
    int[] octets = new int[4];
    for (int i = 0; i < 4; i++) {
      String part = parts[i];
      if (part.isEmpty() || part.length() > 3) {
        return null;
      }
      for (int c = 0; c < part.length(); c++) {
        if (!Character.isDigit(part.charAt(c))) {
          return null;
        }
      }
      octets[i] = Integer.parseInt(part);
      if (octets[i] > 255) {
        return null;
      }
    }
    return octets;
  }
}
