package io.github.wphillipmoore.unifi.client.options;

import java.nio.file.Path;
import java.util.Objects;

/**
 * TLS certificate verification policy for controller connections.
 *
 * <p>Controllers ship with a self-signed certificate, so verification is disabled by default.
 * Download the controller's certificate and use {@link #certificateBundle(Path)} to pin it. The
 * transport dispatches on the concrete type using {@code instanceof} pattern matching.
 */
public sealed interface VerifyPolicy
    permits VerifyPolicy.Disabled, VerifyPolicy.SystemTrust, VerifyPolicy.CertificateBundle {

  /** Accept any server certificate. */
  record Disabled() implements VerifyPolicy {}

  /** Verify against the JVM's default trust store. */
  record SystemTrust() implements VerifyPolicy {}

  /**
   * Verify against the certificates in a PEM bundle.
   *
   * @param path path to the PEM file, never null
   */
  record CertificateBundle(Path path) implements VerifyPolicy {

    /** Validates that path is non-null. */
    public CertificateBundle {
      Objects.requireNonNull(path, "path");
    }
  }

  /** Returns the policy that accepts any certificate. */
  static VerifyPolicy disabled() {
    return new Disabled();
  }

  /** Returns the policy that uses the JVM's default trust store. */
  static VerifyPolicy systemTrust() {
    return new SystemTrust();
  }

  /** Returns a policy that trusts the certificates in the given PEM bundle. */
  static VerifyPolicy certificateBundle(Path path) {
    return new CertificateBundle(path);
  }

  /**
   * Converts a raw {@code verify} option value to a policy.
   *
   * <p>{@code false} disables verification, {@code true} uses the system trust store, and a
   * {@link String} or {@link Path} names a PEM certificate bundle.
   *
   * @param value the raw option value
   * @return the matching policy
   * @throws IllegalArgumentException if the value has an unsupported type
   */
  static VerifyPolicy from(Object value) {
    Objects.requireNonNull(value, "verify");
    if (value instanceof VerifyPolicy policy) {
      return policy;
    }
    if (value instanceof Boolean enabled) {
      return enabled ? systemTrust() : disabled();
    }
    if (value instanceof Path path) {
      return certificateBundle(path);
    }
    if (value instanceof String path) {
      return certificateBundle(Path.of(path));
    }
    throw new IllegalArgumentException(
        "Unsupported verify option type: " + value.getClass().getName());
  }
}
