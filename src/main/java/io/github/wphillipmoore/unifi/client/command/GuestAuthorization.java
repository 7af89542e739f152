package io.github.wphillipmoore.unifi.client.command;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Optional limits for an {@code authorize-guest} command.
 *
 * <p>Unset limits are left out of the command. Additional fields not modelled here are sent as
 * given and, like the limits, win over the command's fixed fields of the same name.
 */
public final class GuestAuthorization {

  private final @Nullable Integer up;
  private final @Nullable Integer down;
  private final @Nullable Integer bytes;
  private final @Nullable String apMac;
  private final Map<String, Object> additional;

  private GuestAuthorization(Builder builder) {
    this.up = builder.up;
    this.down = builder.down;
    this.bytes = builder.bytes;
    this.apMac = builder.apMac;
    this.additional = new LinkedHashMap<>(builder.additional);
  }

  /** Returns an authorization with no extra limits. */
  public static GuestAuthorization none() {
    return builder().build();
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the upload limit in kbps, or {@code null} if unlimited. */
  public @Nullable Integer getUp() {
    return up;
  }

  /** Returns the download limit in kbps, or {@code null} if unlimited. */
  public @Nullable Integer getDown() {
    return down;
  }

  /** Returns the data quota in MB, or {@code null} if unlimited. */
  public @Nullable Integer getBytes() {
    return bytes;
  }

  /** Returns the access point MAC the guest is bound to, or {@code null}. */
  public @Nullable String getApMac() {
    return apMac;
  }

  /** Renders the set fields as command parameters, limits first, then additional fields. */
  public Map<String, Object> toParameters() {
    Map<String, Object> parameters = new LinkedHashMap<>();
    if (up != null) {
      parameters.put("up", up);
    }
    if (down != null) {
      parameters.put("down", down);
    }
    if (bytes != null) {
      parameters.put("bytes", bytes);
    }
    if (apMac != null) {
      parameters.put("ap_mac", apMac);
    }
    parameters.putAll(additional);
    return parameters;
  }

  /** Builder for {@link GuestAuthorization}. */
  public static final class Builder {

    private @Nullable Integer up;
    private @Nullable Integer down;
    private @Nullable Integer bytes;
    private @Nullable String apMac;
    private final Map<String, Object> additional = new LinkedHashMap<>();

    private Builder() {}

    /** Sets the upload limit in kbps. */
    public Builder up(int kbps) {
      this.up = kbps;
      return this;
    }

    /** Sets the download limit in kbps. */
    public Builder down(int kbps) {
      this.down = kbps;
      return this;
    }

    /** Sets the data quota in MB. */
    public Builder bytes(int megabytes) {
      this.bytes = megabytes;
      return this;
    }

    /** Sets the access point MAC the guest is bound to. */
    public Builder apMac(String apMac) {
      this.apMac = Objects.requireNonNull(apMac, "apMac");
      return this;
    }

    /** Adds a field not modelled by this class. */
    public Builder field(String name, Object value) {
      additional.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    /** Builds the authorization. */
    public GuestAuthorization build() {
      return new GuestAuthorization(this);
    }
  }
}
