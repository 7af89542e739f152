package io.github.wphillipmoore.unifi.client;

import io.github.wphillipmoore.unifi.client.command.CommandEnvelope;
import io.github.wphillipmoore.unifi.client.command.GuestAuthorization;
import java.util.Map;
import java.util.Objects;

/**
 * Station manager commands, sent as command envelopes to {@code /api/s/{site}/cmd/stamgr}.
 *
 * <p>Site identifiers and MAC addresses are passed through unvalidated; the controller rejects
 * malformed values with an ordinary HTTP error.
 */
public final class CommandApi {

  static final String AUTHORIZE_GUEST = "authorize-guest";
  static final String UNAUTHORIZE_GUEST = "unauthorize-guest";
  static final String KICK_STATION = "kick-sta";

  private final RequestDispatcher dispatcher;

  /**
   * Creates the command API.
   *
   * @param dispatcher the dispatcher that sends the envelopes
   */
  public CommandApi(RequestDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  /**
   * Sends an arbitrary station manager command.
   *
   * @param site the site identifier, e.g. {@code "default"}
   * @param envelope the command envelope
   * @return the raw response
   */
  public TransportResponse execute(String site, CommandEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    return dispatcher.post(stationManagerPath(site), envelope.toPayload());
  }

  /**
   * Authorizes a guest client by MAC address.
   *
   * @param site the site identifier
   * @param mac the guest's MAC address
   * @param minutes how long the authorization lasts
   * @return the raw response
   */
  public TransportResponse authorizeGuest(String site, String mac, int minutes) {
    return authorizeGuest(site, mac, minutes, Map.of());
  }

  /**
   * Authorizes a guest client with typed limits.
   *
   * @param site the site identifier
   * @param mac the guest's MAC address
   * @param minutes how long the authorization lasts
   * @param limits upload, download and quota limits
   * @return the raw response
   */
  public TransportResponse authorizeGuest(
      String site, String mac, int minutes, GuestAuthorization limits) {
    Objects.requireNonNull(limits, "limits");
    return authorizeGuest(site, mac, minutes, limits.toParameters());
  }

  /**
   * Authorizes a guest client with extra command fields.
   *
   * <p>The envelope is {@code {cmd: "authorize-guest", mac, minutes}} with {@code extra} applied
   * on top; an extra field named {@code mac} or {@code minutes} replaces the argument value.
   *
   * @param site the site identifier
   * @param mac the guest's MAC address
   * @param minutes how long the authorization lasts
   * @param extra extra fields such as {@code up}, {@code down} (kbps) or {@code bytes} (MB)
   * @return the raw response
   */
  public TransportResponse authorizeGuest(
      String site, String mac, int minutes, Map<String, ?> extra) {
    CommandEnvelope envelope =
        CommandEnvelope.of(AUTHORIZE_GUEST)
            .with("mac", mac)
            .with("minutes", minutes)
            .overlay(extra);
    return execute(site, envelope);
  }

  /**
   * Revokes a guest client's authorization.
   *
   * @param site the site identifier
   * @param mac the guest's MAC address
   * @return the raw response
   */
  public TransportResponse unauthorizeGuest(String site, String mac) {
    return execute(site, CommandEnvelope.of(UNAUTHORIZE_GUEST).with("mac", mac));
  }

  /**
   * Disconnects a client so that it reconnects.
   *
   * @param site the site identifier
   * @param mac the client's MAC address
   * @return the raw response
   */
  public TransportResponse reconnectClient(String site, String mac) {
    return execute(site, CommandEnvelope.of(KICK_STATION).with("mac", mac));
  }

  static String stationManagerPath(String site) {
    return "/api/s/" + Objects.requireNonNull(site, "site") + "/cmd/stamgr";
  }
}
