package io.github.wphillipmoore.unifi.client;

/** HTTP methods issued against the controller API. */
public enum HttpMethod {
  GET,
  POST,
  PUT
}
