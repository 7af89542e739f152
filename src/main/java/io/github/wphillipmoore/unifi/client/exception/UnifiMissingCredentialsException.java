package io.github.wphillipmoore.unifi.client.exception;

/**
 * Thrown when a relogin is attempted but no username or password was supplied and none was
 * stored by an earlier login.
 */
public final class UnifiMissingCredentialsException extends UnifiException {

  private static final long serialVersionUID = 1L;

  private final String missingField;

  /**
   * Creates a missing-credentials exception.
   *
   * @param missingField the credential field that could not be resolved
   */
  public UnifiMissingCredentialsException(String missingField) {
    super("No " + missingField + " supplied and none stored from a previous login");
    this.missingField = missingField;
  }

  /** Returns the credential field that could not be resolved ("username" or "password"). */
  public String getMissingField() {
    return missingField;
  }
}
