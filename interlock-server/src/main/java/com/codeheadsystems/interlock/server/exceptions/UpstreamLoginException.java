package com.codeheadsystems.interlock.server.exceptions;

/**
 * Any other failure raised by the login client: rejected credentials, transport errors,
 * protocol drift. The original cause is preserved.
 */
public class UpstreamLoginException extends LoginFaultException {

  /**
   * Instantiates a new Upstream login exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public UpstreamLoginException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
