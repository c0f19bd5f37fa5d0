package com.codeheadsystems.interlock.server.exceptions;

/**
 * The session token is unknown, expired or already removed.
 */
public class InvalidSessionException extends LoginFaultException {

  /**
   * Instantiates a new Invalid session exception.
   *
   * @param message the message
   */
  public InvalidSessionException(final String message) {
    super(message, null);
  }
}
