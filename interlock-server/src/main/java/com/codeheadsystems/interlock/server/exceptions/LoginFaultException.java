package com.codeheadsystems.interlock.server.exceptions;

/**
 * Base type for the hard failures a login attempt can end in.
 * <p>
 * A verification challenge is not a fault and is never reported through this hierarchy.
 */
public abstract class LoginFaultException extends RuntimeException {

  protected LoginFaultException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
