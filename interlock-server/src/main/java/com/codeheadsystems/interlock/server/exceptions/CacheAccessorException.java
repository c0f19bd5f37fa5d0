package com.codeheadsystems.interlock.server.exceptions;

/**
 * Failure talking to the remote cookie cache tier.
 * <p>
 * Always recovered inside the credential cache: a failed read is treated as a miss and a failed
 * write or delete as a no-op.
 */
public class CacheAccessorException extends RuntimeException {

  /**
   * Instantiates a new Cache accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CacheAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
