package com.codeheadsystems.interlock.server.login;

/**
 * Kinds of out-of-band verification the upstream login can demand.
 */
public enum ChallengeType {

  /**
   * A code was sent to the account's address and must be typed back.
   */
  CONFIRMATION_CODE("confirmation_code"),

  /**
   * The user must confirm the account's email address or otherwise verify their identity.
   */
  EMAIL_VERIFICATION("email_verification");

  private final String wireName;

  ChallengeType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Name used on the wire.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }
}
