package com.codeheadsystems.interlock.model.auth;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported to the caller of the authentication endpoints.
 */
public enum AuthStatus {

  /**
   * Login finished; the credential bundle has been persisted.
   */
  SUCCESS("success"),

  /**
   * Login is suspended on a verification challenge and expects a follow-up
   * {@code POST /auth/challenge} with the same session token.
   */
  CHALLENGE("challenge");

  private final String wireName;

  AuthStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
