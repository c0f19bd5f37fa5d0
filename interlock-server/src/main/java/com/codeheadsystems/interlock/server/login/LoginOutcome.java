package com.codeheadsystems.interlock.server.login;

import com.codeheadsystems.interlock.server.exceptions.LoginFaultException;

/**
 * Result of one run of the login driver. Exactly one of success, suspension on a challenge, or
 * failure.
 */
public sealed interface LoginOutcome
    permits LoginOutcome.Success, LoginOutcome.Suspended, LoginOutcome.Failed {

  /**
   * Session token of the attempt.
   *
   * @return the token
   */
  String sessionToken();

  /**
   * The login completed and the cookie blob has been written locally.
   *
   * @param sessionToken the token
   */
  record Success(String sessionToken) implements LoginOutcome {
  }

  /**
   * The login is waiting for the user to answer a challenge.
   *
   * @param sessionToken the token to resume with
   * @param challenge    what the user has to answer
   */
  record Suspended(String sessionToken, VerificationChallenge challenge) implements LoginOutcome {
  }

  /**
   * The attempt failed. The session is kept for the caller to clean up or retry.
   *
   * @param sessionToken the token
   * @param fault        why
   */
  record Failed(String sessionToken, LoginFaultException fault) implements LoginOutcome {
  }
}
