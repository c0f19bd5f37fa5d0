package com.codeheadsystems.interlock.server.store;

import com.codeheadsystems.interlock.server.login.ChallengeType;
import java.time.Instant;

/**
 * State of one in-flight login attempt, keyed by its session token.
 * <p>
 * Immutable; the registry replaces the whole record on every change.
 *
 * @param token            opaque session token
 * @param identity         raw account handle the attempt was started with
 * @param secret           account password, needed to re-run the login on resume
 * @param cookies          local cookie blob handed to the login client
 * @param createdAt        when the attempt was started
 * @param challengePending whether the attempt is suspended on a challenge (informational)
 * @param challengeType    kind of the last challenge raised, or null
 * @param answer           queued one-shot answer, or null
 */
public record LoginSession(
    String token,
    String identity,
    String secret,
    CookieRef cookies,
    Instant createdAt,
    boolean challengePending,
    ChallengeType challengeType,
    String answer) {

  /**
   * Creates a fresh session with no challenge and no answer.
   *
   * @param token     the token
   * @param identity  the identity
   * @param secret    the secret
   * @param cookies   the cookies
   * @param createdAt the created at
   * @return the login session
   */
  public static LoginSession open(String token, String identity, String secret, CookieRef cookies,
                                  Instant createdAt) {
    return new LoginSession(token, identity, secret, cookies, createdAt, false, null, null);
  }

  LoginSession withChallenge(ChallengeType type) {
    return new LoginSession(token, identity, secret, cookies, createdAt, true, type, answer);
  }

  LoginSession withAnswer(String newAnswer) {
    return new LoginSession(token, identity, secret, cookies, createdAt, false, challengeType, newAnswer);
  }

  LoginSession withoutAnswer() {
    return new LoginSession(token, identity, secret, cookies, createdAt, challengePending, challengeType, null);
  }

  @Override
  public String toString() {
    return "LoginSession[token=" + token + ", identity=" + identity
        + ", challengePending=" + challengePending + ", challengeType=" + challengeType
        + ", answerQueued=" + (answer != null) + "]";
  }
}
