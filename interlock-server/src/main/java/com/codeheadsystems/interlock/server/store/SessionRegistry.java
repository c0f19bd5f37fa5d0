package com.codeheadsystems.interlock.server.store;

import com.codeheadsystems.interlock.server.login.ChallengeType;
import java.util.Optional;

/**
 * Storage abstraction for in-flight login sessions.
 * <p>
 * Implementations must be thread-safe, and every mutation must be atomic with respect to other
 * mutations of the same token. {@link #remove(String)} is the normal way a session ends; callers
 * remove the session once a login has succeeded or been abandoned.
 */
public interface SessionRegistry {

  /**
   * Registers a new session with no challenge pending.
   *
   * @param token    opaque session token
   * @param identity raw account handle
   * @param secret   account password
   * @param cookies  cookie blob reference for the login client
   * @return the stored session
   * @throws IllegalStateException if the token is already registered or the registry is full
   */
  LoginSession create(String token, String identity, String secret, CookieRef cookies);

  /**
   * Loads a session.
   *
   * @param token opaque session token
   * @return the session, or empty if unknown, removed or expired
   */
  Optional<LoginSession> get(String token);

  /**
   * Marks the session as suspended on a challenge. Idempotent.
   *
   * @param token opaque session token
   * @param type  kind of challenge raised
   * @return false if the session does not exist
   */
  boolean markChallenge(String token, ChallengeType type);

  /**
   * Queues a one-shot answer, replacing any answer not yet consumed, and clears the pending flag.
   *
   * @param token  opaque session token
   * @param answer the answer
   * @return false if the session does not exist
   */
  boolean setAnswer(String token, String answer);

  /**
   * Takes the queued answer out of the session, leaving the slot empty.
   *
   * @param token opaque session token
   * @return the answer, or empty if none is queued or the session does not exist
   */
  Optional<String> consumeAnswer(String token);

  /**
   * Removes a session.
   *
   * @param token opaque session token
   * @return true if a session was removed
   */
  boolean remove(String token);

  /**
   * Number of sessions currently held, expired ones not yet evicted included.
   *
   * @return the count
   */
  int size();
}
