package com.codeheadsystems.interlock.server.manager;

import com.codeheadsystems.interlock.server.login.LoginOutcome;
import com.codeheadsystems.interlock.server.store.CookieCache;
import com.codeheadsystems.interlock.server.store.CookieRef;
import com.codeheadsystems.interlock.server.store.LoginSession;
import com.codeheadsystems.interlock.server.store.SessionRegistry;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the start-auth and submit-challenge endpoints.
 * <p>
 * Owns token generation and the success hand-off the login driver leaves to its caller: once a
 * run succeeds the cookie blob is pushed through the {@link CookieCache} and the session is
 * removed. Framework adapters ({@code AuthResource} for JAX-RS / Dropwizard) only translate
 * outcomes and exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: missing request data → HTTP 400</li>
 *   <li>{@link IllegalStateException}: session registry at capacity → HTTP 503</li>
 * </ul>
 * Login failures are never thrown; they come back as {@link LoginOutcome.Failed}.
 */
public class AuthenticationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationManager.class);

  private final ChallengeLoginManager loginManager;
  private final CookieCache cookieCache;
  private final SessionRegistry registry;
  private final boolean cleanupLocalAfterSave;

  /**
   * Instantiates a new Authentication manager.
   *
   * @param loginManager          the login driver
   * @param cookieCache           the cookie cache
   * @param registry              the session registry the driver uses
   * @param cleanupLocalAfterSave delete the local cookie copy once it has been pushed remotely
   */
  public AuthenticationManager(ChallengeLoginManager loginManager, CookieCache cookieCache,
                               SessionRegistry registry, boolean cleanupLocalAfterSave) {
    this.loginManager = loginManager;
    this.cookieCache = cookieCache;
    this.registry = registry;
    this.cleanupLocalAfterSave = cleanupLocalAfterSave;
  }

  /**
   * Starts a login for the identity.
   *
   * @param identity account handle
   * @param secret   account password
   * @return the outcome; a suspended outcome carries the token for {@link #submitChallenge}
   * @throws IllegalArgumentException if identity or secret is blank
   * @throws IllegalStateException    if too many logins are pending
   */
  public LoginOutcome start(String identity, String secret) {
    requireText(identity, "identity");
    requireText(secret, "secret");
    String token = UUID.randomUUID().toString();
    CookieRef cookies = cookieCache.load(identity);
    log.debug("start(identity={}, cachedCookie={})", cookies.identity(), cookies.exists());

    LoginOutcome outcome = loginManager.begin(token, identity, secret, cookies);
    if (outcome instanceof LoginOutcome.Success) {
      completeLogin(token, identity);
    }
    return outcome;
  }

  /**
   * Answers the challenge a login is suspended on.
   *
   * @param token  session token from the challenge
   * @param answer the user's answer
   * @return the outcome of the resumed login
   * @throws IllegalArgumentException if token or answer is blank
   */
  public LoginOutcome submitChallenge(String token, String answer) {
    requireText(token, "sessionToken");
    requireText(answer, "answer");
    log.debug("submitChallenge(token={})", token);

    LoginOutcome outcome = loginManager.resume(token, answer);
    if (outcome instanceof LoginOutcome.Success) {
      Optional<String> identity = registry.get(token).map(LoginSession::identity);
      identity.ifPresent(id -> completeLogin(token, id));
    }
    return outcome;
  }

  /**
   * Drops any cached cookie blob for the identity, locally and remotely.
   *
   * @param identity account handle
   * @throws IllegalArgumentException if identity is blank
   */
  public void forget(String identity) {
    requireText(identity, "identity");
    cookieCache.delete(identity);
  }

  /**
   * Abandons a pending login.
   *
   * @param token session token
   * @return true if a session was removed
   */
  public boolean abandon(String token) {
    requireText(token, "sessionToken");
    return registry.remove(token);
  }

  private void completeLogin(String token, String identity) {
    cookieCache.save(identity, cleanupLocalAfterSave);
    registry.remove(token);
  }

  private static void requireText(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
  }
}
