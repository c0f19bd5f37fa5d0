package com.codeheadsystems.interlock.server.manager;

import com.codeheadsystems.interlock.server.exceptions.InvalidSessionException;
import com.codeheadsystems.interlock.server.exceptions.UnexpectedPromptException;
import com.codeheadsystems.interlock.server.exceptions.UpstreamLoginException;
import com.codeheadsystems.interlock.server.login.LoginClient;
import com.codeheadsystems.interlock.server.login.LoginOutcome;
import com.codeheadsystems.interlock.server.login.PromptClassifier;
import com.codeheadsystems.interlock.server.login.VerificationChallenge;
import com.codeheadsystems.interlock.server.store.CookieRef;
import com.codeheadsystems.interlock.server.store.LoginSession;
import com.codeheadsystems.interlock.server.store.SessionRegistry;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives login attempts that may stop half way for a verification challenge.
 * <p>
 * Each run hands the {@link LoginClient} a fresh {@link InterceptingConsole}. A prompt that looks
 * like a challenge aborts the run and the attempt is reported as
 * {@link LoginOutcome.Suspended}; {@link #resume} queues the user's answer and runs the whole
 * login again, the answer being handed to the first prompt that is not itself a challenge.
 * <p>
 * <strong>Serialization:</strong> runs are serialized behind one fair lock per manager. Login
 * clients in practice drive a single interactive surface per process, so two concurrent runs
 * would interleave prompts; the lock also makes queue-answer-then-run atomic for each resume.
 * <p>
 * <strong>Outcome contract:</strong> neither {@link #begin} nor {@link #resume} throws for a
 * challenge or a failed login. On success the caller persists the cookie blob and removes the
 * session; on failure the session is left in place.
 */
public class ChallengeLoginManager {

  private static final Logger log = LoggerFactory.getLogger(ChallengeLoginManager.class);

  private final LoginClient loginClient;
  private final SessionRegistry registry;
  private final PromptClassifier classifier;
  private final ReentrantLock loginLock = new ReentrantLock(true);

  /**
   * Instantiates a new Challenge login manager.
   *
   * @param loginClient the login client
   * @param registry    the session registry
   * @param classifier  the prompt classifier
   */
  public ChallengeLoginManager(LoginClient loginClient, SessionRegistry registry,
                               PromptClassifier classifier) {
    this.loginClient = loginClient;
    this.registry = registry;
    this.classifier = classifier;
  }

  /**
   * Registers a session for the token and runs the login once.
   *
   * @param token    fresh session token
   * @param identity account handle
   * @param secret   account password
   * @param cookies  cookie blob for the login client
   * @return the outcome of the run
   * @throws IllegalStateException if the registry refuses the session (token in use, or full)
   */
  public LoginOutcome begin(String token, String identity, String secret, CookieRef cookies) {
    log.debug("begin(token={}, identity={})", token, cookies.identity());
    LoginSession session = registry.create(token, identity, secret, cookies);
    loginLock.lock();
    try {
      return runLogin(session);
    } finally {
      loginLock.unlock();
    }
  }

  /**
   * Queues an answer for a suspended session and runs the login again from the start.
   *
   * @param token  session token returned with the challenge
   * @param answer the user's answer
   * @return the outcome of the run; {@link InvalidSessionException} if the token is unknown
   */
  public LoginOutcome resume(String token, String answer) {
    log.debug("resume(token={})", token);
    loginLock.lock();
    try {
      Optional<LoginSession> session = registry.get(token);
      if (session.isEmpty() || !registry.setAnswer(token, answer)) {
        return new LoginOutcome.Failed(token, new InvalidSessionException("Invalid session token"));
      }
      return runLogin(session.get());
    } finally {
      loginLock.unlock();
    }
  }

  private LoginOutcome runLogin(LoginSession session) {
    String token = session.token();
    InterceptingConsole console = new InterceptingConsole(token, registry, classifier);
    Exception failure = null;
    try {
      loginClient.authenticate(session.identity(), session.secret(), session.cookies(), console);
    } catch (Exception e) {
      failure = e;
    } finally {
      console.close();
    }

    Optional<VerificationChallenge> challenge = console.challenge();
    if (challenge.isPresent()) {
      registry.markChallenge(token, challenge.get().type());
      log.info("Login for {} suspended on {} challenge", session.cookies().identity(),
          challenge.get().type().wireName());
      return new LoginOutcome.Suspended(token, challenge.get());
    }

    Optional<UnexpectedPromptException> unexpected = console.unexpectedPrompt();
    if (unexpected.isPresent()) {
      log.warn("Login for {} hit an unexpected prompt: {}", session.cookies().identity(),
          unexpected.get().prompt());
      return new LoginOutcome.Failed(token, unexpected.get());
    }

    if (failure != null) {
      if (failure instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.warn("Login for {} failed: {}", session.cookies().identity(), failure.getMessage());
      return new LoginOutcome.Failed(token,
          new UpstreamLoginException("Login failed for " + session.cookies().identity(), failure));
    }

    log.info("Login for {} succeeded", session.cookies().identity());
    return new LoginOutcome.Success(token);
  }
}
