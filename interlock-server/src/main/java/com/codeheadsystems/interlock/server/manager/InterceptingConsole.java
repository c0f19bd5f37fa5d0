package com.codeheadsystems.interlock.server.manager;

import com.codeheadsystems.interlock.server.exceptions.UnexpectedPromptException;
import com.codeheadsystems.interlock.server.login.LoginConsole;
import com.codeheadsystems.interlock.server.login.PromptClassifier;
import com.codeheadsystems.interlock.server.login.VerificationChallenge;
import com.codeheadsystems.interlock.server.store.SessionRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console handed to the login client for exactly one run.
 * <p>
 * Keeps a bounded tail of the client's output, classifies every prompt and either aborts the run
 * on a challenge, answers it from the session's queued answer, or aborts with
 * {@link UnexpectedPromptException}. The first abort is remembered so the driver can report it
 * even when the login client wraps or swallows the exception. Once closed the console refuses
 * every prompt.
 */
class InterceptingConsole implements LoginConsole {

  private static final Logger log = LoggerFactory.getLogger(InterceptingConsole.class);

  static final int MAX_BUFFERED_CHARS = 16 * 1024;

  private final String token;
  private final SessionRegistry registry;
  private final PromptClassifier classifier;
  private final StringBuilder output = new StringBuilder();

  private VerificationChallenge challenge;
  private UnexpectedPromptException unexpectedPrompt;
  private boolean closed;

  InterceptingConsole(String token, SessionRegistry registry, PromptClassifier classifier) {
    this.token = token;
    this.registry = registry;
    this.classifier = classifier;
  }

  @Override
  public synchronized void print(String text) {
    if (closed || text == null) {
      return;
    }
    output.append(text);
    if (!text.endsWith("\n")) {
      output.append('\n');
    }
    if (output.length() > MAX_BUFFERED_CHARS) {
      output.delete(0, output.length() - MAX_BUFFERED_CHARS);
    }
  }

  @Override
  public synchronized String prompt(String text) {
    if (closed) {
      throw new IllegalStateException("Login console is closed");
    }
    if (challenge != null) {
      throw new ChallengeInterrupt(challenge);
    }
    if (unexpectedPrompt != null) {
      throw unexpectedPrompt;
    }

    Optional<VerificationChallenge> classified =
        classifier.classify(PromptClassifier.lastNonEmptyLine(output), text);
    if (classified.isPresent()) {
      challenge = classified.get();
      log.debug("Prompt classified as {} for session token={}", challenge.type(), token);
      throw new ChallengeInterrupt(challenge);
    }

    Optional<String> answer = registry.consumeAnswer(token);
    if (answer.isPresent()) {
      log.debug("Answered prompt from queued answer for session token={}", token);
      return answer.get();
    }

    unexpectedPrompt = new UnexpectedPromptException(text);
    throw unexpectedPrompt;
  }

  synchronized void close() {
    closed = true;
  }

  synchronized Optional<VerificationChallenge> challenge() {
    return Optional.ofNullable(challenge);
  }

  synchronized Optional<UnexpectedPromptException> unexpectedPrompt() {
    return Optional.ofNullable(unexpectedPrompt);
  }

  synchronized String bufferedOutput() {
    return output.toString();
  }

  /**
   * Thrown into the login client to unwind it when a challenge is detected.
   */
  static final class ChallengeInterrupt extends RuntimeException {

    ChallengeInterrupt(VerificationChallenge challenge) {
      super("Verification challenge: " + challenge.type().wireName(), null, false, false);
    }
  }
}
