package com.codeheadsystems.interlock.server.store;

import com.codeheadsystems.interlock.server.login.ChallengeType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Per-token atomicity comes from {@code compute}-style updates on the map. When a TTL is set,
 * expired sessions are lazily evicted on access and purged in bulk only when the registry hits
 * its capacity; a zero TTL keeps sessions until they are removed. All sessions are lost on
 * restart.
 */
public class InMemorySessionRegistry implements SessionRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionRegistry.class);

  /**
   * Default cap on concurrently held sessions.
   */
  public static final int DEFAULT_MAX_SESSIONS = 10_000;

  private final ConcurrentHashMap<String, LoginSession> sessions = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final int maxSessions;
  private final Clock clock;

  /**
   * Creates a registry that never expires sessions.
   */
  public InMemorySessionRegistry() {
    this(Duration.ZERO, DEFAULT_MAX_SESSIONS, Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory session registry.
   *
   * @param ttl         session lifetime, {@link Duration#ZERO} to disable expiry
   * @param maxSessions maximum number of sessions held at once
   * @param clock       time source for creation stamps and expiry checks
   */
  public InMemorySessionRegistry(Duration ttl, int maxSessions, Clock clock) {
    if (ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must not be negative: " + ttl);
    }
    if (maxSessions < 1) {
      throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
    }
    this.ttl = ttl;
    this.maxSessions = maxSessions;
    this.clock = clock;
  }

  @Override
  public LoginSession create(String token, String identity, String secret, CookieRef cookies) {
    if (sessions.size() >= maxSessions) {
      purgeExpired();
      if (sessions.size() >= maxSessions) {
        throw new IllegalStateException("Too many pending sessions");
      }
    }
    LoginSession fresh = LoginSession.open(token, identity, secret, cookies, clock.instant());
    sessions.compute(token, (k, current) -> {
      if (current != null && !isExpired(current)) {
        throw new IllegalStateException("Session token already in use");
      }
      return fresh;
    });
    log.debug("Created session token={}", token);
    return fresh;
  }

  @Override
  public Optional<LoginSession> get(String token) {
    LoginSession session = sessions.get(token);
    if (session == null) {
      return Optional.empty();
    }
    if (isExpired(session)) {
      sessions.remove(token, session);
      log.debug("Evicted expired session token={}", token);
      return Optional.empty();
    }
    return Optional.of(session);
  }

  @Override
  public boolean markChallenge(String token, ChallengeType type) {
    return update(token, s -> s.withChallenge(type)) != null;
  }

  @Override
  public boolean setAnswer(String token, String answer) {
    return update(token, s -> s.withAnswer(answer)) != null;
  }

  @Override
  public Optional<String> consumeAnswer(String token) {
    AtomicReference<String> taken = new AtomicReference<>();
    update(token, s -> {
      taken.set(s.answer());
      return s.withoutAnswer();
    });
    return Optional.ofNullable(taken.get());
  }

  @Override
  public boolean remove(String token) {
    boolean removed = sessions.remove(token) != null;
    log.debug("Removed session token={} (present={})", token, removed);
    return removed;
  }

  @Override
  public int size() {
    return sessions.size();
  }

  private LoginSession update(String token, UnaryOperator<LoginSession> change) {
    return sessions.computeIfPresent(token, (k, current) -> isExpired(current) ? null : change.apply(current));
  }

  private void purgeExpired() {
    if (ttl.isZero()) {
      return;
    }
    int before = sessions.size();
    sessions.values().removeIf(this::isExpired);
    log.debug("Purged {} expired session(s)", before - sessions.size());
  }

  private boolean isExpired(LoginSession session) {
    if (ttl.isZero()) {
      return false;
    }
    Instant cutoff = clock.instant().minus(ttl);
    return session.createdAt().isBefore(cutoff);
  }
}
