package com.codeheadsystems.interlock.dropwizard;

import com.codeheadsystems.interlock.dropwizard.health.CookieCacheHealthCheck;
import com.codeheadsystems.interlock.server.accessor.RemoteCookieCache;
import com.codeheadsystems.interlock.server.accessor.UpstashRemoteCookieCache;
import com.codeheadsystems.interlock.server.login.LoginClient;
import com.codeheadsystems.interlock.server.login.PromptClassifier;
import com.codeheadsystems.interlock.server.manager.AuthenticationManager;
import com.codeheadsystems.interlock.server.manager.ChallengeLoginManager;
import com.codeheadsystems.interlock.server.resource.AuthResource;
import com.codeheadsystems.interlock.server.store.InMemorySessionRegistry;
import com.codeheadsystems.interlock.server.store.SessionRegistry;
import com.codeheadsystems.interlock.server.store.TieredCookieCache;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the challenge-aware login endpoints into an existing Dropwizard
 * application.
 * <p>
 * Registers the {@code /auth} JAX-RS resource and the cookie cache health check. Requires an
 * {@link InterlockConfiguration} block in the application's YAML config, and lets that config
 * reference environment variables such as {@code ${UPSTASH_REDIS_URL:-}}.
 * <p>
 * Embed in your application with an in-memory session registry:
 * <pre>{@code
 *   bootstrap.addBundle(new InterlockBundle<>(myLoginClient));
 * }</pre>
 * <p>
 * Or supply your own registry and remote tier:
 * <pre>{@code
 *   bootstrap.addBundle(new InterlockBundle<>(myLoginClient, mySessionRegistry, myRemoteCache));
 * }</pre>
 * A null registry or remote tier falls back to what the configuration describes.
 */
@Singleton
public class InterlockBundle<C extends InterlockConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(InterlockBundle.class);

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final LoginClient loginClient;
  private final SessionRegistry sessionRegistry;
  private final RemoteCookieCache remoteCookieCache;

  /**
   * Creates a bundle whose registry and remote tier are built from the configuration.
   * <p>
   * Pending logins are held in memory and lost on restart.
   *
   * @param loginClient the login client to drive
   */
  public InterlockBundle(LoginClient loginClient) {
    this(loginClient, null, null);
  }

  /**
   * Creates a bundle backed by the supplied collaborators.
   *
   * @param loginClient       the login client to drive
   * @param sessionRegistry   registry for pending logins, or null for the in-memory default
   * @param remoteCookieCache remote cookie tier, or null to build one from the configuration
   */
  @Inject
  public InterlockBundle(LoginClient loginClient,
                         SessionRegistry sessionRegistry,
                         RemoteCookieCache remoteCookieCache) {
    if (loginClient == null) {
      throw new IllegalArgumentException("loginClient is required");
    }
    this.loginClient = loginClient;
    this.sessionRegistry = sessionRegistry;
    this.remoteCookieCache = remoteCookieCache;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
  }

  @Override
  public void run(C configuration, Environment environment) {
    TieredCookieCache cookieCache = new TieredCookieCache(
        Path.of(configuration.getCookieDirectory()),
        configuration.getCookieFileSuffix(),
        configuration.getRemoteKeyPrefix(),
        configuration.getCookieTtlSeconds(),
        buildRemoteCookieCache(configuration, environment));
    SessionRegistry registry = sessionRegistry != null
        ? sessionRegistry
        : new InMemorySessionRegistry(Duration.ofSeconds(configuration.getSessionTtlSeconds()),
            configuration.getMaxPendingSessions(), Clock.systemUTC());

    ChallengeLoginManager loginManager =
        new ChallengeLoginManager(loginClient, registry, new PromptClassifier());
    AuthenticationManager authenticationManager = new AuthenticationManager(
        loginManager, cookieCache, registry, configuration.isCleanupLocalAfterSave());

    environment.jersey().register(new AuthResource(authenticationManager));
    environment.healthChecks().register("cookie-cache", new CookieCacheHealthCheck(cookieCache));
  }

  private RemoteCookieCache buildRemoteCookieCache(C configuration, Environment environment) {
    if (remoteCookieCache != null) {
      return remoteCookieCache;
    }
    if (!configuration.remoteCacheConfigured()) {
      log.warn("remoteCacheUrl or remoteCacheToken not set. Cookie persistence is local only.");
      return null;
    }
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .build();
    return new UpstashRemoteCookieCache(httpClient, environment.getObjectMapper(),
        URI.create(configuration.getRemoteCacheUrl().strip()), configuration.getRemoteCacheToken().strip());
  }
}
