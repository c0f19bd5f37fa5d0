package com.codeheadsystems.interlock.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.interlock.server.store.CookieCache;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health check that verifies the local cookie directory is usable and reports whether the remote
 * tier is configured.
 * <p>
 * Running without a remote tier is healthy; it only means cookies do not outlive the local disk.
 */
public class CookieCacheHealthCheck extends HealthCheck {

  private final CookieCache cookieCache;

  /**
   * Instantiates a new Cookie cache health check.
   *
   * @param cookieCache the cookie cache
   */
  public CookieCacheHealthCheck(CookieCache cookieCache) {
    this.cookieCache = cookieCache;
  }

  @Override
  protected Result check() {
    Path directory = cookieCache.localDirectory();
    if (!Files.isDirectory(directory)) {
      return Result.unhealthy("Cookie directory %s is missing", directory);
    }
    if (!Files.isWritable(directory)) {
      return Result.unhealthy("Cookie directory %s is not writable", directory);
    }
    return Result.healthy("directory=%s, remote=%s", directory,
        cookieCache.remoteEnabled() ? "enabled" : "disabled");
  }
}
