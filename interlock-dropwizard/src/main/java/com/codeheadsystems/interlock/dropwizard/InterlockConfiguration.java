package com.codeheadsystems.interlock.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the interlock login endpoints.
 * <p>
 * The remote cookie tier is enabled only when both {@code remoteCacheUrl} and
 * {@code remoteCacheToken} are set. Both are usually supplied from the environment:
 * <pre>{@code
 *   remoteCacheUrl: ${UPSTASH_REDIS_URL:-}
 *   remoteCacheToken: ${UPSTASH_REDIS_TOKEN:-}
 *   cookieTtlSeconds: ${COOKIE_TTL_SECONDS:-604800}
 * }</pre>
 * Without them cookies are kept on local disk only, which does not survive the loss of the
 * instance.
 */
public class InterlockConfiguration extends Configuration {

  /**
   * Directory holding the local cookie copies. Created on startup if missing.
   */
  @NotEmpty
  private String cookieDirectory = "cookies";

  /**
   * File name suffix of a local copy, also appended to remote keys.
   */
  @NotEmpty
  private String cookieFileSuffix = ".json";

  /**
   * Base URL of the Upstash REST endpoint. Empty disables the remote tier.
   */
  private String remoteCacheUrl = "";

  /**
   * Bearer token for the Upstash REST endpoint. Empty disables the remote tier.
   */
  private String remoteCacheToken = "";

  /**
   * Namespace tag prepended to remote keys.
   */
  @NotEmpty
  private String remoteKeyPrefix = "cookie:";

  /**
   * Expiry applied to remote copies, in seconds. Defaults to one week.
   */
  @Min(1)
  private long cookieTtlSeconds = 604800;

  /**
   * Delete the local copy once it has been pushed to the remote tier. Ignored without one.
   */
  private boolean cleanupLocalAfterSave = false;

  /**
   * Lifetime of a pending login in seconds. 0 keeps sessions until they complete or are
   * abandoned.
   */
  @Min(0)
  private long sessionTtlSeconds = 900;

  /**
   * Maximum number of logins pending at once. Further starts get HTTP 503.
   */
  @Min(1)
  private int maxPendingSessions = 10_000;

  /**
   * Gets cookie directory.
   *
   * @return the cookie directory
   */
  @JsonProperty
  public String getCookieDirectory() {
    return cookieDirectory;
  }

  /**
   * Sets cookie directory.
   *
   * @param cookieDirectory the cookie directory
   */
  @JsonProperty
  public void setCookieDirectory(String cookieDirectory) {
    this.cookieDirectory = cookieDirectory;
  }

  /**
   * Gets cookie file suffix.
   *
   * @return the cookie file suffix
   */
  @JsonProperty
  public String getCookieFileSuffix() {
    return cookieFileSuffix;
  }

  /**
   * Sets cookie file suffix.
   *
   * @param cookieFileSuffix the cookie file suffix
   */
  @JsonProperty
  public void setCookieFileSuffix(String cookieFileSuffix) {
    this.cookieFileSuffix = cookieFileSuffix;
  }

  /**
   * Gets remote cache url.
   *
   * @return the remote cache url
   */
  @JsonProperty
  public String getRemoteCacheUrl() {
    return remoteCacheUrl;
  }

  /**
   * Sets remote cache url.
   *
   * @param remoteCacheUrl the remote cache url
   */
  @JsonProperty
  public void setRemoteCacheUrl(String remoteCacheUrl) {
    this.remoteCacheUrl = remoteCacheUrl;
  }

  /**
   * Gets remote cache token.
   *
   * @return the remote cache token
   */
  @JsonProperty
  public String getRemoteCacheToken() {
    return remoteCacheToken;
  }

  /**
   * Sets remote cache token.
   *
   * @param remoteCacheToken the remote cache token
   */
  @JsonProperty
  public void setRemoteCacheToken(String remoteCacheToken) {
    this.remoteCacheToken = remoteCacheToken;
  }

  /**
   * Gets remote key prefix.
   *
   * @return the remote key prefix
   */
  @JsonProperty
  public String getRemoteKeyPrefix() {
    return remoteKeyPrefix;
  }

  /**
   * Sets remote key prefix.
   *
   * @param remoteKeyPrefix the remote key prefix
   */
  @JsonProperty
  public void setRemoteKeyPrefix(String remoteKeyPrefix) {
    this.remoteKeyPrefix = remoteKeyPrefix;
  }

  /**
   * Gets cookie ttl seconds.
   *
   * @return the cookie ttl seconds
   */
  @JsonProperty
  public long getCookieTtlSeconds() {
    return cookieTtlSeconds;
  }

  /**
   * Sets cookie ttl seconds.
   *
   * @param cookieTtlSeconds the cookie ttl seconds
   */
  @JsonProperty
  public void setCookieTtlSeconds(long cookieTtlSeconds) {
    this.cookieTtlSeconds = cookieTtlSeconds;
  }

  /**
   * Is cleanup local after save boolean.
   *
   * @return the boolean
   */
  @JsonProperty
  public boolean isCleanupLocalAfterSave() {
    return cleanupLocalAfterSave;
  }

  /**
   * Sets cleanup local after save.
   *
   * @param cleanupLocalAfterSave the cleanup local after save
   */
  @JsonProperty
  public void setCleanupLocalAfterSave(boolean cleanupLocalAfterSave) {
    this.cleanupLocalAfterSave = cleanupLocalAfterSave;
  }

  /**
   * Gets session ttl seconds.
   *
   * @return the session ttl seconds
   */
  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  /**
   * Sets session ttl seconds.
   *
   * @param sessionTtlSeconds the session ttl seconds
   */
  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  /**
   * Gets max pending sessions.
   *
   * @return the max pending sessions
   */
  @JsonProperty
  public int getMaxPendingSessions() {
    return maxPendingSessions;
  }

  /**
   * Sets max pending sessions.
   *
   * @param maxPendingSessions the max pending sessions
   */
  @JsonProperty
  public void setMaxPendingSessions(int maxPendingSessions) {
    this.maxPendingSessions = maxPendingSessions;
  }

  /**
   * Whether both remote cache settings are present.
   *
   * @return true if the remote tier should be enabled
   */
  public boolean remoteCacheConfigured() {
    return remoteCacheUrl != null && !remoteCacheUrl.isBlank()
        && remoteCacheToken != null && !remoteCacheToken.isBlank();
  }
}
