package com.codeheadsystems.interlock.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model opening a login attempt against the upstream service.
 * <p>
 * The secret is held server-side for the lifetime of the attempt so that the login can be
 * re-run from scratch when the caller answers a verification challenge.
 * <p>
 * Used by: {@code POST /auth/start}
 *
 * @param identity account handle as typed by the user; normalized server-side before it is used
 *                 as a storage key
 * @param secret   the account password
 */
public record AuthStartRequest(
    @JsonProperty("identity") String identity,
    @JsonProperty("secret") String secret) {

  @Override
  public String toString() {
    return "AuthStartRequest[identity=" + identity + ", secret=***]";
  }
}
