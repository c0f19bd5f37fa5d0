package com.codeheadsystems.interlock.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model carrying the user's answer to a verification challenge.
 * <p>
 * Used by: {@code POST /auth/challenge}
 *
 * @param sessionToken the token returned with the challenge
 * @param answer       the code or address the user was asked for; delivered to the login at most once
 */
public record ChallengeSubmitRequest(
    @JsonProperty("sessionToken") String sessionToken,
    @JsonProperty("answer") String answer) {

  @Override
  public String toString() {
    return "ChallengeSubmitRequest[sessionToken=" + sessionToken + ", answer=***]";
  }
}
