package com.codeheadsystems.interlock.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response shape shared by {@code POST /auth/start} and {@code POST /auth/challenge}.
 * <p>
 * A {@link AuthStatus#SUCCESS} response carries no other fields. A {@link AuthStatus#CHALLENGE}
 * response carries the challenge kind, the text the upstream service showed, an optional
 * masked hint (for example {@code te***@g***.com}) and the session token the answer must be
 * submitted under. Hard failures are reported through HTTP status codes, never through this body.
 *
 * @param status        success or challenge
 * @param challengeType {@code confirmation_code} or {@code email_verification}
 * @param message       the prompt line that triggered the challenge
 * @param hint          masked address extracted from the prompt, if any
 * @param sessionToken  token to echo back in {@link ChallengeSubmitRequest}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(
    @JsonProperty("status") AuthStatus status,
    @JsonProperty("challengeType") String challengeType,
    @JsonProperty("message") String message,
    @JsonProperty("hint") String hint,
    @JsonProperty("sessionToken") String sessionToken) {

  public static AuthResponse success() {
    return new AuthResponse(AuthStatus.SUCCESS, null, null, null, null);
  }

  public static AuthResponse challenge(String challengeType, String message, String hint,
                                       String sessionToken) {
    return new AuthResponse(AuthStatus.CHALLENGE, challengeType, message, hint, sessionToken);
  }
}
