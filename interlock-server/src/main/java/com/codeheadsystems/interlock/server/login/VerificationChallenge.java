package com.codeheadsystems.interlock.server.login;

/**
 * Structured description of a verification step demanded mid-login.
 * <p>
 * Lives only for the round trip that carries it to the caller; nothing persists it.
 *
 * @param type    kind of challenge
 * @param message the line that triggered the challenge
 * @param hint    masked address found in the prompt (e.g. {@code te***@g***.com}), or null
 */
public record VerificationChallenge(ChallengeType type, String message, String hint) {
}
