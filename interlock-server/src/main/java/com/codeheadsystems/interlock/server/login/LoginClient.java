package com.codeheadsystems.interlock.server.login;

import com.codeheadsystems.interlock.server.store.CookieRef;

/**
 * Narrow capability over the third-party login client.
 * <p>
 * <strong>Resubmission contract:</strong> the client exposes no checkpoint, so a login that was
 * aborted on a verification prompt is resumed by calling {@link #authenticate} again from the
 * start with the answer queued on a new console. Implementations must make that safe, which in
 * practice means the upstream provider treats the repeated steps (including re-sending an
 * already issued code) as idempotent.
 */
public interface LoginClient {

  /**
   * Logs in, reading cookies from and writing refreshed cookies to {@code cookies}.
   *
   * @param identity account handle
   * @param secret   account password
   * @param cookies  local cookie blob; may not exist yet, must exist after a successful login
   * @param console  where output and prompts go
   * @throws Exception on rejected credentials, transport errors or an abort raised by the console
   */
  void authenticate(String identity, String secret, CookieRef cookies, LoginConsole console)
      throws Exception;
}
