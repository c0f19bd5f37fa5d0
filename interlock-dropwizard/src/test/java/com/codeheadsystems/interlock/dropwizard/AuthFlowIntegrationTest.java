package com.codeheadsystems.interlock.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.interlock.model.auth.AuthResponse;
import com.codeheadsystems.interlock.model.auth.AuthStartRequest;
import com.codeheadsystems.interlock.model.auth.AuthStatus;
import com.codeheadsystems.interlock.model.auth.ChallengeSubmitRequest;
import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.Response;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link InterlockBundle}.
 * <p>
 * Starts a real embedded Jetty server with a scripted login client and a local-only cookie
 * cache, and drives the start / challenge / abandon / forget endpoints over HTTP.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthFlowIntegrationTest {

  private static final Path COOKIE_DIR = createCookieDirectory();

  static final DropwizardAppExtension<InterlockConfiguration> APP =
      new DropwizardAppExtension<>(
          InterlockTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("cookieDirectory", COOKIE_DIR.toString()));

  // ── Health check ─────────────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("cookie-cache").contains("remote=disabled");
  }

  // ── Start ────────────────────────────────────────────────────────────────

  @Test
  void start_trustedLogin_succeedsAndWritesCookies() {
    Response response = start("trusted-alice", "pw");

    assertThat(response.getStatus()).isEqualTo(200);
    AuthResponse body = response.readEntity(AuthResponse.class);
    assertThat(body.status()).isEqualTo(AuthStatus.SUCCESS);
    assertThat(body.sessionToken()).isNull();
    assertThat(COOKIE_DIR.resolve("trusted-alice.json")).exists();
  }

  @Test
  void start_rejectedPassword_returns401() {
    assertThat(start("mallory", "wrong").getStatus()).isEqualTo(401);
  }

  @Test
  void start_unanswerablePrompt_returns502() {
    assertThat(start("captcha-carl", "pw").getStatus()).isEqualTo(502);
  }

  @Test
  void start_missingSecret_returns400() {
    assertThat(start("bob", null).getStatus()).isEqualTo(400);
  }

  // ── Challenge ────────────────────────────────────────────────────────────

  /**
   * Full flow: challenge on start, correct code on resume, cookies persisted, session gone.
   */
  @Test
  void challengeFlow_correctCode_succeeds() {
    AuthResponse challenge = start("Bob", "pw").readEntity(AuthResponse.class);

    assertThat(challenge.status()).isEqualTo(AuthStatus.CHALLENGE);
    assertThat(challenge.challengeType()).isEqualTo("confirmation_code");
    assertThat(challenge.hint()).isEqualTo("b***@e****.com");
    assertThat(challenge.message()).startsWith("A confirmation code has been sent");
    assertThat(challenge.sessionToken()).isNotBlank();

    Response resumed = submit(challenge.sessionToken(), ScriptedLoginClient.CODE);

    assertThat(resumed.getStatus()).isEqualTo(200);
    assertThat(resumed.readEntity(AuthResponse.class).status()).isEqualTo(AuthStatus.SUCCESS);
    assertThat(COOKIE_DIR.resolve("bob.json")).exists();

    // the session ended with the successful login
    assertThat(submit(challenge.sessionToken(), ScriptedLoginClient.CODE).getStatus()).isEqualTo(404);
  }

  @Test
  void challengeFlow_wrongCode_returns401() {
    AuthResponse challenge = start("carol", "pw").readEntity(AuthResponse.class);
    assertThat(challenge.status()).isEqualTo(AuthStatus.CHALLENGE);

    assertThat(submit(challenge.sessionToken(), "000000").getStatus()).isEqualTo(401);
    assertThat(COOKIE_DIR.resolve("carol.json")).doesNotExist();
  }

  @Test
  void submit_unknownToken_returns404() {
    assertThat(submit("no-such-token", ScriptedLoginClient.CODE).getStatus()).isEqualTo(404);
  }

  // ── Abandon / forget ─────────────────────────────────────────────────────

  @Test
  void abandon_pendingLogin_invalidatesToken() {
    AuthResponse challenge = start("dave", "pw").readEntity(AuthResponse.class);
    assertThat(challenge.status()).isEqualTo(AuthStatus.CHALLENGE);

    assertThat(delete("/auth/sessions/" + challenge.sessionToken()).getStatus()).isEqualTo(204);
    assertThat(delete("/auth/sessions/" + challenge.sessionToken()).getStatus()).isEqualTo(404);
    assertThat(submit(challenge.sessionToken(), ScriptedLoginClient.CODE).getStatus()).isEqualTo(404);
  }

  @Test
  void forget_removesCachedCookies() {
    assertThat(start("trusted-frank", "pw").getStatus()).isEqualTo(200);
    assertThat(COOKIE_DIR.resolve("trusted-frank.json")).exists();

    assertThat(delete("/auth/credentials/trusted-frank").getStatus()).isEqualTo(204);

    assertThat(COOKIE_DIR.resolve("trusted-frank.json")).doesNotExist();
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private static Response start(String identity, String secret) {
    return APP.client()
        .target(url("/auth/start"))
        .request()
        .post(Entity.json(new AuthStartRequest(identity, secret)));
  }

  private static Response submit(String token, String answer) {
    return APP.client()
        .target(url("/auth/challenge"))
        .request()
        .post(Entity.json(new ChallengeSubmitRequest(token, answer)));
  }

  private static Response delete(String path) {
    return APP.client().target(url(path)).request().delete();
  }

  private static String url(String path) {
    return String.format("http://localhost:%d%s", APP.getLocalPort(), path);
  }

  private static Path createCookieDirectory() {
    try {
      return Files.createTempDirectory("interlock-cookies");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
