package com.codeheadsystems.interlock.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import com.codeheadsystems.interlock.model.auth.AuthResponse;
import com.codeheadsystems.interlock.model.auth.AuthStartRequest;
import com.codeheadsystems.interlock.model.auth.AuthStatus;
import com.codeheadsystems.interlock.model.auth.ChallengeSubmitRequest;
import com.codeheadsystems.interlock.server.exceptions.InvalidSessionException;
import com.codeheadsystems.interlock.server.exceptions.UnexpectedPromptException;
import com.codeheadsystems.interlock.server.exceptions.UpstreamLoginException;
import com.codeheadsystems.interlock.server.login.ChallengeType;
import com.codeheadsystems.interlock.server.login.LoginOutcome;
import com.codeheadsystems.interlock.server.login.VerificationChallenge;
import com.codeheadsystems.interlock.server.manager.AuthenticationManager;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthResourceTest {

  @Mock private AuthenticationManager authenticationManager;
  private AuthResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    // WebApplicationException and Response.noContent() need a RuntimeDelegate. Only the API jar is
    // on the test classpath, so install a mock whose responses carry the status they were built with.
    AtomicInteger lastStatus = new AtomicInteger();
    Response.ResponseBuilder builder = mock(Response.ResponseBuilder.class, invocation -> {
      String name = invocation.getMethod().getName();
      if (name.equals("status")) {
        Object arg = invocation.getArgument(0);
        if (arg instanceof Integer code) {
          lastStatus.set(code);
        } else if (arg instanceof Response.StatusType type) {
          lastStatus.set(type.getStatusCode());
        }
        return invocation.getMock();
      }
      if (name.equals("build")) {
        int code = lastStatus.get();
        return mock(Response.class, withSettings().defaultAnswer(inv ->
            inv.getMethod().getName().equals("getStatus")
                ? code : Mockito.RETURNS_DEFAULTS.answer(inv)));
      }
      if (invocation.getMethod().getReturnType().isInstance(invocation.getMock())) {
        return invocation.getMock();
      }
      return Mockito.RETURNS_DEFAULTS.answer(invocation);
    });

    RuntimeDelegate delegate = mock(RuntimeDelegate.class);
    when(delegate.createResponseBuilder()).thenReturn(builder);
    RuntimeDelegate.setInstance(delegate);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RuntimeDelegate.setInstance(null);
  }

  @BeforeEach
  void setUp() {
    resource = new AuthResource(authenticationManager);
  }

  @Test
  void start_success_returnsSuccess() {
    when(authenticationManager.start("alice", "pw")).thenReturn(new LoginOutcome.Success("tok-1"));

    AuthResponse response = resource.start(new AuthStartRequest("alice", "pw"));

    assertThat(response.status()).isEqualTo(AuthStatus.SUCCESS);
    assertThat(response.sessionToken()).isNull();
  }

  @Test
  void start_suspended_returnsChallenge() {
    VerificationChallenge challenge = new VerificationChallenge(ChallengeType.CONFIRMATION_CODE,
        "A confirmation code has been sent to te***@g***.com", "te***@g***.com");
    when(authenticationManager.start("alice", "pw"))
        .thenReturn(new LoginOutcome.Suspended("tok-1", challenge));

    AuthResponse response = resource.start(new AuthStartRequest("alice", "pw"));

    assertThat(response.status()).isEqualTo(AuthStatus.CHALLENGE);
    assertThat(response.challengeType()).isEqualTo("confirmation_code");
    assertThat(response.message()).isEqualTo(challenge.message());
    assertThat(response.hint()).isEqualTo("te***@g***.com");
    assertThat(response.sessionToken()).isEqualTo("tok-1");
  }

  @Test
  void start_nullBody_badRequest() {
    assertStatus(() -> resource.start(null), 400);
  }

  @Test
  void start_missingField_badRequest() {
    when(authenticationManager.start("alice", null))
        .thenThrow(new IllegalArgumentException("Missing required field: secret"));

    assertStatus(() -> resource.start(new AuthStartRequest("alice", null)), 400);
  }

  @Test
  void start_registryFull_serviceUnavailable() {
    when(authenticationManager.start("alice", "pw"))
        .thenThrow(new IllegalStateException("Too many pending sessions"));

    assertStatus(() -> resource.start(new AuthStartRequest("alice", "pw")), 503);
  }

  @Test
  void start_upstreamFailure_unauthorized() {
    when(authenticationManager.start("alice", "pw")).thenReturn(new LoginOutcome.Failed("tok-1",
        new UpstreamLoginException("Login failed for alice", new IOException("bad password"))));

    assertStatus(() -> resource.start(new AuthStartRequest("alice", "pw")), 401);
  }

  @Test
  void start_unexpectedPrompt_badGateway() {
    when(authenticationManager.start("alice", "pw"))
        .thenReturn(new LoginOutcome.Failed("tok-1", new UnexpectedPromptException("Captcha: ")));

    assertStatus(() -> resource.start(new AuthStartRequest("alice", "pw")), 502);
  }

  @Test
  void submitChallenge_success_returnsSuccess() {
    when(authenticationManager.submitChallenge("tok-1", "424242"))
        .thenReturn(new LoginOutcome.Success("tok-1"));

    AuthResponse response = resource.submitChallenge(new ChallengeSubmitRequest("tok-1", "424242"));

    assertThat(response.status()).isEqualTo(AuthStatus.SUCCESS);
  }

  @Test
  void submitChallenge_unknownToken_notFound() {
    when(authenticationManager.submitChallenge("nope", "424242")).thenReturn(
        new LoginOutcome.Failed("nope", new InvalidSessionException("Invalid session token")));

    assertStatus(() -> resource.submitChallenge(new ChallengeSubmitRequest("nope", "424242")), 404);
  }

  @Test
  void submitChallenge_nullBody_badRequest() {
    assertStatus(() -> resource.submitChallenge(null), 400);
  }

  @Test
  void abandon_known_noContent() {
    when(authenticationManager.abandon("tok-1")).thenReturn(true);

    assertThat(resource.abandon("tok-1").getStatus()).isEqualTo(204);
  }

  @Test
  void abandon_unknown_notFound() {
    when(authenticationManager.abandon("tok-1")).thenReturn(false);

    assertStatus(() -> resource.abandon("tok-1"), 404);
  }

  @Test
  void forget_noContent() {
    assertThat(resource.forget("alice").getStatus()).isEqualTo(204);
    verify(authenticationManager).forget("alice");
  }

  private static void assertStatus(ThrowableAssert.ThrowingCallable call, int status) {
    assertThatThrownBy(call)
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(status));
  }
}
