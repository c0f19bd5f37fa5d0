package com.codeheadsystems.interlock.server.resource;

import com.codeheadsystems.interlock.model.auth.AuthResponse;
import com.codeheadsystems.interlock.model.auth.AuthStartRequest;
import com.codeheadsystems.interlock.model.auth.ChallengeSubmitRequest;
import com.codeheadsystems.interlock.server.exceptions.InvalidSessionException;
import com.codeheadsystems.interlock.server.exceptions.LoginFaultException;
import com.codeheadsystems.interlock.server.exceptions.UnexpectedPromptException;
import com.codeheadsystems.interlock.server.login.LoginOutcome;
import com.codeheadsystems.interlock.server.login.VerificationChallenge;
import com.codeheadsystems.interlock.server.manager.AuthenticationManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for resumable, challenge-aware logins.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/start}: begin a login</li>
 *   <li>{@code POST /auth/challenge}: answer the challenge a login is waiting on</li>
 *   <li>{@code DELETE /auth/sessions/{token}}: abandon a pending login</li>
 *   <li>{@code DELETE /auth/credentials/{identity}}: drop cached cookies for an identity</li>
 * </ul>
 * Both login endpoints answer {@code 200} with either a success or a challenge body. Hard
 * failures map to: 400 for missing fields, 401 when the upstream login fails, 404 for an unknown
 * session token, 502 for a prompt that cannot be answered, 503 when too many logins are pending.
 */
@Singleton
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final AuthenticationManager authenticationManager;

  /**
   * Instantiates a new Auth resource.
   *
   * @param authenticationManager the authentication manager
   */
  @Inject
  public AuthResource(final AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
    log.info("AuthResource({})", authenticationManager);
  }

  /**
   * Begins a login.
   *
   * @param req the request
   * @return success, or the challenge to answer
   */
  @POST
  @Path("/start")
  public AuthResponse start(final AuthStartRequest req) {
    log.debug("start()");
    if (req == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    try {
      return toResponse(authenticationManager.start(req.identity(), req.secret()));
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (IllegalStateException e) {
      throw new WebApplicationException("Too many pending sessions", Response.Status.SERVICE_UNAVAILABLE);
    }
  }

  /**
   * Answers a challenge and resumes the login.
   *
   * @param req the request
   * @return success, or the next challenge to answer
   */
  @POST
  @Path("/challenge")
  public AuthResponse submitChallenge(final ChallengeSubmitRequest req) {
    log.debug("submitChallenge()");
    if (req == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    try {
      return toResponse(authenticationManager.submitChallenge(req.sessionToken(), req.answer()));
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }

  /**
   * Abandons a pending login.
   *
   * @param token the session token
   * @return 204, or 404 if the token is unknown
   */
  @DELETE
  @Path("/sessions/{token}")
  public Response abandon(@PathParam("token") final String token) {
    log.debug("abandon(token={})", token);
    boolean removed;
    try {
      removed = authenticationManager.abandon(token);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
    if (!removed) {
      throw new WebApplicationException("Invalid session token", Response.Status.NOT_FOUND);
    }
    return Response.noContent().build();
  }

  /**
   * Drops the cached cookie blob for an identity.
   *
   * @param identity the account handle
   * @return 204
   */
  @DELETE
  @Path("/credentials/{identity}")
  public Response forget(@PathParam("identity") final String identity) {
    log.debug("forget()");
    try {
      authenticationManager.forget(identity);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
    return Response.noContent().build();
  }

  private AuthResponse toResponse(LoginOutcome outcome) {
    if (outcome instanceof LoginOutcome.Suspended suspended) {
      VerificationChallenge challenge = suspended.challenge();
      return AuthResponse.challenge(challenge.type().wireName(), challenge.message(),
          challenge.hint(), suspended.sessionToken());
    }
    if (outcome instanceof LoginOutcome.Failed failed) {
      throw toWebException(failed.fault());
    }
    return AuthResponse.success();
  }

  private static WebApplicationException toWebException(LoginFaultException fault) {
    if (fault instanceof InvalidSessionException) {
      return new WebApplicationException(fault.getMessage(), Response.Status.NOT_FOUND);
    }
    if (fault instanceof UnexpectedPromptException) {
      return new WebApplicationException("Login requires input that cannot be provided",
          Response.Status.BAD_GATEWAY);
    }
    log.debug("Upstream login failed", fault);
    return new WebApplicationException("Login failed", Response.Status.UNAUTHORIZED);
  }
}
