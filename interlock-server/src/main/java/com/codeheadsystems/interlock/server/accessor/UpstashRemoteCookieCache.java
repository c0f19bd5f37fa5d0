package com.codeheadsystems.interlock.server.accessor;

import com.codeheadsystems.interlock.server.exceptions.CacheAccessorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RemoteCookieCache} speaking the Upstash Redis REST protocol.
 * <p>
 * Commands are sent as {@code /<command>/<key>} against the configured base URL with a bearer
 * token; the value of {@code SET} travels as the request body. Replies are JSON envelopes of the
 * form {@code {"result": ...}} or {@code {"error": "..."}}. Blobs are stored as UTF-8 text.
 * <p>
 * I/O errors, interruptions, HTTP error codes and {@code error} envelopes are all surfaced as
 * {@link CacheAccessorException}.
 */
public class UpstashRemoteCookieCache implements RemoteCookieCache {

  private static final Logger log = LoggerFactory.getLogger(UpstashRemoteCookieCache.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI baseUri;
  private final String token;

  /**
   * Instantiates a new Upstash remote cookie cache.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param baseUri      REST endpoint of the database, e.g. {@code https://eu1-xyz.upstash.io}
   * @param token        REST bearer token
   */
  public UpstashRemoteCookieCache(final HttpClient httpClient,
                                  final ObjectMapper objectMapper,
                                  final URI baseUri,
                                  final String token) {
    log.info("UpstashRemoteCookieCache({})", baseUri);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUri = baseUri;
    this.token = token;
  }

  @Override
  public Optional<byte[]> get(final String key) {
    log.debug("get(key={})", key);
    HttpRequest request = authorized(command("get", key, ""))
        .GET()
        .build();
    JsonNode result = execute(key, request);
    if (result == null || result.isNull()) {
      return Optional.empty();
    }
    return Optional.of(result.asText().getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void set(final String key, final byte[] value, final long ttlSeconds) {
    log.debug("set(key={}, bytes={}, ttlSeconds={})", key, value.length, ttlSeconds);
    HttpRequest request = authorized(command("set", key, "?EX=" + ttlSeconds))
        .header("Content-Type", "text/plain; charset=utf-8")
        .POST(HttpRequest.BodyPublishers.ofByteArray(value))
        .build();
    execute(key, request);
  }

  @Override
  public void delete(final String key) {
    log.debug("delete(key={})", key);
    HttpRequest request = authorized(command("del", key, ""))
        .POST(HttpRequest.BodyPublishers.noBody())
        .build();
    execute(key, request);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI command(String command, String key, String query) {
    String encodedKey = URLEncoder.encode(key, StandardCharsets.UTF_8);
    String base = baseUri.toString();
    String separator = base.endsWith("/") ? "" : "/";
    return URI.create(base + separator + command + "/" + encodedKey + query);
  }

  private HttpRequest.Builder authorized(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .header("Accept", "application/json")
        .header("Authorization", "Bearer " + token);
  }

  private JsonNode execute(String key, HttpRequest request) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(key, response.statusCode());
      JsonNode body = objectMapper.readTree(response.body());
      if (body == null || body.isMissingNode()) {
        throw new CacheAccessorException("Empty reply from remote cache for key: " + key, null);
      }
      if (body.hasNonNull("error")) {
        throw new CacheAccessorException(
            "Remote cache error for key " + key + ": " + body.get("error").asText(), null);
      }
      return body.get("result");
    } catch (IOException e) {
      throw new CacheAccessorException("Remote cache request failed for key: " + key, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CacheAccessorException("Remote cache request interrupted for key: " + key, e);
    }
  }

  private void checkStatus(String key, int statusCode) {
    if (statusCode == 401) {
      throw new CacheAccessorException("Remote cache rejected credentials (401) for key: " + key, null);
    }
    if (statusCode >= 400) {
      throw new CacheAccessorException(
          "Remote cache returned HTTP " + statusCode + " for key: " + key, null);
    }
  }
}
