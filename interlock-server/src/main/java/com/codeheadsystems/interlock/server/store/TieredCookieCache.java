package com.codeheadsystems.interlock.server.store;

import com.codeheadsystems.interlock.server.accessor.RemoteCookieCache;
import com.codeheadsystems.interlock.server.exceptions.CacheAccessorException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CookieCache} keeping one file per normalized identity in a local directory, optionally
 * backed by a {@link RemoteCookieCache}.
 * <p>
 * Layout: the local copy lives at {@code <directory>/<identity><suffix>}; the remote key is
 * {@code <keyPrefix><identity><suffix>}. Without a remote tier the cache is local only and
 * {@link #save} does nothing, so the only copy of a blob is never deleted.
 */
public class TieredCookieCache implements CookieCache {

  private static final Logger log = LoggerFactory.getLogger(TieredCookieCache.class);

  /**
   * Default remote TTL: one week.
   */
  public static final long DEFAULT_TTL_SECONDS = 60L * 60 * 24 * 7;
  public static final String DEFAULT_SUFFIX = ".json";
  public static final String DEFAULT_KEY_PREFIX = "cookie:";

  private final Path directory;
  private final String suffix;
  private final String keyPrefix;
  private final long ttlSeconds;
  private final RemoteCookieCache remote;

  // normalized identity -> last bytes read from or pushed to a tier
  private final ConcurrentHashMap<String, byte[]> mirror = new ConcurrentHashMap<>();

  /**
   * Creates a local-only cache with the default layout.
   *
   * @param directory local directory, created if missing
   */
  public TieredCookieCache(Path directory) {
    this(directory, DEFAULT_SUFFIX, DEFAULT_KEY_PREFIX, DEFAULT_TTL_SECONDS, null);
  }

  /**
   * Instantiates a new Tiered cookie cache.
   *
   * @param directory  local directory, created if missing
   * @param suffix     file name suffix, also appended to remote keys
   * @param keyPrefix  namespace tag prepended to remote keys
   * @param ttlSeconds expiry applied to remote copies
   * @param remote     remote tier, or null to run local only
   */
  public TieredCookieCache(Path directory, String suffix, String keyPrefix, long ttlSeconds,
                           RemoteCookieCache remote) {
    if (ttlSeconds <= 0) {
      throw new IllegalArgumentException("ttlSeconds must be positive: " + ttlSeconds);
    }
    this.directory = directory;
    this.suffix = suffix;
    this.keyPrefix = keyPrefix;
    this.ttlSeconds = ttlSeconds;
    this.remote = remote;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create cookie directory " + directory, e);
    }
    if (remote == null) {
      log.warn("No remote cookie cache configured. Cookies are kept on local disk only.");
    }
  }

  @Override
  public CookieRef load(String identity) {
    String id = IdentityNormalizer.normalize(identity);
    CookieRef ref = new CookieRef(id, pathFor(id));
    log.debug("load(identity={})", id);

    if (ref.exists()) {
      try {
        mirror.put(id, Files.readAllBytes(ref.path()));
      } catch (IOException e) {
        log.warn("Failed reading cookie file {}: {}", ref.path(), e.getMessage());
      }
      return ref;
    }

    if (remote == null) {
      return ref;
    }

    Optional<byte[]> data;
    try {
      data = remote.get(keyFor(id));
    } catch (CacheAccessorException e) {
      log.warn("Remote cookie get failed for {}: {}", id, e.getMessage());
      return ref;
    }

    if (data.isPresent()) {
      try {
        writeLocal(ref.path(), data.get());
        mirror.put(id, data.get());
        log.debug("Restored cookie for {} from remote tier", id);
      } catch (IOException e) {
        log.warn("Failed writing cookie file {}: {}", ref.path(), e.getMessage());
      }
    }
    return ref;
  }

  @Override
  public void save(String identity, boolean cleanupLocal) {
    String id = IdentityNormalizer.normalize(identity);
    log.debug("save(identity={}, cleanupLocal={})", id, cleanupLocal);
    if (remote == null) {
      return;
    }

    Path path = pathFor(id);
    if (!Files.exists(path)) {
      log.debug("No local cookie for {}, nothing to push", id);
      return;
    }

    byte[] content;
    try {
      content = Files.readAllBytes(path);
    } catch (IOException e) {
      log.warn("Failed reading cookie file {}: {}", path, e.getMessage());
      return;
    }

    try {
      remote.set(keyFor(id), content, ttlSeconds);
      mirror.put(id, content);
    } catch (CacheAccessorException e) {
      log.warn("Remote cookie set failed for {}: {}", id, e.getMessage());
    }

    if (cleanupLocal) {
      removeLocal(path);
    }
  }

  @Override
  public void delete(String identity) {
    String id = IdentityNormalizer.normalize(identity);
    log.debug("delete(identity={})", id);
    removeLocal(pathFor(id));
    mirror.remove(id);

    if (remote != null) {
      try {
        remote.delete(keyFor(id));
      } catch (CacheAccessorException e) {
        log.warn("Remote cookie delete failed for {}: {}", id, e.getMessage());
      }
    }
  }

  @Override
  public Optional<byte[]> mirror(String identity) {
    return Optional.ofNullable(mirror.get(IdentityNormalizer.normalize(identity)))
        .map(byte[]::clone);
  }

  @Override
  public boolean remoteEnabled() {
    return remote != null;
  }

  @Override
  public Path localDirectory() {
    return directory;
  }

  Path pathFor(String normalizedIdentity) {
    return directory.resolve(normalizedIdentity + suffix);
  }

  String keyFor(String normalizedIdentity) {
    return keyPrefix + normalizedIdentity + suffix;
  }

  // Write to a sibling temp file and move it into place so a reader never sees half a blob.
  private void writeLocal(Path path, byte[] content) throws IOException {
    Path tmp = Files.createTempFile(directory, ".cookie", ".tmp");
    try {
      Files.write(tmp, content);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private void removeLocal(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed deleting cookie file {}: {}", path, e.getMessage());
    }
  }
}
