package com.codeheadsystems.interlock.server.store;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Two-tier store for post-login cookie blobs.
 * <p>
 * The local copy is authoritative by presence. A remote tier, when configured, keeps a TTL-bound
 * copy so that credentials survive the loss of local disk. Remote failures never escape an
 * implementation: they are logged and treated as a miss or a no-op.
 * <p>
 * All operations do blocking disk and network I/O.
 */
public interface CookieCache {

  /**
   * Makes the local copy available, pulling it from the remote tier if needed.
   *
   * @param identity raw account handle
   * @return reference to the local copy; check {@link CookieRef#exists()} before relying on it
   */
  CookieRef load(String identity);

  /**
   * Pushes the local copy to the remote tier.
   *
   * @param identity     raw account handle
   * @param cleanupLocal delete the local copy afterwards
   */
  void save(String identity, boolean cleanupLocal);

  /**
   * Removes the blob from both tiers, best effort.
   *
   * @param identity raw account handle
   */
  void delete(String identity);

  /**
   * Returns the in-process copy of the blob last read or pushed for the identity.
   *
   * @param identity raw account handle
   * @return a copy of the mirrored bytes, or empty
   */
  Optional<byte[]> mirror(String identity);

  /**
   * Whether a remote tier is configured.
   *
   * @return true if blobs are pushed to a remote tier
   */
  boolean remoteEnabled();

  /**
   * Directory holding the local copies.
   *
   * @return the local directory
   */
  Path localDirectory();
}
