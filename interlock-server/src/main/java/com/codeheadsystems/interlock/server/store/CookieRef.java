package com.codeheadsystems.interlock.server.store;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reference to the local copy of an identity's cookie blob.
 * <p>
 * The file may not exist yet: a login client reads it when present and writes it after a
 * successful login.
 *
 * @param identity normalized identity the blob belongs to
 * @param path     location of the local copy
 */
public record CookieRef(String identity, Path path) {

  /**
   * Whether the local copy is present.
   *
   * @return true if the file exists
   */
  public boolean exists() {
    return Files.exists(path);
  }
}
