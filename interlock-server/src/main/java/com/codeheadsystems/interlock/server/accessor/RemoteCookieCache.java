package com.codeheadsystems.interlock.server.accessor;

import com.codeheadsystems.interlock.server.exceptions.CacheAccessorException;
import java.util.Optional;

/**
 * Remote key/value tier for cookie blobs.
 * <p>
 * Implementations report every failure as a {@link CacheAccessorException}; the credential cache
 * decides how to degrade.
 */
public interface RemoteCookieCache {

  /**
   * Fetches a value.
   *
   * @param key namespaced key
   * @return the stored bytes, or empty if absent or expired
   * @throws CacheAccessorException if the remote tier cannot be reached or rejects the request
   */
  Optional<byte[]> get(String key);

  /**
   * Stores a value with an expiry.
   *
   * @param key        namespaced key
   * @param value      bytes to store
   * @param ttlSeconds expiry in seconds
   * @throws CacheAccessorException if the remote tier cannot be reached or rejects the request
   */
  void set(String key, byte[] value, long ttlSeconds);

  /**
   * Removes a value if present.
   *
   * @param key namespaced key
   * @throws CacheAccessorException if the remote tier cannot be reached or rejects the request
   */
  void delete(String key);
}
