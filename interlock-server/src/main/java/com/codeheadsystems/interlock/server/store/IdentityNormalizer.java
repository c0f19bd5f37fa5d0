package com.codeheadsystems.interlock.server.store;

import java.util.Locale;

/**
 * Turns a user-supplied account handle into a key that is safe to use as a file name and a
 * remote cache key.
 * <p>
 * Lower-cases first, then keeps letters, digits, {@code _} and {@code -}. Applying it twice gives
 * the same result as applying it once.
 */
public final class IdentityNormalizer {

  /**
   * Key used when nothing usable is left of the handle.
   */
  public static final String ANONYMOUS = "anonymous";

  private IdentityNormalizer() {
  }

  /**
   * Normalize string.
   *
   * @param identity the raw account handle, may be null
   * @return the normalized key, never empty
   */
  public static String normalize(final String identity) {
    if (identity == null) {
      return ANONYMOUS;
    }
    String lower = identity.toLowerCase(Locale.ROOT);
    StringBuilder safe = new StringBuilder(lower.length());
    lower.codePoints()
        .filter(cp -> Character.isLetterOrDigit(cp) || cp == '_' || cp == '-')
        .forEach(safe::appendCodePoint);
    return safe.length() == 0 ? ANONYMOUS : safe.toString();
  }
}
