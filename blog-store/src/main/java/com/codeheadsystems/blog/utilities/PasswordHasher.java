package com.codeheadsystems.blog.utilities;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.spec.KeySpec;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Salted PBKDF2 password hashes, stored as {@code pbkdf2-sha256$iterations$saltHex$hashHex}.
 */
@Singleton
public class PasswordHasher {

  static final String SCHEME = "pbkdf2-sha256";
  static final int ITERATIONS = 65_536;
  private static final Logger LOGGER = LoggerFactory.getLogger(PasswordHasher.class);
  private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
  private static final int SALT_BYTES = 16;
  private static final int KEY_BITS = 256;

  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Password hasher.
   *
   * @param secureRandom the secure random
   */
  @Inject
  public PasswordHasher(final SecureRandom secureRandom) {
    LOGGER.info("PasswordHasher({})", secureRandom);
    this.secureRandom = secureRandom;
  }

  /**
   * Hash a plain text password with a fresh salt.
   *
   * @param password the password
   * @return the encoded hash
   */
  public String hash(final String password) {
    final byte[] salt = new byte[SALT_BYTES];
    secureRandom.nextBytes(salt);
    final byte[] hash = derive(password, salt, ITERATIONS);
    return String.join("$", SCHEME, Integer.toString(ITERATIONS),
        Hex.encodeHexString(salt), Hex.encodeHexString(hash));
  }

  /**
   * Whether the password produces the encoded hash.
   *
   * @param password the password
   * @param encoded  the encoded hash
   * @return the boolean
   */
  public boolean matches(final String password, final String encoded) {
    final String[] parts = encoded.split("\\$");
    if (parts.length != 4 || !SCHEME.equals(parts[0])) {
      LOGGER.warn("matches(): unrecognized hash format");
      return false;
    }
    try {
      final int iterations = Integer.parseInt(parts[1]);
      final byte[] salt = Hex.decodeHex(parts[2]);
      final byte[] expected = Hex.decodeHex(parts[3]);
      return MessageDigest.isEqual(expected, derive(password, salt, iterations));
    } catch (NumberFormatException | DecoderException e) {
      LOGGER.warn("matches(): malformed hash", e);
      return false;
    }
  }

  private byte[] derive(final String password, final byte[] salt, final int iterations) {
    final KeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_BITS);
    try {
      return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to hash password", e);
    }
  }

}
