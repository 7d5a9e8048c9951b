package io.kudos.crypto;

import javax.crypto.SecretKey;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies {@link FieldCipher} to sensitive columns at the row boundary.
 *
 * <p>A codec either holds a key and encrypts, or is the {@link #PLAINTEXT} codec that passes
 * values through unchanged. Decoding falls back to the stored value when decryption fails, so
 * rows written before a key was configured stay readable.
 */
public final class FieldCodec {
  private static final Logger logger = Logger.getLogger(FieldCodec.class.getName());

  /** Codec that stores and returns values unchanged. */
  public static final FieldCodec PLAINTEXT = new FieldCodec(null);

  private final SecretKey key;

  private FieldCodec(SecretKey key) {
    this.key = key;
  }

  /**
   * Creates a codec for the given operator passphrase.
   *
   * @param passphrase the data encryption key, may be null or blank
   * @return an encrypting codec, or {@link #PLAINTEXT} with a logged warning when no key is set
   */
  public static FieldCodec of(String passphrase) {
    if (passphrase == null || passphrase.isBlank()) {
      logger.log(Level.WARNING,
          "No data encryption key configured; sensitive fields will be stored in plaintext");
      return PLAINTEXT;
    }
    return new FieldCodec(FieldCipher.deriveKey(passphrase));
  }

  /**
   * Creates an encrypting codec from an existing key.
   *
   * @param key the AES key
   * @return an encrypting codec
   */
  public static FieldCodec withKey(SecretKey key) {
    if (key == null) {
      throw new IllegalArgumentException("key must not be null");
    }
    return new FieldCodec(key);
  }

  public boolean isEncrypting() {
    return key != null;
  }

  /**
   * @param value a plaintext field value, may be null
   * @return the value to store
   */
  public String encode(String value) {
    if (value == null || key == null) {
      return value;
    }
    return FieldCipher.encrypt(value, key);
  }

  /**
   * @param stored the stored column value, may be null
   * @return the plaintext value
   */
  public String decode(String stored) {
    if (stored == null || key == null) {
      return stored;
    }
    String plaintext = FieldCipher.decrypt(stored, key);
    return plaintext != null ? plaintext : stored;
  }
}
