package io.kudos.crypto;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Authenticated encryption of individual string fields with AES-256-GCM.
 *
 * <p>Every call to {@link #encrypt} draws a fresh 16-byte IV, so equal plaintexts produce
 * different ciphertexts. The encoded form is unpadded base64url of
 * {@code iv || tag || ciphertext}.
 *
 * <p>{@link #decrypt} fails closed: any malformed, truncated, tampered or foreign-key input
 * yields {@code null}. Callers cannot tell the causes apart.
 */
public final class FieldCipher {
  static final int KEY_LENGTH = 32;
  static final int IV_LENGTH = 16;
  static final int TAG_LENGTH = 16;

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private FieldCipher() {
  }

  /**
   * Derives a 256-bit key from an operator passphrase.
   *
   * <p>The UTF-8 bytes of the passphrase are truncated or zero-padded to 32 bytes. This is not
   * a key derivation function: short passphrases give low-entropy keys.
   *
   * @param passphrase the operator secret
   * @return an AES key
   * @throws IllegalArgumentException if {@code passphrase} is null or blank
   */
  public static SecretKey deriveKey(String passphrase) {
    if (passphrase == null || passphrase.isBlank()) {
      throw new IllegalArgumentException("passphrase must not be blank");
    }
    byte[] raw = Arrays.copyOf(passphrase.getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
    return new SecretKeySpec(raw, "AES");
  }

  /**
   * Encrypts one field value.
   *
   * @param plaintext the value to encrypt
   * @param key       the AES key
   * @return unpadded base64url of {@code iv || tag || ciphertext}
   * @throws IllegalStateException if the JCA provider rejects the key or transformation
   */
  public static String encrypt(String plaintext, SecretKey key) {
    Objects.requireNonNull(plaintext, "plaintext");
    Objects.requireNonNull(key, "key");
    byte[] iv = new byte[IV_LENGTH];
    RANDOM.nextBytes(iv);
    byte[] sealed;
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
      sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Field encryption failed", e);
    }
    // JCA appends the tag; the stored layout puts it before the ciphertext
    int ctLength = sealed.length - TAG_LENGTH;
    byte[] out = new byte[IV_LENGTH + sealed.length];
    System.arraycopy(iv, 0, out, 0, IV_LENGTH);
    System.arraycopy(sealed, ctLength, out, IV_LENGTH, TAG_LENGTH);
    System.arraycopy(sealed, 0, out, IV_LENGTH + TAG_LENGTH, ctLength);
    return ENCODER.encodeToString(out);
  }

  /**
   * Decrypts one field value.
   *
   * @param encoded the value produced by {@link #encrypt}
   * @param key     the AES key
   * @return the plaintext, or {@code null} if the input cannot be authenticated and decrypted
   */
  public static String decrypt(String encoded, SecretKey key) {
    if (encoded == null || encoded.isEmpty() || key == null) {
      return null;
    }
    byte[] data;
    try {
      data = DECODER.decode(encoded);
    } catch (IllegalArgumentException e) {
      return null;
    }
    if (data.length < IV_LENGTH + TAG_LENGTH + 1) {
      return null;
    }
    int ctLength = data.length - IV_LENGTH - TAG_LENGTH;
    byte[] sealed = new byte[ctLength + TAG_LENGTH];
    System.arraycopy(data, IV_LENGTH + TAG_LENGTH, sealed, 0, ctLength);
    System.arraycopy(data, IV_LENGTH, sealed, ctLength, TAG_LENGTH);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, data, 0, IV_LENGTH));
      return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      return null;
    }
  }
}
