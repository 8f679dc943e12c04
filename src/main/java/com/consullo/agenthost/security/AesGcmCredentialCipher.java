package com.consullo.agenthost.security;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM cipher. Output is {@code hex(nonce || ciphertext || tag)} with a random 12-byte nonce.
 *
 * @since 1.0
 */
public final class AesGcmCredentialCipher implements CredentialCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int KEY_BYTES = 32;
  private static final int NONCE_BYTES = 12;
  private static final int TAG_BITS = 128;
  private static final HexFormat HEX = HexFormat.of();

  private final SecureRandom random = new SecureRandom();

  @Override
  public String encrypt(final byte[] plaintext, final String hexKey) throws CipherException {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext must not be null.");
    }
    final SecretKeySpec key = decodeKey(hexKey);
    final byte[] nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      final byte[] sealed = cipher.doFinal(plaintext);
      final byte[] out = new byte[nonce.length + sealed.length];
      System.arraycopy(nonce, 0, out, 0, nonce.length);
      System.arraycopy(sealed, 0, out, nonce.length, sealed.length);
      return HEX.formatHex(out);
    } catch (final GeneralSecurityException e) {
      throw new CipherException("failed to encrypt", e);
    }
  }

  @Override
  public byte[] decrypt(final String hexCiphertext, final String hexKey) throws CipherException {
    final SecretKeySpec key = decodeKey(hexKey);
    final byte[] raw;
    try {
      raw = HEX.parseHex(hexCiphertext);
    } catch (final IllegalArgumentException | NullPointerException e) {
      throw new CipherException("invalid hex ciphertext", e);
    }
    if (raw.length < NONCE_BYTES + TAG_BITS / 8) {
      throw new CipherException("ciphertext too short");
    }
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 0, NONCE_BYTES));
      return cipher.doFinal(raw, NONCE_BYTES, raw.length - NONCE_BYTES);
    } catch (final AEADBadTagException e) {
      throw new CipherAuthenticationException("failed to decrypt: authentication failed", e);
    } catch (final GeneralSecurityException e) {
      throw new CipherException("failed to decrypt", e);
    }
  }

  private static SecretKeySpec decodeKey(final String hexKey) throws CipherException {
    final byte[] key;
    try {
      key = HEX.parseHex(hexKey);
    } catch (final IllegalArgumentException | NullPointerException e) {
      throw new CipherException("invalid hex key", e);
    }
    if (key.length != KEY_BYTES) {
      throw new CipherException("encryption key must be 32 bytes (got " + key.length + ")");
    }
    return new SecretKeySpec(key, "AES");
  }
}
