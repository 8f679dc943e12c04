package com.consullo.agenthost.security;

/**
 * Authenticated symmetric encryption for credentials at rest.
 *
 * @since 1.0
 */
public interface CredentialCipher {

  /**
   * Encrypts {@code plaintext}.
   *
   * @param plaintext bytes to protect
   * @param hexKey hex-encoded 256-bit key
   * @return hex-encoded ciphertext, nonce first
   * @throws CipherException if the key is malformed or encryption fails
   */
  String encrypt(byte[] plaintext, String hexKey) throws CipherException;

  /**
   * Decrypts a value produced by {@link #encrypt}.
   *
   * @param hexCiphertext hex-encoded ciphertext
   * @param hexKey hex-encoded 256-bit key
   * @return plaintext bytes
   * @throws CipherAuthenticationException if the ciphertext does not authenticate under the key
   * @throws CipherException if the input is malformed
   */
  byte[] decrypt(String hexCiphertext, String hexKey) throws CipherException;
}
