package com.consullo.agenthost.security;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the AES-256-GCM credential cipher.
 *
 * @since 1.0
 */
public class AesGcmCredentialCipherTest {

  private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
  private static final String OTHER_KEY = "ff0102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

  private final AesGcmCredentialCipher cipher = new AesGcmCredentialCipher();

  @Test
  @DisplayName("Should recover the plaintext with the same key")
  void decrypt_SameKey_ReturnsPlaintext() throws Exception {
    final String sealed = cipher.encrypt(bytes("sk-ant-secret"), KEY);

    assertThat(sealed).matches("[0-9a-f]+").doesNotContain("sk-ant");
    assertThat(new String(cipher.decrypt(sealed, KEY), StandardCharsets.UTF_8)).isEqualTo("sk-ant-secret");
  }

  @Test
  @DisplayName("Should use a fresh nonce for every encryption")
  void encrypt_SamePlaintextTwice_DifferentCiphertext() throws Exception {
    final String first = cipher.encrypt(bytes("token"), KEY);
    final String second = cipher.encrypt(bytes("token"), KEY);

    assertThat(first).isNotEqualTo(second);
    // 12-byte nonce + 5-byte body + 16-byte tag, hex encoded
    assertThat(first).hasSize((12 + 5 + 16) * 2);
  }

  @Test
  @DisplayName("Should fail authentication with the wrong key")
  void decrypt_WrongKey_AuthenticationFailure() throws Exception {
    final String sealed = cipher.encrypt(bytes("token"), KEY);

    assertThatThrownBy(() -> cipher.decrypt(sealed, OTHER_KEY))
        .isInstanceOf(CipherAuthenticationException.class);
  }

  @Test
  @DisplayName("Should fail authentication when the ciphertext was tampered with")
  void decrypt_Tampered_AuthenticationFailure() throws Exception {
    final String sealed = cipher.encrypt(bytes("token"), KEY);
    final char last = sealed.charAt(sealed.length() - 1);
    final String tampered = sealed.substring(0, sealed.length() - 1) + (last == '0' ? '1' : '0');

    assertThatThrownBy(() -> cipher.decrypt(tampered, KEY))
        .isInstanceOf(CipherAuthenticationException.class);
  }

  @Test
  @DisplayName("Should reject keys that are not 32 bytes of hex")
  void encrypt_BadKey_CipherException() {
    assertThatThrownBy(() -> cipher.encrypt(bytes("x"), "abcd"))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("32 bytes");
    assertThatThrownBy(() -> cipher.encrypt(bytes("x"), "not-hex"))
        .isInstanceOf(CipherException.class);
  }

  @Test
  @DisplayName("Should reject malformed or truncated ciphertext")
  void decrypt_Malformed_CipherException() {
    assertThatThrownBy(() -> cipher.decrypt("zz", KEY)).isInstanceOf(CipherException.class);
    assertThatThrownBy(() -> cipher.decrypt("00ff", KEY))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("too short");
  }

  private static byte[] bytes(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
