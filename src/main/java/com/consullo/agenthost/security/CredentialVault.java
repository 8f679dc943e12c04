package com.consullo.agenthost.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns plaintext {@link Credentials} into the JSON blob stored with a session record.
 *
 * <p>Without a key the vault refuses to produce a blob at all, so plaintext never reaches the store.
 *
 * @since 1.0
 */
public final class CredentialVault {

  private static final Logger LOGGER = LoggerFactory.getLogger(CredentialVault.class);
  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final CredentialCipher cipher;
  private final String hexKey;

  /**
   * Creates a vault.
   *
   * @param cipher cipher implementation
   * @param hexKey hex-encoded 256-bit key; null or blank disables persistence of credentials
   */
  public CredentialVault(final CredentialCipher cipher, final String hexKey) {
    Validate.notNull(cipher, "cipher must not be null");
    this.cipher = cipher;
    this.hexKey = StringUtils.trimToNull(hexKey);
    if (this.hexKey == null) {
      LOGGER.warn("ENCRYPTION_KEY is not configured; credentials will not be persisted");
    }
  }

  public boolean enabled() {
    return hexKey != null;
  }

  /**
   * Encrypts and serializes credentials.
   *
   * @param credentials plaintext credentials
   * @return JSON blob, or empty when no key is configured
   * @throws CipherException if encryption or serialization fails
   */
  public Optional<String> seal(final Credentials credentials) throws CipherException {
    Validate.notNull(credentials, "credentials must not be null");
    if (hexKey == null) {
      return Optional.empty();
    }
    final String apiKey = cipher.encrypt(bytes(credentials.anthropicApiKey()), hexKey);
    final String github = credentials.hasGithubToken()
        ? cipher.encrypt(bytes(credentials.githubToken()), hexKey)
        : null;
    try {
      return Optional.of(objectMapper.writeValueAsString(new EncryptedCredentials(apiKey, github)));
    } catch (final JsonProcessingException e) {
      throw new CipherException("failed to serialize encrypted credentials", e);
    }
  }

  /**
   * Reverses {@link #seal}.
   *
   * @param blob JSON blob from the store
   * @return plaintext credentials
   * @throws CipherException if no key is configured, the blob is malformed or does not authenticate
   */
  public Credentials unseal(final String blob) throws CipherException {
    if (hexKey == null) {
      throw new CipherException("no encryption key configured");
    }
    final EncryptedCredentials sealed;
    try {
      sealed = objectMapper.readValue(blob, EncryptedCredentials.class);
    } catch (final JsonProcessingException e) {
      throw new CipherException("malformed credential blob", e);
    }
    final String apiKey = new String(cipher.decrypt(sealed.anthropicApiKey(), hexKey), StandardCharsets.UTF_8);
    final String github = sealed.githubToken() == null
        ? null
        : new String(cipher.decrypt(sealed.githubToken(), hexKey), StandardCharsets.UTF_8);
    return new Credentials(apiKey, github);
  }

  private static byte[] bytes(final String value) {
    return StringUtils.defaultString(value).getBytes(StandardCharsets.UTF_8);
  }
}
