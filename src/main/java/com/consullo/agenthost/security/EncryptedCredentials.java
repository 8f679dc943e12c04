package com.consullo.agenthost.security;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Encrypted credential values as persisted in the session record.
 *
 * @param anthropicApiKey hex ciphertext of the API key
 * @param githubToken hex ciphertext of the GitHub token, or null
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncryptedCredentials(String anthropicApiKey, String githubToken) {
}
