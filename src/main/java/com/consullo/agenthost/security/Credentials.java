package com.consullo.agenthost.security;

/**
 * Plaintext credentials handed to a new agent process.
 *
 * <p>Instances live only between receipt and process spawn / encryption. {@link #toString()} never
 * prints the values.
 *
 * @param anthropicApiKey API key exported to the agent as {@code ANTHROPIC_API_KEY}
 * @param githubToken optional token exported as {@code GITHUB_TOKEN}; may be null or blank
 * @since 1.0
 */
public record Credentials(String anthropicApiKey, String githubToken) {

  public boolean hasGithubToken() {
    return githubToken != null && !githubToken.isBlank();
  }

  @Override
  public String toString() {
    return "Credentials[anthropicApiKey=***, githubToken=" + (hasGithubToken() ? "***" : "<none>") + "]";
  }
}
