package com.consullo.agenthost.api;

/**
 * Identity of one API call, as extracted by whatever transport sits in front of the facade.
 *
 * @param clientAddress rate limit key, usually the remote address
 * @param bearerToken token from the authorization header, without the {@code Bearer } prefix
 * @param userId end user the call acts for
 * @since 1.0
 */
public record CallerContext(String clientAddress, String bearerToken, String userId) {

  @Override
  public String toString() {
    return "CallerContext[clientAddress=" + clientAddress + ", userId=" + userId + "]";
  }
}
