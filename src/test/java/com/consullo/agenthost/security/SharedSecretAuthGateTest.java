package com.consullo.agenthost.security;

import com.consullo.agenthost.error.AuthException;
import com.consullo.agenthost.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for shared-secret authentication.
 *
 * @since 1.0
 */
public class SharedSecretAuthGateTest {

  @Test
  @DisplayName("Should accept the configured secret")
  void authenticate_MatchingToken_Accepted() {
    final SharedSecretAuthGate gate = new SharedSecretAuthGate("s3cret");

    assertThat(gate.enabled()).isTrue();
    assertThatCode(() -> gate.authenticate("s3cret")).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("Should reject missing, empty and wrong tokens")
  void authenticate_BadToken_AuthFailure() {
    final SharedSecretAuthGate gate = new SharedSecretAuthGate("s3cret");

    assertThatThrownBy(() -> gate.authenticate(null)).isInstanceOf(AuthException.class);
    assertThatThrownBy(() -> gate.authenticate("")).isInstanceOf(AuthException.class);
    assertThatThrownBy(() -> gate.authenticate("s3cre")).isInstanceOf(AuthException.class);
    assertThatThrownBy(() -> gate.authenticate("s3cret2"))
        .isInstanceOfSatisfying(AuthException.class, e -> assertThat(e.code()).isEqualTo(ErrorCode.AUTH));
  }

  @Test
  @DisplayName("Should let every caller through when no secret is configured")
  void authenticate_NoSecret_Disabled() {
    final SharedSecretAuthGate gate = new SharedSecretAuthGate(" ");

    assertThat(gate.enabled()).isFalse();
    assertThatCode(() -> gate.authenticate(null)).doesNotThrowAnyException();
    assertThatCode(() -> gate.authenticate("anything")).doesNotThrowAnyException();
  }
}
