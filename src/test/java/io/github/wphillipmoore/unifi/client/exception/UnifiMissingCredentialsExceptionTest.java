package io.github.wphillipmoore.unifi.client.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UnifiMissingCredentialsExceptionTest {

  @Test
  void messageNamesMissingField() {
    UnifiMissingCredentialsException ex = new UnifiMissingCredentialsException("password");
    assertThat(ex.getMissingField()).isEqualTo("password");
    assertThat(ex.getMessage()).startsWith("No password supplied");
  }

  @Test
  void isUnifiException() {
    assertThat(new UnifiMissingCredentialsException("username")).isInstanceOf(UnifiException.class);
  }
}
