package io.github.wphillipmoore.unifi.client.options;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class VerifyPolicyTest {

  @Test
  void falseDisablesVerification() {
    assertThat(VerifyPolicy.from(false)).isInstanceOf(VerifyPolicy.Disabled.class);
  }

  @Test
  void trueUsesSystemTrust() {
    assertThat(VerifyPolicy.from(true)).isInstanceOf(VerifyPolicy.SystemTrust.class);
  }

  @Test
  void stringIsCertificateBundle() {
    assertThat(VerifyPolicy.from("/your/unifi/cert.pem"))
        .isEqualTo(new VerifyPolicy.CertificateBundle(Path.of("/your/unifi/cert.pem")));
  }

  @Test
  void pathIsCertificateBundle() {
    Path path = Path.of("cert.pem");

    assertThat(VerifyPolicy.from(path)).isEqualTo(VerifyPolicy.certificateBundle(path));
  }

  @Test
  void policyPassesThrough() {
    VerifyPolicy policy = VerifyPolicy.systemTrust();

    assertThat(VerifyPolicy.from(policy)).isSameAs(policy);
  }

  @Test
  void unsupportedTypeIsRejected() {
    assertThatThrownBy(() -> VerifyPolicy.from(42))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("java.lang.Integer");
  }

  @Test
  void nullBundlePathThrowsNullPointerException() {
    assertThatThrownBy(() -> new VerifyPolicy.CertificateBundle(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("path");
  }

  @Test
  void sealedInterfacePermitsExactlyThreeTypes() {
    assertThat(VerifyPolicy.class.getPermittedSubclasses())
        .extracting(Class::getSimpleName)
        .containsExactlyInAnyOrder("Disabled", "SystemTrust", "CertificateBundle");
  }
}
