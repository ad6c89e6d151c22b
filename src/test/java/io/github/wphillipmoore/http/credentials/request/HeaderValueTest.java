package io.github.wphillipmoore.http.credentials.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HeaderValueTest {

  @Test
  void plainValueIsRendered() {
    HeaderValue value = HeaderValue.of("application/json");

    assertThat(value.value()).isEqualTo("application/json");
    assertThat(value.isSensitive()).isFalse();
    assertThat(value.toString()).isEqualTo("application/json");
  }

  @Test
  void sensitiveValueIsRedacted() {
    HeaderValue value = HeaderValue.sensitive("Basic dXNlcjpwYXNzd29yZA==");

    assertThat(value.value()).isEqualTo("Basic dXNlcjpwYXNzd29yZA==");
    assertThat(value.isSensitive()).isTrue();
    assertThat(value.toString()).isEqualTo("██");
  }

  @Test
  void withSensitiveTogglesFlag() {
    HeaderValue sensitive = HeaderValue.sensitive("secret");

    HeaderValue plain = sensitive.withSensitive(false);

    assertThat(plain.isSensitive()).isFalse();
    assertThat(plain.toString()).isEqualTo("secret");
    assertThat(sensitive.isSensitive()).isTrue();
    assertThat(sensitive.withSensitive(true)).isSameAs(sensitive);
  }

  @Test
  void equalityIgnoresSensitivity() {
    HeaderValue plain = HeaderValue.of("secret");
    HeaderValue sensitive = HeaderValue.sensitive("secret");

    assertThat(plain).isEqualTo(sensitive);
    assertThat(plain.hashCode()).isEqualTo(sensitive.hashCode());
    assertThat(plain).isNotEqualTo(HeaderValue.of("other"));
  }

  @Test
  void lineBreaksAreRejected() {
    assertThatThrownBy(() -> HeaderValue.of("a\r\nInjected: yes"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unexpected char 0xd at 1 in header value");
  }

  @Test
  void nulIsRejected() {
    assertThatThrownBy(() -> HeaderValue.sensitive("a\0b"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nullValueThrowsNullPointerException() {
    assertThatThrownBy(() -> HeaderValue.of(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("value");
  }
}
