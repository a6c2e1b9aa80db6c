package com.codeheadsystems.credhash.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StrictBase64Test {

  @Test
  void encode_omitsPadding() {
    assertThat(StrictBase64.encode("ab".getBytes(StandardCharsets.US_ASCII))).isEqualTo("YWI");
  }

  @Test
  void decode_acceptsUnpadded() {
    assertThat(StrictBase64.decode("YWI")).isEqualTo("ab".getBytes(StandardCharsets.US_ASCII));
  }

  @Test
  void decode_emptyString_isEmpty() {
    assertThat(StrictBase64.decode("")).isEmpty();
  }

  @Test
  void decode_knownSalt() {
    assertThat(StrictBase64.decode("gQc4ZccIqosKqCMKYUgP8A")).hasSize(16);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "YWI=",      // padding
      "YWJ",       // non-zero trailing bits
      "Y",         // impossible length
      "YW-I",      // url-safe alphabet
      "YW I",      // whitespace
      "YWI\n"
  })
  void decode_rejectsNonCanonicalInput(String text) {
    assertThatThrownBy(() -> StrictBase64.decode(text))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
