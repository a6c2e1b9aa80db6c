package com.codeheadsystems.credhash.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.credhash.TestParameters;
import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.config.MapParameterSource;
import com.codeheadsystems.credhash.config.ParameterStore;
import com.codeheadsystems.credhash.exception.ConfigurationException;
import com.codeheadsystems.credhash.format.EncodedFields;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BcryptAlgorithmTest {

  private static final byte[] PASSWORD = "correct horse".getBytes(StandardCharsets.UTF_8);

  private final BcryptAlgorithm algorithm = new BcryptAlgorithm(TestParameters.store(), new RandomProvider());

  private DecodedHash decode(String encoded) {
    return algorithm.format().parse(EncodedFields.split(encoded)).orThrow();
  }

  private static BcryptAlgorithm withCost(String cost) {
    Map<String, String> values = TestParameters.values();
    values.put(ParameterStore.BCRYPT_COST, cost);
    return new BcryptAlgorithm(new ParameterStore(new MapParameterSource(values)), new RandomProvider());
  }

  @Test
  void encode_wrapsBcryptString() {
    String encoded = algorithm.encode(PASSWORD);
    DecodedHash decoded = decode(encoded);

    assertThat(encoded).startsWith("$bcrypt$c=4$");
    assertThat(new String(decoded.hash(), StandardCharsets.US_ASCII)).startsWith("$2a$04$").hasSize(60);
  }

  @Test
  void encode_freshSaltEveryCall() {
    assertThat(algorithm.encode(PASSWORD)).isNotEqualTo(algorithm.encode(PASSWORD));
  }

  @Test
  void encode_passwordLongerThan72Bytes_throws() {
    byte[] tooLong = new byte[BcryptAlgorithm.MAX_PASSWORD_BYTES + 1];
    Arrays.fill(tooLong, (byte) 'a');

    assertThatThrownBy(() -> algorithm.encode(tooLong))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("72");
  }

  @Test
  void encode_exactly72Bytes_roundTrips() {
    byte[] longest = new byte[BcryptAlgorithm.MAX_PASSWORD_BYTES];
    Arrays.fill(longest, (byte) 'a');

    assertThat(algorithm.matches(longest, decode(algorithm.encode(longest)))).isTrue();
  }

  @Test
  void encode_missingCost_throws() {
    Map<String, String> values = TestParameters.values();
    values.remove(ParameterStore.BCRYPT_COST);
    BcryptAlgorithm unconfigured =
        new BcryptAlgorithm(new ParameterStore(new MapParameterSource(values)), new RandomProvider());

    assertThatThrownBy(() -> unconfigured.encode(PASSWORD))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void matches_correctAndWrongPassword() {
    DecodedHash decoded = decode(algorithm.encode(PASSWORD));

    assertThat(algorithm.matches(PASSWORD, decoded)).isTrue();
    assertThat(algorithm.matches("correct horsf".getBytes(StandardCharsets.UTF_8), decoded)).isFalse();
  }

  @Test
  void matches_knownVector() {
    assertThat(algorithm.matches(
        TestParameters.VECTOR_PASSWORD.getBytes(StandardCharsets.UTF_8),
        decode(TestParameters.BCRYPT_VECTOR))).isTrue();
  }

  @Test
  void needsRehash_followsConfiguredCost() {
    DecodedHash decoded = decode(algorithm.encode(PASSWORD));

    assertThat(algorithm.needsRehash(decoded)).isFalse();
    assertThat(withCost("5").needsRehash(decoded)).isTrue();
  }
}
