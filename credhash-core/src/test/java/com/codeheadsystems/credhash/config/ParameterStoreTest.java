package com.codeheadsystems.credhash.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.credhash.TestParameters;
import com.codeheadsystems.credhash.exception.ConfigurationException;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import com.codeheadsystems.credhash.model.Argon2idParameters;
import com.codeheadsystems.credhash.model.BcryptParameters;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ParameterStoreTest {

  @Mock
  private ParameterSource source;

  private static ParameterStore storeWith(String key, String value) {
    Map<String, String> values = TestParameters.values();
    if (value == null) {
      values.remove(key);
    } else {
      values.put(key, value);
    }
    return new ParameterStore(new MapParameterSource(values));
  }

  // --- argon2id ---

  @Test
  void argon2id_resolvesAllValues() {
    Argon2idParameters parameters = TestParameters.store().argon2id();

    assertThat(parameters).isEqualTo(new Argon2idParameters(
        TestParameters.MEMORY, TestParameters.ITERATIONS, TestParameters.PARALLELISM,
        TestParameters.SALT_LENGTH, TestParameters.KEY_LENGTH));
  }

  @Test
  void argon2id_missingMemory_throwsNamingKey() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_MEMORY, null).argon2id())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining(ParameterStore.ARGON2ID_MEMORY)
        .extracting(e -> ((ConfigurationException) e).key())
        .isEqualTo(ParameterStore.ARGON2ID_MEMORY);
  }

  @Test
  void argon2id_blankValue_isTreatedAsMissing() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_ITERATIONS, "  ").argon2id())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Missing");
  }

  @Test
  void argon2id_nonNumericValue_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_PARALLELISM, "two").argon2id())
        .isInstanceOf(ConfigurationException.class)
        .hasCauseInstanceOf(NumberFormatException.class)
        .extracting(e -> ((ConfigurationException) e).key())
        .isEqualTo(ParameterStore.ARGON2ID_PARALLELISM);
  }

  @Test
  void argon2id_surroundingWhitespace_isStripped() {
    assertThat(storeWith(ParameterStore.ARGON2ID_ITERATIONS, " 3 ").argon2id().iterations()).isEqualTo(3);
  }

  @Test
  void argon2id_zeroIterations_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_ITERATIONS, "0").argon2id())
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void argon2id_parallelismAbove255_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_PARALLELISM, "256").argon2id())
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void argon2id_memoryBelowEightBlocksPerLane_throws() {
    Map<String, String> values = TestParameters.values();
    values.put(ParameterStore.ARGON2ID_PARALLELISM, "4");
    values.put(ParameterStore.ARGON2ID_MEMORY, "31");
    ParameterStore store = new ParameterStore(new MapParameterSource(values));

    assertThatThrownBy(store::argon2id)
        .isInstanceOf(ConfigurationException.class)
        .extracting(e -> ((ConfigurationException) e).key())
        .isEqualTo(ParameterStore.ARGON2ID_MEMORY);
  }

  @Test
  void argon2id_memoryAboveLimit_throws() {
    String tooMuch = String.valueOf(Argon2idParameters.MAX_MEMORY_KIB + 1);

    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_MEMORY, tooMuch).argon2id())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining(String.valueOf(Argon2idParameters.MAX_MEMORY_KIB));
  }

  @Test
  void argon2id_iterationsAboveLimit_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_ITERATIONS, "257").argon2id())
        .isInstanceOf(ConfigurationException.class)
        .extracting(e -> ((ConfigurationException) e).key())
        .isEqualTo(ParameterStore.ARGON2ID_ITERATIONS);
  }

  @Test
  void argon2id_keyLengthBelowFour_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_KEY_LENGTH, "3").argon2id())
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void argon2id_zeroSaltLength_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.ARGON2ID_SALT_LENGTH, "0").argon2id())
        .isInstanceOf(ConfigurationException.class);
  }

  // --- bcrypt ---

  @Test
  void bcrypt_resolvesCost() {
    assertThat(TestParameters.store().bcrypt()).isEqualTo(new BcryptParameters(TestParameters.BCRYPT_COST));
  }

  @Test
  void bcrypt_costOutOfRange_throws() {
    assertThatThrownBy(() -> storeWith(ParameterStore.BCRYPT_COST, "3").bcrypt())
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> storeWith(ParameterStore.BCRYPT_COST, "32").bcrypt())
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void bcrypt_missingCost_doesNotAffectArgon2id() {
    ParameterStore store = storeWith(ParameterStore.BCRYPT_COST, null);

    assertThat(store.argon2id()).isNotNull();
    assertThatThrownBy(store::bcrypt).isInstanceOf(ConfigurationException.class);
  }

  // --- resolve ---

  @Test
  void resolve_dispatchesByName() {
    ParameterStore store = TestParameters.store();

    assertThat(store.resolve("argon2id")).isInstanceOf(Argon2idParameters.class);
    assertThat(store.resolve("bcrypt")).isInstanceOf(BcryptParameters.class);
  }

  @Test
  void resolve_unknownAlgorithm_throws() {
    assertThatThrownBy(() -> TestParameters.store().resolve("scrypt"))
        .isInstanceOf(UnsupportedAlgorithmException.class);
  }

  @Test
  void bcrypt_readsSourceOnEveryCall() {
    when(source.get(anyString())).thenReturn(Optional.of("10"), Optional.of("12"));
    ParameterStore store = new ParameterStore(source);

    assertThat(store.bcrypt().cost()).isEqualTo(10);
    assertThat(store.bcrypt().cost()).isEqualTo(12);
    verify(source, times(2)).get(ParameterStore.BCRYPT_COST);
  }
}
