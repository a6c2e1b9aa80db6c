package com.codeheadsystems.credhash.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.codeheadsystems.credhash.TestParameters;
import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AlgorithmRegistryTest {

  @Mock
  private PasswordAlgorithm scrypt;

  private final AlgorithmRegistry standard = AlgorithmRegistry.standard(TestParameters.store(), new RandomProvider());

  @Test
  void standard_registersArgon2idAndBcrypt() {
    assertThat(standard.names()).containsExactly("argon2id", "bcrypt");
    assertThat(standard.lookup("argon2id")).isInstanceOf(Argon2idAlgorithm.class);
    assertThat(standard.lookup("bcrypt")).isInstanceOf(BcryptAlgorithm.class);
  }

  @Test
  void lookup_unknownName_throws() {
    assertThatThrownBy(() -> standard.lookup("scrypt"))
        .isInstanceOf(UnsupportedAlgorithmException.class)
        .hasMessageContaining("scrypt")
        .extracting(e -> ((UnsupportedAlgorithmException) e).algorithm())
        .isEqualTo("scrypt");
  }

  @Test
  void lookup_isCaseSensitive() {
    assertThat(standard.supports("Argon2id")).isFalse();
    assertThatThrownBy(() -> standard.lookup("BCRYPT")).isInstanceOf(UnsupportedAlgorithmException.class);
  }

  @Test
  void toBuilder_extendsWithoutChangingOriginal() {
    when(scrypt.name()).thenReturn("scrypt");

    AlgorithmRegistry extended = standard.toBuilder().register(scrypt).build();

    assertThat(extended.lookup("scrypt")).isSameAs(scrypt);
    assertThat(extended.names()).containsExactly("argon2id", "bcrypt", "scrypt");
    assertThat(standard.supports("scrypt")).isFalse();
  }

  @Test
  void register_duplicateName_throws() {
    when(scrypt.name()).thenReturn("bcrypt");

    assertThatThrownBy(() -> standard.toBuilder().register(scrypt))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("bcrypt");
  }

  @Test
  void names_isUnmodifiable() {
    assertThatThrownBy(() -> standard.names().add("scrypt"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
