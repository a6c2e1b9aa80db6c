package com.codeheadsystems.credhash.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.credhash.exception.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DotEnvFileTest {

  @TempDir
  Path tempDir;

  @Test
  void parse_handlesCommentsQuotesAndExport() {
    Map<String, String> variables = DotEnvFile.parse("test.env", List.of(
        "# hashing parameters",
        "",
        "ARGON2ID_MEMORY=65536",
        "export ARGON2ID_ITERATIONS=3",
        "ARGON2ID_PARALLELISM = \"2\"",
        "ARGON2ID_SALT_LENGTH='16'",
        "BCRYPT_COST=12 # production"));

    assertThat(variables).containsExactlyInAnyOrderEntriesOf(Map.of(
        "ARGON2ID_MEMORY", "65536",
        "ARGON2ID_ITERATIONS", "3",
        "ARGON2ID_PARALLELISM", "2",
        "ARGON2ID_SALT_LENGTH", "16",
        "BCRYPT_COST", "12"));
  }

  @Test
  void parse_quotedValueWithTrailingComment_dropsQuotesAndComment() {
    Map<String, String> variables = DotEnvFile.parse("test.env", List.of(
        "BCRYPT_COST=\"12\" # prod",
        "ARGON2ID_MEMORY='65536'   #comment",
        "LABEL='a # b'"));

    assertThat(variables)
        .containsEntry("BCRYPT_COST", "12")
        .containsEntry("ARGON2ID_MEMORY", "65536")
        .containsEntry("LABEL", "a # b");
  }

  @Test
  void load_quotedCostWithComment_resolves() throws IOException {
    Path file = tempDir.resolve("commented.env");
    Files.writeString(file, "BCRYPT_COST=\"12\" # prod\n", StandardCharsets.UTF_8);

    assertThat(new ParameterStore(DotEnvFile.load(file)).bcrypt().cost()).isEqualTo(12);
  }

  @Test
  void parse_lineWithoutEquals_throwsWithLineNumber() {
    assertThatThrownBy(() -> DotEnvFile.parse("test.env", List.of("A=1", "garbage")))
        .isInstanceOf(ConfigurationException.class)
        .extracting(e -> ((ConfigurationException) e).key())
        .isEqualTo("test.env:2");
  }

  @Test
  void load_resolvesParameterKeys() throws IOException {
    Path file = tempDir.resolve(".env");
    Files.writeString(file, "ARGON2ID_KEY_LENGTH=32\nBCRYPT_COST=10\n", StandardCharsets.UTF_8);

    ParameterStore store = new ParameterStore(DotEnvFile.load(file));

    assertThat(store.bcrypt().cost()).isEqualTo(10);
    assertThat(store.requireInt(ParameterStore.ARGON2ID_KEY_LENGTH, 4, 64)).isEqualTo(32);
  }

  @Test
  void load_missingFile_throwsIoException() {
    assertThatThrownBy(() -> DotEnvFile.load(tempDir.resolve("absent.env")))
        .isInstanceOf(IOException.class);
  }
}
