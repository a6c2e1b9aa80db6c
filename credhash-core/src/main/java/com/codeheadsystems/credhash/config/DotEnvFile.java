package com.codeheadsystems.credhash.config;

import com.codeheadsystems.credhash.exception.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@code .env} file of {@code NAME=value} lines into an environment-style parameter source.
 * <p>
 * Supported syntax: blank lines, {@code #} comment lines, an optional {@code export } prefix,
 * single or double quoted values, and a trailing {@code  # comment} after any value.
 * The file is read once; the returned source is immutable.
 */
public class DotEnvFile {

  private static final Logger log = LoggerFactory.getLogger(DotEnvFile.class);

  private DotEnvFile() {
  }

  /**
   * Reads and parses the file.
   *
   * @param path the file
   * @return a source that resolves keys the same way the process environment does
   * @throws IOException            if the file cannot be read
   * @throws ConfigurationException if a line is not {@code NAME=value}
   */
  public static EnvironmentParameterSource load(Path path) throws IOException {
    Map<String, String> variables = parse(path.toString(), Files.readAllLines(path, StandardCharsets.UTF_8));
    log.debug("Loaded {} variables from {}", variables.size(), path);
    return new EnvironmentParameterSource(Map.copyOf(variables)::get);
  }

  static Map<String, String> parse(String origin, List<String> lines) {
    Map<String, String> variables = new HashMap<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).strip();
      }
      int eq = line.indexOf('=');
      if (eq <= 0) {
        throw new ConfigurationException(origin + ":" + (i + 1), "Expected NAME=value at line " + (i + 1));
      }
      String name = line.substring(0, eq).strip();
      variables.put(name, unquote(line.substring(eq + 1).strip()));
    }
    return variables;
  }

  private static String unquote(String value) {
    if (!value.isEmpty()) {
      char first = value.charAt(0);
      if (first == '"' || first == '\'') {
        int close = value.indexOf(first, 1);
        if (close > 0 && isCommentOrEnd(value.substring(close + 1))) {
          return value.substring(1, close);
        }
      }
    }
    int comment = value.indexOf(" #");
    return comment < 0 ? value : value.substring(0, comment).strip();
  }

  private static boolean isCommentOrEnd(String rest) {
    String trailing = rest.strip();
    return trailing.isEmpty() || trailing.startsWith("#");
  }
}
