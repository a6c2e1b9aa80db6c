package com.codeheadsystems.credhash.cli;

import com.codeheadsystems.credhash.PasswordHasher;
import com.codeheadsystems.credhash.config.CompositeParameterSource;
import com.codeheadsystems.credhash.config.DotEnvFile;
import com.codeheadsystems.credhash.config.EnvironmentParameterSource;
import com.codeheadsystems.credhash.config.ParameterSource;
import com.codeheadsystems.credhash.exception.ConfigurationException;
import com.codeheadsystems.credhash.exception.CredentialHashException;
import com.codeheadsystems.credhash.exception.CryptoFailureException;
import com.codeheadsystems.credhash.exception.FormatException;
import com.codeheadsystems.credhash.exception.IncompatibilityException;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import com.codeheadsystems.credhash.model.AlgorithmParameters;
import com.codeheadsystems.credhash.model.Argon2idParameters;
import com.codeheadsystems.credhash.model.BcryptParameters;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end for hashing, verifying and inspecting password hashes.
 *
 * <pre>
 * Usage:
 *   java -jar credhash-cli.jar &lt;command&gt; &lt;arguments&gt; [--env-file &lt;path&gt;]
 *
 * Commands:
 *   hash   &lt;algorithm&gt; &lt;password&gt;   Print a new encoded hash (argon2id or bcrypt).
 *   verify &lt;password&gt; &lt;encoded&gt;     Print "match" or "no match".
 *   decode &lt;encoded&gt;                Print the algorithm and its parameters.
 *
 * Options:
 *   --env-file &lt;path&gt;   Read parameters from a .env file; process variables take precedence.
 *
 * Exit codes:
 *   0  success, or a matching password
 *   1  usage error or unreadable env file
 *   2  hashing error (configuration, format, unsupported algorithm, ...)
 *   3  password does not match
 * </pre>
 *
 * <p>Parameters come from ARGON2ID_MEMORY, ARGON2ID_ITERATIONS, ARGON2ID_PARALLELISM,
 * ARGON2ID_SALT_LENGTH, ARGON2ID_KEY_LENGTH and BCRYPT_COST. Only {@code hash} needs them.
 */
public class CredhashCli {

  public static final int EXIT_OK = 0;
  public static final int EXIT_USAGE = 1;
  public static final int EXIT_ERROR = 2;
  public static final int EXIT_NO_MATCH = 3;

  private static final Logger log = LoggerFactory.getLogger(CredhashCli.class);

  private final PrintStream out;
  private final PrintStream err;
  private final ParameterSource environment;

  /**
   * Instantiates a new Credhash cli.
   *
   * @param out         standard output
   * @param err         standard error
   * @param environment where parameters are read when no env file overrides them
   */
  public CredhashCli(PrintStream out, PrintStream err, ParameterSource environment) {
    this.out = out;
    this.err = err;
    this.environment = environment;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int status = new CredhashCli(System.out, System.err, new EnvironmentParameterSource()).run(args);
    System.exit(status);
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @return the process exit code
   */
  public int run(String[] args) {
    String envFile = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      if (args[i].equals("--env-file")) {
        if (i + 1 >= args.length) {
          err.println("Missing value for --env-file");
          printUsage();
          return EXIT_USAGE;
        }
        envFile = args[++i];
      } else {
        positional.add(args[i]);
      }
    }

    if (positional.isEmpty()) {
      printUsage();
      return EXIT_USAGE;
    }

    ParameterSource source = environment;
    if (envFile != null) {
      try {
        source = CompositeParameterSource.of(environment, DotEnvFile.load(Path.of(envFile)));
      } catch (IOException e) {
        err.println("Cannot read env file " + envFile + ": " + e.getMessage());
        return EXIT_USAGE;
      } catch (ConfigurationException e) {
        err.println("Invalid env file " + envFile + ": " + e.getMessage());
        return EXIT_USAGE;
      }
    }

    String command = positional.get(0);
    List<String> operands = positional.subList(1, positional.size());
    log.debug("Running command {}", command);
    PasswordHasher hasher = PasswordHasher.standard(source);

    try {
      return switch (command) {
        case "hash"   -> operands.size() == 2 ? runHash(hasher, operands.get(0), operands.get(1)) : usage();
        case "verify" -> operands.size() == 2 ? runVerify(hasher, operands.get(0), operands.get(1)) : usage();
        case "decode" -> operands.size() == 1 ? runDecode(hasher, operands.get(0)) : usage();
        default -> {
          err.println("Unknown command: " + command);
          yield usage();
        }
      };
    } catch (CredentialHashException e) {
      err.println("Error (" + kind(e) + "): " + e.getMessage());
      return EXIT_ERROR;
    } catch (IllegalArgumentException e) {
      err.println("Error (invalid-input): " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  private int runHash(PasswordHasher hasher, String algorithm, String password) {
    out.println(hasher.encode(algorithm, password));
    return EXIT_OK;
  }

  private int runVerify(PasswordHasher hasher, String password, String encoded) {
    if (hasher.verify(password, encoded)) {
      out.println("match");
      return EXIT_OK;
    }
    out.println("no match");
    return EXIT_NO_MATCH;
  }

  private int runDecode(PasswordHasher hasher, String encoded) {
    DecodedHash decoded = hasher.decode(encoded);
    out.println("algorithm   : " + decoded.algorithm());
    AlgorithmParameters parameters = decoded.parameters();
    if (parameters instanceof Argon2idParameters argon2) {
      out.println("version     : " + Argon2idParameters.VERSION);
      out.println("memory      : " + argon2.memoryCostKiB() + " KiB");
      out.println("iterations  : " + argon2.iterations());
      out.println("parallelism : " + argon2.parallelism());
      out.println("salt length : " + argon2.saltLength());
      out.println("key length  : " + argon2.keyLength());
    } else if (parameters instanceof BcryptParameters bcrypt) {
      out.println("cost        : " + bcrypt.cost());
    } else {
      out.println("parameters  : " + parameters);
    }
    return EXIT_OK;
  }

  /**
   * Short name of the failure for the error line.
   *
   * @param e the failure
   * @return the kind
   */
  static String kind(CredentialHashException e) {
    if (e instanceof ConfigurationException) {
      return "configuration";
    } else if (e instanceof UnsupportedAlgorithmException) {
      return "unsupported-algorithm";
    } else if (e instanceof FormatException) {
      return "format";
    } else if (e instanceof IncompatibilityException) {
      return "incompatibility";
    } else if (e instanceof CryptoFailureException) {
      return "crypto-failure";
    }
    return "hashing";
  }

  private int usage() {
    printUsage();
    return EXIT_USAGE;
  }

  private void printUsage() {
    err.println("Usage: CredhashCli <command> <arguments> [--env-file <path>]");
    err.println();
    err.println("Commands:");
    err.println("  hash   <algorithm> <password>   Print a new encoded hash (argon2id or bcrypt)");
    err.println("  verify <password> <encoded>     Print \"match\" (exit 0) or \"no match\" (exit 3)");
    err.println("  decode <encoded>                Print the algorithm and its parameters");
    err.println();
    err.println("Options:");
    err.println("  --env-file <path>   Read parameters from a .env file; process variables take precedence");
    err.println();
    err.println("Examples:");
    err.println("  BCRYPT_COST=12 java -jar credhash-cli.jar hash bcrypt hunter2");
    err.println("  java -jar credhash-cli.jar hash argon2id hunter2 --env-file .env");
    err.println("  java -jar credhash-cli.jar verify hunter2 '$argon2id$v=19,m=65536,t=3,p=2$...'");
  }
}
