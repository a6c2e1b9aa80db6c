package com.codeheadsystems.credhash.springboot.config;

import com.codeheadsystems.credhash.PasswordHasher;
import com.codeheadsystems.credhash.algorithm.AlgorithmRegistry;
import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.config.ParameterSource;
import com.codeheadsystems.credhash.config.ParameterStore;
import java.security.SecureRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration
@EnableConfigurationProperties(CredhashProperties.class)
public class CredhashAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(CredhashAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance used for salts. Override this bean to supply a custom
   * implementation:
   * <pre>{@code
   *   @Bean
   *   public SecureRandom secureRandom() throws NoSuchAlgorithmException {
   *     return SecureRandom.getInstance("NativePRNG");
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public RandomProvider randomProvider(SecureRandom secureRandom) {
    return new RandomProvider(secureRandom);
  }

  /**
   * Reads {@code credhash.argon2id.*} and {@code credhash.bcrypt.cost} from the environment on
   * every call. Replace this bean to pull parameters from elsewhere.
   */
  @Bean
  @ConditionalOnMissingBean
  public ParameterSource parameterSource(Environment environment) {
    return new SpringEnvironmentParameterSource(environment);
  }

  @Bean
  @ConditionalOnMissingBean
  public ParameterStore parameterStore(ParameterSource parameterSource) {
    return new ParameterStore(parameterSource);
  }

  /**
   * The standard Argon2id and bcrypt registry. Applications adding an algorithm can define their
   * own registry bean, typically starting from {@code AlgorithmRegistry.standard(...).toBuilder()}.
   */
  @Bean
  @ConditionalOnMissingBean
  public AlgorithmRegistry algorithmRegistry(ParameterStore parameterStore, RandomProvider randomProvider) {
    return AlgorithmRegistry.standard(parameterStore, randomProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher(AlgorithmRegistry algorithmRegistry, CredhashProperties props) {
    PasswordHasher hasher = new PasswordHasher(algorithmRegistry, props.getDefaultAlgorithm());
    log.info("Password hasher ready, default algorithm {}", hasher.defaultAlgorithm());
    return hasher;
  }
}
