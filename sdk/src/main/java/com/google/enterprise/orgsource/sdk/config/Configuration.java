/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.enterprise.orgsource.sdk.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.MapDifference;
import com.google.common.collect.Maps;
import com.google.enterprise.orgsource.sdk.InvalidConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Static factory for retrieval settings.
 *
 * <p>Components declare their settings up front as {@link ConfigValue} placeholders, for example
 * {@code Configuration.getInteger("processor.maxConcurrency", 5)}. Placeholders created before
 * {@link #initConfig} runs are registered and resolved once the configuration is loaded; later
 * ones resolve immediately. Values are trimmed before parsing.
 *
 * <p>Per-type settings are layered with {@link #getOverriden}, so that
 * {@code metadata.Flow.maxConcurrency} falls back to {@code metadata.maxConcurrency}, which
 * falls back to its built-in default.
 *
 * <p>Use {@link ResetConfigRule} and {@link SetupConfigRule} in unit tests.
 */
public class Configuration {
  private static final Logger logger = Logger.getLogger(Configuration.class.getName());

  static final String DEFAULT_CONFIG_FILE = "orgsource-config.properties";
  private static final String PROPERTY_PREFIX = "-D";
  private static final String CONFIG_FILE_PROPERTY = "config";
  private static final Splitter KEY_VALUE = Splitter.on('=').limit(2).trimResults();

  @SuppressWarnings("rawtypes")
  private static final List<ConfigValue> pending = new ArrayList<>();
  private static final AtomicBoolean initialized = new AtomicBoolean();
  @Nullable private static Properties loadedConfig;

  private Configuration() {
    throw new AssertionError();
  }

  /**
   * Loads the properties file named by {@code -Dconfig=<file>} (default
   * {@value #DEFAULT_CONFIG_FILE}) and applies the other {@code -Dkey=value} arguments on top of
   * it. A missing file is not an error.
   *
   * @param args command line arguments; arguments not starting with {@code -D} are ignored
   * @throws IOException if the file exists but cannot be read
   */
  public static void initConfig(String[] args) throws IOException {
    checkNotNull(args, "arguments can not be null");
    Properties overrides = new Properties();
    for (String arg : args) {
      if (!arg.startsWith(PROPERTY_PREFIX)) {
        continue;
      }
      List<String> keyValue = KEY_VALUE.splitToList(arg.substring(PROPERTY_PREFIX.length()));
      if (keyValue.size() == 2 && !keyValue.get(0).isEmpty()) {
        overrides.setProperty(keyValue.get(0), keyValue.get(1));
      }
    }
    Path file = Paths.get(overrides.getProperty(CONFIG_FILE_PROPERTY, DEFAULT_CONFIG_FILE));
    Properties merged = new Properties();
    if (Files.isRegularFile(file)) {
      try (InputStream in = Files.newInputStream(file)) {
        merged.load(in);
      }
      logger.log(Level.CONFIG, "Loaded configuration from {0}", file.toAbsolutePath());
    } else {
      logger.log(Level.CONFIG, "Configuration file {0} not found, using defaults", file);
    }
    merged.putAll(overrides);
    initConfig(merged);
  }

  /**
   * Resolves every registered placeholder against {@code config}. Calling it again with the same
   * properties does nothing; with different properties it fails. If a value cannot be parsed no
   * placeholder is resolved and the configuration stays uninitialized.
   *
   * @throws InvalidConfigurationException if a value is malformed or a required key is missing
   */
  @SuppressWarnings("rawtypes")
  public static synchronized void initConfig(Properties config) {
    checkNotNull(config, "config can not be null");
    if (initialized.get()) {
      MapDifference<String, String> difference =
          Maps.difference(asMap(loadedConfig), asMap(config));
      if (difference.areEqual()) {
        logger.log(Level.CONFIG, "Configuration already loaded with the same properties");
        return;
      }
      throw new IllegalStateException("Configuration already loaded with different properties."
          + " Only in loaded: " + difference.entriesOnlyOnLeft().keySet()
          + ", only in new: " + difference.entriesOnlyOnRight().keySet()
          + ", differing: " + difference.entriesDiffering().keySet());
    }
    loadedConfig = config;
    synchronized (pending) {
      try {
        pending.forEach(Configuration::resolve);
        initialized.set(true);
      } catch (RuntimeException e) {
        pending.forEach(ConfigValue::reset);
        loadedConfig = null;
        throw e;
      }
      pending.forEach(ConfigValue::freeze);
    }
  }

  private static Map<String, String> asMap(Properties properties) {
    return Maps.toMap(properties.stringPropertyNames(), properties::getProperty);
  }

  /** Returns a copy of the loaded properties. */
  public static Properties getConfig() {
    checkState(initialized.get(), "configuration not initialized yet");
    Properties copy = new Properties();
    copy.putAll(loadedConfig);
    return copy;
  }

  public static boolean isInitialized() {
    return initialized.get();
  }

  /** Converts a configured string into a typed value. */
  public interface Parser<T> {
    /** @throws InvalidConfigurationException if the value is malformed */
    T parse(String value) throws InvalidConfigurationException;
  }

  private static final ImmutableMap<String, Boolean> BOOLEANS =
      ImmutableMap.of("true", true, "false", false);

  /** Accepts only {@code true} and {@code false}, ignoring case. */
  public static final Parser<Boolean> BOOLEAN_PARSER =
      value -> {
        Boolean parsed = BOOLEANS.get(Strings.nullToEmpty(value).toLowerCase(Locale.ROOT));
        if (parsed == null) {
          throw new InvalidConfigurationException(
              String.format("Invalid value [%s] for boolean configuration property", value));
        }
        return parsed;
      };

  public static final Parser<Integer> INTEGER_PARSER = numberParser(Integer::valueOf);

  public static final Parser<Long> LONG_PARSER = numberParser(Long::valueOf);

  public static final Parser<String> STRING_PARSER =
      value -> checkNotNull(value, "value to parse can not be null.");

  private static <T extends Number> Parser<T> numberParser(Function<String, T> valueOf) {
    return value -> {
      checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
      try {
        return valueOf.apply(value);
      } catch (NumberFormatException e) {
        throw new InvalidConfigurationException(
            String.format("Invalid number [%s]", value), e);
      }
    };
  }

  /** Comma separated values; blank entries are dropped. */
  private static <T> Parser<List<T>> listParser(Parser<T> elementParser) {
    return value -> {
      ImmutableList.Builder<T> parsed = ImmutableList.builder();
      for (String element : Splitter.on(',').trimResults().omitEmptyStrings()
          .split(checkNotNull(value))) {
        parsed.add(elementParser.parse(element));
      }
      return parsed.build();
    };
  }

  /**
   * Returns a value read from {@code configKey}, or from {@code fallback} when the key is not
   * set. Fallbacks can be chained.
   */
  public static <T> ConfigValue<T> getOverriden(String configKey, ConfigValue<T> fallback) {
    return register(new ConfigValue.Builder<T>()
        .setConfigKey(configKey)
        .setFallback(fallback)
        .build());
  }

  public static ConfigValue<Boolean> getBoolean(String configKey, Boolean defaultValue) {
    return getValue(configKey, defaultValue, BOOLEAN_PARSER);
  }

  public static ConfigValue<String> getString(String configKey, String defaultValue) {
    return getValue(configKey, defaultValue, STRING_PARSER);
  }

  public static ConfigValue<Integer> getInteger(String configKey, Integer defaultValue) {
    return getValue(configKey, defaultValue, INTEGER_PARSER);
  }

  public static ConfigValue<Long> getLong(String configKey, Long defaultValue) {
    return getValue(configKey, defaultValue, LONG_PARSER);
  }

  /** Returns a comma delimited list value, e.g. {@code cli.allowedCommands=sf,sfdx}. */
  public static <T> ConfigValue<List<T>> getMultiValue(
      String configKey, List<T> defaultValues, Parser<T> parser) {
    return getValue(configKey, defaultValues, listParser(parser));
  }

  /**
   * Returns a value parsed with {@code parser}. A {@code null} default makes the key required.
   */
  public static <T> ConfigValue<T> getValue(
      String configKey, @Nullable T defaultValue, Parser<T> parser) {
    return register(new ConfigValue.Builder<T>()
        .setConfigKey(configKey)
        .setDefaultValue(defaultValue)
        .setParser(parser)
        .build());
  }

  private static <T> ConfigValue<T> register(ConfigValue<T> value) {
    synchronized (pending) {
      if (!initialized.get()) {
        pending.add(value);
        return value;
      }
    }
    resolve(value);
    value.freeze();
    return value;
  }

  @SuppressWarnings("rawtypes")
  private static void resolve(ConfigValue value) {
    checkState(loadedConfig != null, "loadedConfig not initialized yet");
    String configured = loadedConfig.getProperty(value.getConfigKey());
    value.initialize(configured == null ? null : configured.trim());
  }

  /**
   * Throws {@link InvalidConfigurationException} instead of {@link IllegalArgumentException}
   * when {@code condition} does not hold.
   */
  public static void checkConfiguration(boolean condition, String errorFormat,
      Object... errorArgs) {
    if (!condition) {
      throw new InvalidConfigurationException(String.format(errorFormat, errorArgs));
    }
  }

  private static synchronized void resetConfiguration() {
    synchronized (pending) {
      pending.clear();
    }
    initialized.set(false);
    loadedConfig = null;
  }

  /** {@link TestRule} that clears the static configuration before each test. */
  public static class ResetConfigRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetConfiguration();
      return base;
    }
  }

  /**
   * {@link TestRule} that lets a test load the configuration from {@link Properties}.
   *
   * <pre>
   * {@code @Rule public ResetConfigRule resetConfig = new ResetConfigRule(); }
   * {@code @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized(); }
   * </pre>
   */
  public static class SetupConfigRule implements TestRule {
    private SetupConfigRule() {}

    @Override
    public Statement apply(Statement base, Description description) {
      return base;
    }

    public static SetupConfigRule uninitialized() {
      return new SetupConfigRule();
    }

    /** @throws IllegalArgumentException if {@code properties} holds non-string entries */
    public void initConfig(Properties properties) {
      checkArgument(properties.size() == properties.stringPropertyNames().size(),
          "Non-string properties found in config: %s", properties.keySet());
      Configuration.initConfig(properties);
    }
  }
}
