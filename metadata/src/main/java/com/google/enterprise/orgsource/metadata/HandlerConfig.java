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
package com.google.enterprise.orgsource.metadata;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.orgsource.sdk.InvalidConfigurationException;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-type handler settings: whether the type is enabled, whether item content is fetched in
 * parallel and with how much concurrency, how often a failing command is retried, how long a
 * single command may run and how early the type is processed.
 *
 * <p>{@link #fromConfiguration(String)} resolves each setting in this order:
 *
 * <ol>
 *   <li>{@code metadata.<Type>.<setting>}
 *   <li>{@code metadata.<setting>}
 *   <li>the built-in default for that type, if there is one (large types such as {@code Profile}
 *       run with lower concurrency and longer timeouts, some are disabled)
 *   <li>the global default: enabled, parallel, concurrency 5, 3 retries, 30000 ms, medium
 *       priority
 * </ol>
 */
public final class HandlerConfig {
  public static final String METADATA = "metadata";
  public static final String CONFIG_ENABLED = ".enabled";
  public static final String CONFIG_PARALLEL = ".parallel";
  public static final String CONFIG_MAX_CONCURRENCY = ".maxConcurrency";
  public static final String CONFIG_RETRY_COUNT = ".retryCount";
  public static final String CONFIG_TIMEOUT = ".timeout";
  public static final String CONFIG_PRIORITY = ".priority";

  public static final int MIN_CONCURRENCY = 1;
  public static final int MAX_CONCURRENCY = 10;
  public static final long MIN_TIMEOUT_MILLIS = 1000;

  static final long DEFAULT_TIMEOUT = 30000;
  static final long MEDIUM_TIMEOUT = 45000;
  static final long EXTENDED_TIMEOUT = 60000;

  /** Order in which enabled types are processed when a whole target is analyzed. */
  public enum Priority {
    HIGH,
    MEDIUM,
    LOW
  }

  public static final HandlerConfig DEFAULT =
      new HandlerConfig(true, true, 5, 3, DEFAULT_TIMEOUT, Priority.MEDIUM);

  @VisibleForTesting
  static final ImmutableMap<String, HandlerConfig> TYPE_DEFAULTS =
      new ImmutableMap.Builder<String, HandlerConfig>()
          .put("ApexClass", builtin(true, 5, DEFAULT_TIMEOUT, Priority.HIGH))
          .put("ApexTrigger", builtin(true, 5, DEFAULT_TIMEOUT, Priority.HIGH))
          .put("CustomObject", builtin(true, 3, MEDIUM_TIMEOUT, Priority.HIGH))
          .put("LightningComponentBundle", builtin(true, 3, EXTENDED_TIMEOUT, Priority.HIGH))
          .put("AuraDefinitionBundle", builtin(true, 3, EXTENDED_TIMEOUT, Priority.MEDIUM))
          .put("PermissionSet", builtin(true, 5, DEFAULT_TIMEOUT, Priority.MEDIUM))
          .put("Profile", builtin(false, 2, EXTENDED_TIMEOUT, Priority.MEDIUM))
          .put("Flow", builtin(true, 3, MEDIUM_TIMEOUT, Priority.MEDIUM))
          .put("Layout", builtin(true, 5, DEFAULT_TIMEOUT, Priority.MEDIUM))
          .put("CustomLabels", builtin(true, 3, DEFAULT_TIMEOUT, Priority.LOW))
          .put("CustomMetadata", builtin(true, 5, DEFAULT_TIMEOUT, Priority.LOW))
          .put("EmailTemplate", builtin(false, 5, DEFAULT_TIMEOUT, Priority.LOW))
          .put("StaticResource", builtin(false, 2, EXTENDED_TIMEOUT, Priority.LOW))
          .put("Report", builtin(false, 3, DEFAULT_TIMEOUT, Priority.LOW))
          .put("Dashboard", builtin(false, 3, DEFAULT_TIMEOUT, Priority.LOW))
          .build();

  /** Case-insensitive {@link Priority} names. */
  @VisibleForTesting
  static final Configuration.Parser<Priority> PRIORITY_PARSER =
      value -> {
        try {
          return Priority.valueOf(Strings.nullToEmpty(value).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
          throw new InvalidConfigurationException(
              String.format("Invalid priority [%s], expected one of high, medium or low", value),
              e);
        }
      };

  private final boolean enabled;
  private final boolean parallel;
  private final int maxConcurrency;
  private final int retryCount;
  private final long timeoutMillis;
  private final Priority priority;

  /** Creates a config with {@link Priority#MEDIUM} priority. */
  public HandlerConfig(
      boolean enabled, boolean parallel, int maxConcurrency, int retryCount, long timeoutMillis) {
    this(enabled, parallel, maxConcurrency, retryCount, timeoutMillis, Priority.MEDIUM);
  }

  /**
   * Creates a config. {@code maxConcurrency} is clamped to {@value #MIN_CONCURRENCY}..{@value
   * #MAX_CONCURRENCY} and {@code timeoutMillis} to at least {@value #MIN_TIMEOUT_MILLIS}.
   */
  public HandlerConfig(boolean enabled, boolean parallel, int maxConcurrency, int retryCount,
      long timeoutMillis, Priority priority) {
    checkArgument(retryCount >= 0, "retryCount can not be negative");
    this.enabled = enabled;
    this.parallel = parallel;
    this.maxConcurrency = clampConcurrency(maxConcurrency);
    this.retryCount = retryCount;
    this.timeoutMillis = Math.max(MIN_TIMEOUT_MILLIS, timeoutMillis);
    this.priority = checkNotNull(priority, "priority can not be null");
  }

  private static HandlerConfig builtin(
      boolean enabled, int maxConcurrency, long timeoutMillis, Priority priority) {
    return new HandlerConfig(enabled, true, maxConcurrency, 3, timeoutMillis, priority);
  }

  /** Built-in settings for {@code typeName}, without consulting the configuration. */
  public static HandlerConfig defaultsFor(String typeName) {
    return TYPE_DEFAULTS.getOrDefault(typeName, DEFAULT);
  }

  /**
   * Resolves the settings of {@code typeName} from {@link Configuration}. A negative retry count
   * is raised to zero; {@link #validate(String)} reports it.
   */
  public static HandlerConfig fromConfiguration(String typeName) {
    checkState(Configuration.isInitialized(), "Configuration should be initialized before using");
    HandlerConfig builtin = defaultsFor(typeName);
    return new HandlerConfig(
        resolve(typeName, CONFIG_ENABLED, builtin.enabled, Configuration.BOOLEAN_PARSER),
        resolve(typeName, CONFIG_PARALLEL, builtin.parallel, Configuration.BOOLEAN_PARSER),
        resolve(typeName, CONFIG_MAX_CONCURRENCY, builtin.maxConcurrency,
            Configuration.INTEGER_PARSER),
        Math.max(0, resolve(typeName, CONFIG_RETRY_COUNT, builtin.retryCount,
            Configuration.INTEGER_PARSER)),
        resolve(typeName, CONFIG_TIMEOUT, builtin.timeoutMillis, Configuration.LONG_PARSER),
        resolve(typeName, CONFIG_PRIORITY, builtin.priority, PRIORITY_PARSER));
  }

  /**
   * Checks the configured values of {@code typeName} before they are clamped. Returns one message
   * per problem, empty when the settings are usable as given.
   */
  public static List<String> validate(String typeName) {
    checkState(Configuration.isInitialized(), "Configuration should be initialized before using");
    HandlerConfig builtin = defaultsFor(typeName);
    int concurrency = resolve(typeName, CONFIG_MAX_CONCURRENCY, builtin.maxConcurrency,
        Configuration.INTEGER_PARSER);
    long timeout = resolve(typeName, CONFIG_TIMEOUT, builtin.timeoutMillis,
        Configuration.LONG_PARSER);
    int retries = resolve(typeName, CONFIG_RETRY_COUNT, builtin.retryCount,
        Configuration.INTEGER_PARSER);
    ImmutableList.Builder<String> problems = ImmutableList.builder();
    if (concurrency < MIN_CONCURRENCY) {
      problems.add("Max concurrency must be at least " + MIN_CONCURRENCY);
    }
    if (concurrency > MAX_CONCURRENCY) {
      problems.add("Max concurrency should not exceed " + MAX_CONCURRENCY);
    }
    if (timeout < MIN_TIMEOUT_MILLIS) {
      problems.add("Timeout must be at least " + MIN_TIMEOUT_MILLIS + "ms");
    }
    if (retries < 0) {
      problems.add("Retry count cannot be negative");
    }
    return problems.build();
  }

  /** {@code metadata.<Type><key>}, falling back to {@code metadata<key>}, then {@code builtin}. */
  private static <T> T resolve(
      String typeName, String key, T builtin, Configuration.Parser<T> parser) {
    return Configuration.getOverriden(METADATA + "." + typeName + key,
        Configuration.getValue(METADATA + key, builtin, parser)).get();
  }

  static int clampConcurrency(int concurrency) {
    return Math.max(MIN_CONCURRENCY, Math.min(concurrency, MAX_CONCURRENCY));
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isParallel() {
    return parallel;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  public Priority getPriority() {
    return priority;
  }

  public HandlerConfig withEnabled(boolean enabled) {
    return new HandlerConfig(
        enabled, parallel, maxConcurrency, retryCount, timeoutMillis, priority);
  }

  public HandlerConfig withParallel(boolean parallel) {
    return new HandlerConfig(
        enabled, parallel, maxConcurrency, retryCount, timeoutMillis, priority);
  }

  public HandlerConfig withMaxConcurrency(int maxConcurrency) {
    return new HandlerConfig(
        enabled, parallel, maxConcurrency, retryCount, timeoutMillis, priority);
  }

  public HandlerConfig withRetryCount(int retryCount) {
    return new HandlerConfig(
        enabled, parallel, maxConcurrency, retryCount, timeoutMillis, priority);
  }

  public HandlerConfig withTimeoutMillis(long timeoutMillis) {
    return new HandlerConfig(
        enabled, parallel, maxConcurrency, retryCount, timeoutMillis, priority);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof HandlerConfig)) {
      return false;
    }
    HandlerConfig other = (HandlerConfig) obj;
    return enabled == other.enabled
        && parallel == other.parallel
        && maxConcurrency == other.maxConcurrency
        && retryCount == other.retryCount
        && timeoutMillis == other.timeoutMillis
        && priority == other.priority;
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, parallel, maxConcurrency, retryCount, timeoutMillis, priority);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enabled", enabled)
        .add("parallel", parallel)
        .add("maxConcurrency", maxConcurrency)
        .add("retryCount", retryCount)
        .add("timeoutMillis", timeoutMillis)
        .add("priority", priority)
        .toString();
  }
}
