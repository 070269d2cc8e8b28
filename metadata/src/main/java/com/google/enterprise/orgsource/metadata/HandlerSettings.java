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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.enterprise.orgsource.metadata.HandlerConfig.Priority;
import com.google.enterprise.orgsource.sdk.InvalidConfigurationException;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The {@link HandlerConfig} of every known type, changeable at runtime.
 *
 * <p>Optional configuration parameters, besides the per-type keys of {@link HandlerConfig}:
 *
 * <ul>
 *   <li>{@value #TUNING} - {@code default}, {@code performance} (parallel, at most 5 concurrent
 *       commands, no timeout above {@value HandlerConfig#EXTENDED_TIMEOUT} ms) or {@code
 *       largeOrg} (parallel, at most 2 concurrent commands, at least {@value
 *       HandlerConfig#EXTENDED_TIMEOUT} ms and 5 retries). Default {@code default}.
 * </ul>
 */
public class HandlerSettings {
  private static final Logger logger = Logger.getLogger(HandlerSettings.class.getName());

  public static final String TUNING = "metadata.tuning";

  /** Adjustment applied on top of each configured type. */
  public enum Tuning {
    DEFAULT(config -> config),
    PERFORMANCE(config -> config
        .withParallel(true)
        .withMaxConcurrency(Math.min(config.getMaxConcurrency(), 5))
        .withTimeoutMillis(Math.min(config.getTimeoutMillis(), HandlerConfig.EXTENDED_TIMEOUT))),
    LARGE_ORG(config -> config
        .withParallel(true)
        .withMaxConcurrency(Math.min(config.getMaxConcurrency(), 2))
        .withTimeoutMillis(Math.max(config.getTimeoutMillis(), HandlerConfig.EXTENDED_TIMEOUT))
        .withRetryCount(Math.max(config.getRetryCount(), 5)));

    private final UnaryOperator<HandlerConfig> adjustment;

    Tuning(UnaryOperator<HandlerConfig> adjustment) {
      this.adjustment = adjustment;
    }

    public HandlerConfig apply(HandlerConfig config) {
      return adjustment.apply(config);
    }

    static Tuning parse(String value) {
      String normalized = value.replace("_", "").toLowerCase(Locale.ROOT);
      for (Tuning tuning : values()) {
        if (tuning.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
          return tuning;
        }
      }
      throw new InvalidConfigurationException(String.format(
          "Invalid value [%s] for %s, expected default, performance or largeOrg", value, TUNING));
    }
  }

  private final Map<String, HandlerConfig> configs = new LinkedHashMap<>();
  private final ImmutableList<Problem> problems;

  /** Settings of {@code configs}, in the given order, with no reported problems. */
  public HandlerSettings(Map<String, HandlerConfig> configs) {
    this(configs, ImmutableList.of());
  }

  private HandlerSettings(Map<String, HandlerConfig> configs, List<Problem> problems) {
    checkNotNull(configs).forEach((type, config) -> this.configs.put(type, checkNotNull(config)));
    this.problems = ImmutableList.copyOf(problems);
  }

  /** Built-in settings of every {@link BuiltinTypes} type. */
  public static HandlerSettings defaults() {
    Map<String, HandlerConfig> configs = new LinkedHashMap<>();
    for (TypeDefinition definition : BuiltinTypes.all()) {
      configs.put(definition.getName(), HandlerConfig.defaultsFor(definition.getName()));
    }
    return new HandlerSettings(configs);
  }

  /**
   * Resolves the settings of every {@link BuiltinTypes} type from {@link Configuration}, applies
   * {@value #TUNING} and records the values that had to be clamped.
   */
  public static HandlerSettings fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    Tuning tuning = Configuration.getValue(TUNING, Tuning.DEFAULT, Tuning::parse).get();
    Map<String, HandlerConfig> configs = new LinkedHashMap<>();
    ImmutableList.Builder<Problem> problems = ImmutableList.builder();
    for (TypeDefinition definition : BuiltinTypes.all()) {
      String type = definition.getName();
      configs.put(type, tuning.apply(HandlerConfig.fromConfiguration(type)));
      HandlerConfig.validate(type).forEach(message -> problems.add(new Problem(type, message)));
    }
    HandlerSettings settings = new HandlerSettings(configs, problems.build());
    for (Problem problem : settings.validate()) {
      logger.log(Level.WARNING, "Handler configuration of {0}: {1}",
          new Object[] {problem.getType(), problem.getMessage()});
    }
    return settings;
  }

  /** Settings of {@code type}, or the disabled global default for unknown types. */
  public synchronized HandlerConfig get(String type) {
    return Optional.ofNullable(configs.get(type)).orElse(HandlerConfig.DEFAULT.withEnabled(false));
  }

  public synchronized void set(String type, HandlerConfig config) {
    configs.put(checkNotNull(type), checkNotNull(config));
  }

  public synchronized boolean isKnown(String type) {
    return configs.containsKey(type);
  }

  /** Enables a known type. Returns {@code false} and changes nothing for unknown types. */
  public synchronized boolean enableType(String type) {
    return setEnabled(type, true);
  }

  /** Disables a known type. Returns {@code false} and changes nothing for unknown types. */
  public synchronized boolean disableType(String type) {
    return setEnabled(type, false);
  }

  private boolean setEnabled(String type, boolean enabled) {
    HandlerConfig config = configs.get(type);
    if (config == null) {
      return false;
    }
    configs.put(type, config.withEnabled(enabled));
    logger.log(Level.INFO, "{0} type {1}", new Object[] {enabled ? "Enabled" : "Disabled", type});
    return true;
  }

  public synchronized List<String> getAllTypes() {
    return ImmutableList.copyOf(configs.keySet());
  }

  /** Enabled types, high priority first, in configuration order within a priority. */
  public synchronized List<String> getEnabledTypes() {
    return configs.entrySet().stream()
        .filter(entry -> entry.getValue().isEnabled())
        .sorted(Comparator.comparing(
            (Map.Entry<String, HandlerConfig> entry) -> entry.getValue().getPriority()))
        .map(Map.Entry::getKey)
        .collect(ImmutableList.toImmutableList());
  }

  /** Enabled types of {@code priority}, in configuration order. */
  public synchronized List<String> getTypesByPriority(Priority priority) {
    checkNotNull(priority);
    return configs.entrySet().stream()
        .filter(entry -> entry.getValue().isEnabled())
        .filter(entry -> entry.getValue().getPriority() == priority)
        .map(Map.Entry::getKey)
        .collect(ImmutableList.toImmutableList());
  }

  public synchronized Summary getSummary() {
    int enabled = 0;
    EnumMap<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      byPriority.put(priority, 0);
    }
    for (HandlerConfig config : configs.values()) {
      if (config.isEnabled()) {
        enabled++;
      }
      byPriority.merge(config.getPriority(), 1, Integer::sum);
    }
    return new Summary(configs.size(), enabled, byPriority);
  }

  /** Configured values that were out of range and had to be clamped. */
  public List<Problem> validate() {
    return problems;
  }

  /** A configured value of one type that is out of range. */
  public static final class Problem {
    private final String type;
    private final String message;

    public Problem(String type, String message) {
      this.type = checkNotNull(type);
      this.message = checkNotNull(message);
    }

    public String getType() {
      return type;
    }

    public String getMessage() {
      return message;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Problem)) {
        return false;
      }
      Problem other = (Problem) obj;
      return type.equals(other.type) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, message);
    }

    @Override
    public String toString() {
      return type + ": " + message;
    }
  }

  /** How many types are known, enabled and disabled, and how many have each priority. */
  public static final class Summary {
    private final int total;
    private final int enabled;
    private final ImmutableMap<Priority, Integer> byPriority;

    Summary(int total, int enabled, Map<Priority, Integer> byPriority) {
      this.total = total;
      this.enabled = enabled;
      this.byPriority = Maps.immutableEnumMap(byPriority);
    }

    public int getTotal() {
      return total;
    }

    public int getEnabled() {
      return enabled;
    }

    public int getDisabled() {
      return total - enabled;
    }

    /** Known types of {@code priority}, enabled or not. */
    public int getCount(Priority priority) {
      return byPriority.getOrDefault(priority, 0);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("total", total)
          .add("enabled", enabled)
          .add("byPriority", byPriority)
          .toString();
    }
  }
}
