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

import com.google.common.base.Strings;
import com.google.enterprise.orgsource.sdk.InvalidConfigurationException;
import com.google.enterprise.orgsource.sdk.config.Configuration.Parser;
import javax.annotation.Nullable;

/**
 * A single setting declared through {@link Configuration}.
 *
 * <p>The value is resolved from, in order: the configured string, the fallback setting, the
 * default. A setting with neither fallback nor default is required.
 */
public class ConfigValue<T> {
  private final String configKey;
  @Nullable private final T defaultValue;
  @Nullable private final ConfigValue<T> fallback;
  private final Parser<T> parser;

  private volatile boolean frozen;
  @Nullable private volatile T resolved;

  private ConfigValue(Builder<T> builder) {
    this.configKey = builder.configKey;
    this.defaultValue = builder.defaultValue;
    this.fallback = builder.fallback;
    this.parser = builder.fallback == null ? builder.parser : builder.fallback.parser;
  }

  /**
   * Returns the resolved value.
   *
   * @throws IllegalStateException if the configuration is not loaded yet
   */
  public T get() {
    checkState(frozen, "Config Key %s not initialized", configKey);
    return resolved;
  }

  @Nullable
  public T getDefault() {
    return defaultValue;
  }

  public boolean isInitialized() {
    return frozen;
  }

  String getConfigKey() {
    return configKey;
  }

  /** Computes the value; it becomes visible through {@link #get} only after {@link #freeze}. */
  synchronized void initialize(@Nullable String configured) {
    if (frozen) {
      return;
    }
    resolved = resolve(configured);
  }

  private T resolve(@Nullable String configured) {
    if (!Strings.isNullOrEmpty(configured)) {
      try {
        return parser.parse(configured);
      } catch (InvalidConfigurationException e) {
        throw new InvalidConfigurationException(
            String.format("Unable to parse [%s] configured for %s", configured, configKey), e);
      }
    }
    if (fallback != null) {
      return fallback.get();
    }
    if (defaultValue == null) {
      throw new InvalidConfigurationException(
          String.format("Required Config Key %s not initialized", configKey));
    }
    return defaultValue;
  }

  synchronized void freeze() {
    frozen = true;
  }

  synchronized void reset() {
    frozen = false;
    resolved = null;
  }

  static final class Builder<T> {
    private String configKey;
    private T defaultValue;
    private ConfigValue<T> fallback;
    private Parser<T> parser;

    Builder<T> setConfigKey(String configKey) {
      this.configKey = configKey;
      return this;
    }

    Builder<T> setDefaultValue(@Nullable T defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    /** The fallback's parser is used for this setting too. */
    Builder<T> setFallback(ConfigValue<T> fallback) {
      this.fallback = checkNotNull(fallback, "fallback can not be null");
      return this;
    }

    Builder<T> setParser(Parser<T> parser) {
      this.parser = parser;
      return this;
    }

    ConfigValue<T> build() {
      checkArgument(!Strings.isNullOrEmpty(configKey), "configKey can not be empty or null");
      checkArgument(parser != null || fallback != null, "parser can not be null");
      checkArgument(defaultValue == null || fallback == null,
          "a setting can have a default or a fallback, not both");
      return new ConfigValue<>(this);
    }
  }
}
