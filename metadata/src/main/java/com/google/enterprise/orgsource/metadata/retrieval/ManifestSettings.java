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
package com.google.enterprise.orgsource.metadata.retrieval;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.Key;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.enterprise.orgsource.metadata.retrieval.ManifestTypes.ManifestType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Per-target manifest selection, persisted in a {@link SettingsStore}.
 *
 * <p>Targets without saved settings start from the types of {@link ManifestTypes} that are
 * enabled by default, with every member of each type and the default API version. Every change
 * is written back to the store immediately.
 */
public class ManifestSettings {
  private static final Logger logger = Logger.getLogger(ManifestSettings.class.getName());
  private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  @VisibleForTesting static final String STORE_KEY = "orgManifestConfigs";

  private final SettingsStore store;
  private final String defaultApiVersion;
  private final Clock clock;
  private final Map<String, TargetManifestConfig> configs = new LinkedHashMap<>();

  /**
   * Loads the saved settings from {@code store}.
   *
   * @throws IOException if the store cannot be read or holds malformed settings
   */
  public ManifestSettings(SettingsStore store, String defaultApiVersion) throws IOException {
    this(store, defaultApiVersion, Clock.systemUTC());
  }

  @VisibleForTesting
  ManifestSettings(SettingsStore store, String defaultApiVersion, Clock clock)
      throws IOException {
    checkArgument(!Strings.isNullOrEmpty(defaultApiVersion),
        "defaultApiVersion can not be null or empty");
    this.store = checkNotNull(store, "store can not be null");
    this.defaultApiVersion = defaultApiVersion;
    this.clock = checkNotNull(clock);
    load();
  }

  /** Returns the settings of {@code targetId}, creating default settings on first use. */
  public synchronized TargetManifestConfig getConfig(String targetId) {
    return configs.computeIfAbsent(targetId, this::defaultConfig);
  }

  /** Replaces the enabled types of {@code targetId}. Every name must be in the catalogue. */
  public void setEnabledTypes(String targetId, List<String> typeNames) throws IOException {
    checkNotNull(typeNames, "typeNames can not be null");
    for (String typeName : typeNames) {
      checkArgument(ManifestTypes.isKnown(typeName), "Unknown manifest type: %s", typeName);
    }
    update(targetId, builder -> builder.setEnabledTypes(ImmutableList.copyOf(typeNames)));
  }

  /**
   * Restricts {@code typeName} to {@code members}. An empty list restores the wildcard.
   */
  public void setMembers(String targetId, String typeName, List<String> members)
      throws IOException {
    checkArgument(ManifestTypes.isKnown(typeName), "Unknown manifest type: %s", typeName);
    checkNotNull(members, "members can not be null");
    synchronized (this) {
      Map<String, List<String>> updated = new LinkedHashMap<>(getConfig(targetId)
          .getCustomMembers());
      if (members.isEmpty()) {
        updated.remove(typeName);
      } else {
        updated.put(typeName, ImmutableList.copyOf(members));
      }
      update(targetId, builder -> builder.setCustomMembers(updated));
    }
  }

  public void setApiVersion(String targetId, String apiVersion) throws IOException {
    checkArgument(!Strings.isNullOrEmpty(apiVersion), "apiVersion can not be null or empty");
    update(targetId, builder -> builder.setApiVersion(apiVersion));
  }

  public void setAlias(String targetId, @Nullable String alias) throws IOException {
    update(targetId, builder -> builder.setAlias(alias));
  }

  /** Enabled types of {@code targetId}, in catalogue order. */
  public List<ManifestType> getEnabledTypes(String targetId) {
    Set<String> enabled = ImmutableSet.copyOf(getConfig(targetId).getEnabledTypes());
    return ManifestTypes.all().stream()
        .filter(type -> enabled.contains(type.getName()))
        .collect(ImmutableList.toImmutableList());
  }

  /** The {@code package.xml} for {@code targetId}. */
  public String generateManifest(String targetId) {
    TargetManifestConfig config = getConfig(targetId);
    List<String> typeNames = getEnabledTypes(targetId).stream()
        .map(ManifestType::getName)
        .collect(Collectors.toList());
    return ManifestBuilder.build(typeNames, config.getCustomMembers(), config.getApiVersion());
  }

  /** Writes the {@code package.xml} for {@code targetId} to {@code file}. */
  public Path writeManifest(String targetId, Path file) throws IOException {
    Files.write(file, generateManifest(targetId).getBytes(UTF_8));
    return file;
  }

  public void enableAll(String targetId) throws IOException {
    update(targetId, builder -> builder.setEnabledTypes(ManifestTypes.allNames()));
  }

  public void enableCoreTypesOnly(String targetId) throws IOException {
    update(targetId,
        builder -> builder.setEnabledTypes(ImmutableList.copyOf(ManifestTypes.CORE_TYPES)));
  }

  /** Restores the default types, drops explicit members and resets the API version. */
  public void resetToDefault(String targetId) throws IOException {
    update(targetId, builder -> builder
        .setEnabledTypes(ManifestTypes.defaultEnabledNames())
        .setCustomMembers(ImmutableMap.of())
        .setApiVersion(defaultApiVersion));
  }

  public void removeTarget(String targetId) throws IOException {
    synchronized (this) {
      if (configs.remove(targetId) == null) {
        return;
      }
      save();
    }
  }

  public synchronized List<String> getConfiguredTargetIds() {
    return ImmutableList.copyOf(configs.keySet());
  }

  public ManifestStats getStats(String targetId) {
    TargetManifestConfig config = getConfig(targetId);
    List<ManifestType> enabled = getEnabledTypes(targetId);
    int categories = (int) enabled.stream().map(ManifestType::getCategory).distinct().count();
    int total = ManifestTypes.all().size();
    return new ManifestStats(total, enabled.size(), total - enabled.size(), categories,
        config.getLastModified());
  }

  private interface Update {
    TargetManifestConfig.Builder apply(TargetManifestConfig.Builder builder);
  }

  private synchronized void update(String targetId, Update update) throws IOException {
    TargetManifestConfig updated = update.apply(getConfig(targetId).toBuilder())
        .setLastModified(clock.instant())
        .build();
    configs.put(targetId, updated);
    save();
    logger.log(Level.FINE, "Updated manifest settings of {0}", targetId);
  }

  private TargetManifestConfig defaultConfig(String targetId) {
    return new TargetManifestConfig.Builder(targetId)
        .setLastModified(clock.instant())
        .setEnabledTypes(ManifestTypes.defaultEnabledNames())
        .setApiVersion(defaultApiVersion)
        .build();
  }

  private void load() throws IOException {
    String stored = store.get(STORE_KEY, null);
    if (Strings.isNullOrEmpty(stored)) {
      return;
    }
    StoredSettings settings;
    try {
      settings = JSON_FACTORY.fromString(stored, StoredSettings.class);
    } catch (IllegalArgumentException e) {
      throw new IOException("Malformed manifest settings", e);
    }
    if (settings.targets == null) {
      return;
    }
    for (Map.Entry<String, StoredTargetConfig> entry : settings.targets.entrySet()) {
      configs.put(entry.getKey(), entry.getValue().toConfig(entry.getKey(), defaultApiVersion));
    }
    logger.log(Level.FINE, "Loaded manifest settings of {0} targets", configs.size());
  }

  private void save() throws IOException {
    StoredSettings settings = new StoredSettings();
    settings.targets = new LinkedHashMap<>();
    configs.forEach((id, config) -> settings.targets.put(id, StoredTargetConfig.of(config)));
    settings.setFactory(JSON_FACTORY);
    store.set(STORE_KEY, settings.toString());
  }

  /** Summary of the manifest selection of a target. */
  public static final class ManifestStats {
    private final int totalAvailableTypes;
    private final int enabledTypes;
    private final int disabledTypes;
    private final int categoriesUsed;
    private final Instant lastModified;

    ManifestStats(int totalAvailableTypes, int enabledTypes, int disabledTypes,
        int categoriesUsed, Instant lastModified) {
      this.totalAvailableTypes = totalAvailableTypes;
      this.enabledTypes = enabledTypes;
      this.disabledTypes = disabledTypes;
      this.categoriesUsed = categoriesUsed;
      this.lastModified = lastModified;
    }

    public int getTotalAvailableTypes() {
      return totalAvailableTypes;
    }

    public int getEnabledTypes() {
      return enabledTypes;
    }

    public int getDisabledTypes() {
      return disabledTypes;
    }

    public int getCategoriesUsed() {
      return categoriesUsed;
    }

    public Instant getLastModified() {
      return lastModified;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("totalAvailableTypes", totalAvailableTypes)
          .add("enabledTypes", enabledTypes)
          .add("disabledTypes", disabledTypes)
          .add("categoriesUsed", categoriesUsed)
          .add("lastModified", lastModified)
          .toString();
    }
  }

  /** Stored form of all settings. */
  public static class StoredSettings extends GenericJson {
    @Key public Map<String, StoredTargetConfig> targets;
  }

  /** Stored form of a {@link TargetManifestConfig}. */
  public static class StoredTargetConfig extends GenericJson {
    @Key public String orgAlias;
    @Key public Long lastModified;
    @Key public List<String> enabledMetadataTypes;
    @Key public Map<String, List<String>> customMembers;
    @Key public String apiVersion;

    static StoredTargetConfig of(TargetManifestConfig config) {
      StoredTargetConfig stored = new StoredTargetConfig();
      stored.orgAlias = config.getAlias().orElse(null);
      stored.lastModified = config.getLastModified().toEpochMilli();
      stored.enabledMetadataTypes = new ArrayList<>(config.getEnabledTypes());
      stored.customMembers = new LinkedHashMap<>(config.getCustomMembers());
      stored.apiVersion = config.getApiVersion();
      return stored;
    }

    TargetManifestConfig toConfig(String targetId, String defaultApiVersion) {
      return new TargetManifestConfig.Builder(targetId)
          .setAlias(orgAlias)
          .setLastModified(
              lastModified == null ? Instant.EPOCH : Instant.ofEpochMilli(lastModified))
          .setEnabledTypes(enabledMetadataTypes == null
              ? ManifestTypes.defaultEnabledNames()
              : enabledMetadataTypes)
          .setCustomMembers(customMembers == null ? ImmutableMap.of() : customMembers)
          .setApiVersion(Strings.isNullOrEmpty(apiVersion) ? defaultApiVersion : apiVersion)
          .build();
    }
  }
}
