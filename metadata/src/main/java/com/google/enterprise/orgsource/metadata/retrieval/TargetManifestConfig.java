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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/** Manifest selection of one target: enabled types, explicit members and API version. */
public final class TargetManifestConfig {
  private final String targetId;
  @Nullable private final String alias;
  private final Instant lastModified;
  private final ImmutableList<String> enabledTypes;
  private final ImmutableMap<String, ImmutableList<String>> customMembers;
  private final String apiVersion;

  private TargetManifestConfig(Builder builder) {
    this.targetId = builder.targetId;
    this.alias = builder.alias;
    this.lastModified = builder.lastModified;
    this.enabledTypes = ImmutableList.copyOf(builder.enabledTypes);
    ImmutableMap.Builder<String, ImmutableList<String>> members = ImmutableMap.builder();
    builder.customMembers.forEach((type, names) -> members.put(type, ImmutableList.copyOf(names)));
    this.customMembers = members.build();
    this.apiVersion = builder.apiVersion;
  }

  public String getTargetId() {
    return targetId;
  }

  public Optional<String> getAlias() {
    return Optional.ofNullable(alias);
  }

  public Instant getLastModified() {
    return lastModified;
  }

  /** Names of the enabled types in the order they were set. */
  public List<String> getEnabledTypes() {
    return enabledTypes;
  }

  /** Explicit members per type. Types without an entry retrieve every member. */
  public Map<String, ImmutableList<String>> getCustomMembers() {
    return customMembers;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public Builder toBuilder() {
    return new Builder(targetId)
        .setAlias(alias)
        .setLastModified(lastModified)
        .setEnabledTypes(enabledTypes)
        .setCustomMembers(customMembers)
        .setApiVersion(apiVersion);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TargetManifestConfig)) {
      return false;
    }
    TargetManifestConfig other = (TargetManifestConfig) o;
    return targetId.equals(other.targetId)
        && Objects.equals(alias, other.alias)
        && lastModified.equals(other.lastModified)
        && enabledTypes.equals(other.enabledTypes)
        && customMembers.equals(other.customMembers)
        && apiVersion.equals(other.apiVersion);
  }

  @Override
  public int hashCode() {
    return Objects.hash(targetId, alias, lastModified, enabledTypes, customMembers, apiVersion);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("targetId", targetId)
        .add("alias", alias)
        .add("enabledTypes", enabledTypes)
        .add("customMembers", customMembers)
        .add("apiVersion", apiVersion)
        .toString();
  }

  /** Builder for {@link TargetManifestConfig}. */
  public static final class Builder {
    private final String targetId;
    @Nullable private String alias;
    private Instant lastModified = Instant.EPOCH;
    private List<String> enabledTypes = ImmutableList.of();
    private Map<String, ? extends List<String>> customMembers = ImmutableMap.of();
    private String apiVersion;

    public Builder(String targetId) {
      checkArgument(!Strings.isNullOrEmpty(targetId), "target id can not be null or empty");
      this.targetId = targetId;
    }

    public Builder setAlias(@Nullable String alias) {
      this.alias = Strings.emptyToNull(alias);
      return this;
    }

    public Builder setLastModified(Instant lastModified) {
      this.lastModified = checkNotNull(lastModified);
      return this;
    }

    public Builder setEnabledTypes(List<String> enabledTypes) {
      this.enabledTypes = checkNotNull(enabledTypes);
      return this;
    }

    public Builder setCustomMembers(Map<String, ? extends List<String>> customMembers) {
      this.customMembers = checkNotNull(customMembers);
      return this;
    }

    public Builder setApiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    public TargetManifestConfig build() {
      checkArgument(!Strings.isNullOrEmpty(apiVersion), "apiVersion can not be null or empty");
      return new TargetManifestConfig(this);
    }
  }
}
