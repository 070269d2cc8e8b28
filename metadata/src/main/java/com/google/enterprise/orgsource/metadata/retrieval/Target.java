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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * An org that sources are retrieved from.
 *
 * <p>The {@code id} keys local state such as directories and settings. The command line tool is
 * addressed with {@link #identifier()}: the username when known, else the alias, else the id.
 */
public final class Target {
  private final String id;
  @Nullable private final String username;
  @Nullable private final String alias;

  public Target(String id, @Nullable String username, @Nullable String alias) {
    checkArgument(!Strings.isNullOrEmpty(id), "target id can not be null or empty");
    this.id = id;
    this.username = Strings.emptyToNull(username);
    this.alias = Strings.emptyToNull(alias);
  }

  public static Target of(String id) {
    return new Target(id, null, null);
  }

  public String getId() {
    return id;
  }

  public Optional<String> getUsername() {
    return Optional.ofNullable(username);
  }

  public Optional<String> getAlias() {
    return Optional.ofNullable(alias);
  }

  /** Identifier passed to the command line tool as {@code --target-org}. */
  public String identifier() {
    if (username != null) {
      return username;
    }
    return alias != null ? alias : id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Target)) {
      return false;
    }
    Target other = (Target) o;
    return id.equals(other.id)
        && Objects.equals(username, other.username)
        && Objects.equals(alias, other.alias);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, username, alias);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("username", username)
        .add("alias", alias)
        .toString();
  }
}
