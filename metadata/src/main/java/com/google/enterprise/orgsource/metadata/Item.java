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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Locale;
import java.util.Objects;

/**
 * A single artifact of a metadata type in a remote org.
 *
 * <p>The id is {@code <targetId>-<infix>-<fullName>} where the infix is the lower-cased type name
 * unless a handler chooses a shorter one. Descriptor companions of source artifacts carry the
 * suffix {@value #META_SUFFIX} and are flagged with {@link #isMetaFile()}.
 */
public final class Item {
  public static final String META_SUFFIX = "-meta";

  private final String id;
  private final String name;
  private final String fullName;
  private final String typeName;
  private final String targetId;
  private final boolean metaFile;

  private Item(Builder builder) {
    this.typeName = builder.typeName;
    this.fullName = builder.fullName;
    this.targetId = builder.targetId;
    this.metaFile = builder.metaFile;
    this.name = Strings.isNullOrEmpty(builder.name) ? fullName : builder.name;
    String infix = Strings.isNullOrEmpty(builder.idInfix)
        ? typeName.toLowerCase(Locale.ROOT)
        : builder.idInfix;
    this.id = targetId + "-" + infix + "-" + fullName + (metaFile ? META_SUFFIX : "");
  }

  public String getId() {
    return id;
  }

  /** File name shown to users, e.g. {@code AccountService.cls}. */
  public String getName() {
    return name;
  }

  /** API name of the artifact, e.g. {@code AccountService}. */
  public String getFullName() {
    return fullName;
  }

  public String getTypeName() {
    return typeName;
  }

  public String getTargetId() {
    return targetId;
  }

  public boolean isMetaFile() {
    return metaFile;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Item)) {
      return false;
    }
    Item other = (Item) obj;
    return id.equals(other.id)
        && name.equals(other.name)
        && fullName.equals(other.fullName)
        && typeName.equals(other.typeName)
        && targetId.equals(other.targetId)
        && metaFile == other.metaFile;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, fullName, typeName, targetId, metaFile);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("name", name)
        .add("type", typeName)
        .toString();
  }

  /** Builder for {@link Item}. */
  public static class Builder {
    private final String targetId;
    private final String typeName;
    private final String fullName;
    private String name;
    private String idInfix;
    private boolean metaFile;

    public Builder(String targetId, String typeName, String fullName) {
      checkArgument(!Strings.isNullOrEmpty(targetId), "targetId can not be null or empty");
      checkArgument(!Strings.isNullOrEmpty(typeName), "typeName can not be null or empty");
      checkArgument(!Strings.isNullOrEmpty(fullName), "fullName can not be null or empty");
      this.targetId = targetId;
      this.typeName = typeName;
      this.fullName = fullName;
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setIdInfix(String idInfix) {
      this.idInfix = checkNotNull(idInfix);
      return this;
    }

    public Builder setMetaFile(boolean metaFile) {
      this.metaFile = metaFile;
      return this;
    }

    public Item build() {
      return new Item(this);
    }
  }
}
