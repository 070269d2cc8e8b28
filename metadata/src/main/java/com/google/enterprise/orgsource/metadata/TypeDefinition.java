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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a metadata type: its name, the file extensions its artifacts use,
 * whether an artifact is a multi-file bundle, and how it is retrieved.
 */
public final class TypeDefinition {
  static final String DEFAULT_EXTENSION = ".txt";

  private final String name;
  private final String displayName;
  private final ImmutableList<String> fileExtensions;
  private final boolean bundle;
  private final RetrievalStrategy retrievalStrategy;
  private final ImmutableSet<SupportedOperation> supportedOperations;
  private final ImmutableList<TypeDefinition> children;
  private final String cliTypeName;

  private TypeDefinition(Builder builder) {
    this.name = builder.name;
    this.displayName = Strings.isNullOrEmpty(builder.displayName) ? name : builder.displayName;
    this.fileExtensions = ImmutableList.copyOf(builder.fileExtensions);
    this.bundle = builder.bundle;
    this.retrievalStrategy = builder.retrievalStrategy;
    this.supportedOperations = ImmutableSet.copyOf(builder.supportedOperations);
    this.children = ImmutableList.copyOf(builder.children);
    this.cliTypeName = Strings.isNullOrEmpty(builder.cliTypeName) ? name : builder.cliTypeName;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public List<String> getFileExtensions() {
    return fileExtensions;
  }

  /** Returns the primary file extension, or {@value #DEFAULT_EXTENSION} if none is declared. */
  public String getFileExtension() {
    return fileExtensions.isEmpty() ? DEFAULT_EXTENSION : fileExtensions.get(0);
  }

  public boolean isBundle() {
    return bundle;
  }

  public RetrievalStrategy getRetrievalStrategy() {
    return retrievalStrategy;
  }

  public Set<SupportedOperation> getSupportedOperations() {
    return supportedOperations;
  }

  public boolean supports(SupportedOperation operation) {
    return supportedOperations.contains(operation);
  }

  public List<TypeDefinition> getChildren() {
    return children;
  }

  /** Type name understood by the command line tool, usually the same as {@link #getName()}. */
  public String getCliTypeName() {
    return cliTypeName;
  }

  public Builder toBuilder() {
    return new Builder(name)
        .setDisplayName(displayName)
        .setFileExtensions(fileExtensions)
        .setBundle(bundle)
        .setRetrievalStrategy(retrievalStrategy)
        .setSupportedOperations(supportedOperations)
        .setChildren(children)
        .setCliTypeName(cliTypeName);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof TypeDefinition)) {
      return false;
    }
    TypeDefinition other = (TypeDefinition) obj;
    return name.equals(other.name)
        && displayName.equals(other.displayName)
        && fileExtensions.equals(other.fileExtensions)
        && bundle == other.bundle
        && retrievalStrategy == other.retrievalStrategy
        && supportedOperations.equals(other.supportedOperations)
        && children.equals(other.children)
        && cliTypeName.equals(other.cliTypeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, displayName, fileExtensions, bundle, retrievalStrategy,
        supportedOperations, children, cliTypeName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("fileExtensions", fileExtensions)
        .add("bundle", bundle)
        .add("strategy", retrievalStrategy)
        .add("operations", supportedOperations)
        .toString();
  }

  /** Builder for {@link TypeDefinition}. */
  public static class Builder {
    private final String name;
    private String displayName;
    private List<String> fileExtensions = ImmutableList.of();
    private boolean bundle;
    private RetrievalStrategy retrievalStrategy = RetrievalStrategy.MANIFEST_RETRIEVE;
    private Set<SupportedOperation> supportedOperations =
        ImmutableSet.of(SupportedOperation.LIST, SupportedOperation.FETCH);
    private List<TypeDefinition> children = ImmutableList.of();
    private String cliTypeName;

    public Builder(String name) {
      checkArgument(!Strings.isNullOrEmpty(name), "type name can not be null or empty");
      this.name = name;
    }

    public Builder setDisplayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder setFileExtensions(List<String> fileExtensions) {
      this.fileExtensions = checkNotNull(fileExtensions);
      return this;
    }

    public Builder setFileExtensions(String... fileExtensions) {
      return setFileExtensions(Arrays.asList(fileExtensions));
    }

    public Builder setBundle(boolean bundle) {
      this.bundle = bundle;
      return this;
    }

    public Builder setRetrievalStrategy(RetrievalStrategy retrievalStrategy) {
      this.retrievalStrategy = checkNotNull(retrievalStrategy);
      return this;
    }

    public Builder setSupportedOperations(Set<SupportedOperation> supportedOperations) {
      this.supportedOperations = checkNotNull(supportedOperations);
      return this;
    }

    public Builder setSupportedOperations(SupportedOperation... supportedOperations) {
      return setSupportedOperations(ImmutableSet.copyOf(supportedOperations));
    }

    public Builder setChildren(List<TypeDefinition> children) {
      this.children = checkNotNull(children);
      return this;
    }

    public Builder setCliTypeName(String cliTypeName) {
      this.cliTypeName = cliTypeName;
      return this;
    }

    public TypeDefinition build() {
      return new TypeDefinition(this);
    }
  }
}
