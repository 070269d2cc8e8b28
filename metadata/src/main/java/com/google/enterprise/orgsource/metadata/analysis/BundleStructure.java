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
package com.google.enterprise.orgsource.metadata.analysis;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Which file of a component bundle plays which role, e.g. {@code controller} or {@code css}. */
public final class BundleStructure {
  public static final String HTML = "html";
  public static final String JS = "js";
  public static final String CSS = "css";
  public static final String XML = "xml";
  public static final String SVG = "svg";
  public static final String TEST = "test";
  public static final String CMP = "cmp";
  public static final String CONTROLLER = "controller";
  public static final String HELPER = "helper";
  public static final String STYLE = "style";
  public static final String RENDERER = "renderer";
  public static final String DESIGN = "design";
  public static final String DOCUMENTATION = "documentation";

  private final String componentName;
  private final ImmutableMap<String, String> filesByRole;

  public BundleStructure(String componentName, Map<String, String> filesByRole) {
    this.componentName = checkNotNull(componentName);
    this.filesByRole = ImmutableMap.copyOf(filesByRole);
  }

  public String getComponentName() {
    return componentName;
  }

  /** The file playing {@code role}, if the bundle has one. */
  public Optional<String> getFile(String role) {
    return Optional.ofNullable(filesByRole.get(role));
  }

  public Map<String, String> getFilesByRole() {
    return filesByRole;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BundleStructure)) {
      return false;
    }
    BundleStructure other = (BundleStructure) obj;
    return componentName.equals(other.componentName) && filesByRole.equals(other.filesByRole);
  }

  @Override
  public int hashCode() {
    return Objects.hash(componentName, filesByRole);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("componentName", componentName)
        .add("filesByRole", filesByRole)
        .toString();
  }
}
