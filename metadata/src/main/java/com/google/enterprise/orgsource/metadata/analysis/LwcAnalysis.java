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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Lightning web components of an org with their files, API versions and exposure. */
public final class LwcAnalysis {
  static final ImmutableList<String> FILE_KINDS = ImmutableList.of("js", "html", "css", "xml");

  private final ImmutableList<Component> components;
  private final FileCounts fileCounts;
  private final ImmutableMap<String, Integer> apiVersions;

  public LwcAnalysis(List<Component> components) {
    this.components = ImmutableList.copyOf(components);
    this.fileCounts = FileCounts.count(
        this.components.stream()
            .flatMap(component -> component.getFiles().stream())
            .collect(Collectors.toList()),
        FILE_KINDS, LwcAnalysis::fileKind);
    Map<String, Integer> counts = new TreeMap<>();
    this.components.forEach(component -> counts.merge(component.getApiVersion(), 1, Integer::sum));
    this.apiVersions = counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  static String fileKind(String fileName) {
    if (fileName.endsWith(".js")) {
      return "js";
    } else if (fileName.endsWith(".html")) {
      return "html";
    } else if (fileName.endsWith(".css")) {
      return "css";
    } else if (fileName.endsWith(".xml")) {
      return "xml";
    }
    return null;
  }

  public List<Component> getComponents() {
    return components;
  }

  /** Files by kind: {@code js}, {@code html}, {@code css} and {@code xml}. */
  public FileCounts getFileCounts() {
    return fileCounts;
  }

  /** Number of components per API version, most used version first. */
  public Map<String, Integer> getApiVersions() {
    return apiVersions;
  }

  /** Names of the components available in Lightning App Builder and Experience Builder. */
  public List<String> getExposedComponents() {
    return components.stream()
        .filter(Component::isExposed)
        .map(Component::getName)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("components", components.size())
        .add("fileCounts", fileCounts)
        .add("apiVersions", apiVersions)
        .toString();
  }

  /** One component bundle. */
  public static final class Component {
    private final String name;
    private final ImmutableList<String> files;
    private final String apiVersion;
    private final boolean exposed;

    public Component(String name, List<String> files, String apiVersion, boolean exposed) {
      this.name = checkNotNull(name);
      this.files = ImmutableList.copyOf(files);
      this.apiVersion = checkNotNull(apiVersion);
      this.exposed = exposed;
    }

    public String getName() {
      return name;
    }

    public List<String> getFiles() {
      return files;
    }

    public String getApiVersion() {
      return apiVersion;
    }

    public boolean isExposed() {
      return exposed;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("files", files)
          .add("apiVersion", apiVersion)
          .add("exposed", exposed)
          .toString();
    }
  }
}
