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
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Aura components of an org with their files and how elaborate they are. */
public final class AuraAnalysis {
  static final ImmutableList<String> FILE_KINDS = ImmutableList.of("cmp", "js", "css", "other");

  /** Complexity judged by the number of files in the bundle. */
  public enum Complexity {
    SIMPLE,
    MEDIUM,
    COMPLEX;

    static Complexity ofFileCount(int files) {
      if (files <= 2) {
        return SIMPLE;
      }
      return files <= 5 ? MEDIUM : COMPLEX;
    }
  }

  private final ImmutableList<Component> components;
  private final FileCounts fileCounts;
  private final ImmutableMap<Complexity, Integer> complexity;

  public AuraAnalysis(List<Component> components) {
    this.components = ImmutableList.copyOf(components);
    this.fileCounts = FileCounts.count(
        this.components.stream()
            .flatMap(component -> component.getFiles().stream())
            .collect(Collectors.toList()),
        FILE_KINDS, AuraAnalysis::fileKind);
    EnumMap<Complexity, Integer> counts = new EnumMap<>(Complexity.class);
    for (Complexity level : Complexity.values()) {
      counts.put(level, 0);
    }
    this.components.forEach(component -> counts.merge(component.getComplexity(), 1, Integer::sum));
    this.complexity = Maps.immutableEnumMap(counts);
  }

  static String fileKind(String fileName) {
    if (fileName.endsWith(".cmp")) {
      return "cmp";
    } else if (fileName.endsWith(".js")) {
      return "js";
    } else if (fileName.endsWith(".css")) {
      return "css";
    }
    return "other";
  }

  public List<Component> getComponents() {
    return components;
  }

  /** Files by kind: {@code cmp}, {@code js}, {@code css} and {@code other}. */
  public FileCounts getFileCounts() {
    return fileCounts;
  }

  /** Number of components at each complexity level. */
  public Map<Complexity, Integer> getComplexity() {
    return complexity;
  }

  /** Number of bundles that define an event. */
  public int getEventCount() {
    return (int) components.stream().filter(Component::isEvent).count();
  }

  /** Number of bundles that define an application. */
  public int getApplicationCount() {
    return (int) components.stream().filter(Component::isApplication).count();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("components", components.size())
        .add("fileCounts", fileCounts)
        .add("complexity", complexity)
        .toString();
  }

  /** One Aura bundle. */
  public static final class Component {
    private final String name;
    private final ImmutableList<String> files;
    private final boolean event;
    private final boolean application;

    public Component(String name, List<String> files, boolean event, boolean application) {
      this.name = checkNotNull(name);
      this.files = ImmutableList.copyOf(files);
      this.event = event;
      this.application = application;
    }

    public String getName() {
      return name;
    }

    public List<String> getFiles() {
      return files;
    }

    public boolean hasController() {
      return files.contains(name + "Controller.js");
    }

    public boolean hasHelper() {
      return files.contains(name + "Helper.js");
    }

    public boolean hasStyle() {
      return files.contains(name + ".css");
    }

    public boolean isEvent() {
      return event;
    }

    public boolean isApplication() {
      return application;
    }

    public Complexity getComplexity() {
      return Complexity.ofFileCount(files.size());
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("files", files)
          .add("complexity", getComplexity())
          .toString();
    }
  }
}
