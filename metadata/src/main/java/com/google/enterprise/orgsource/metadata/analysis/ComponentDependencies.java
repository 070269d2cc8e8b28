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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** What an Aura component refers to in its markup. */
public final class ComponentDependencies {
  public static final ComponentDependencies NONE = new ComponentDependencies(
      ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<String> extendedComponents;
  private final ImmutableList<String> interfaces;
  private final ImmutableList<String> registeredEvents;
  private final ImmutableList<String> childComponents;

  public ComponentDependencies(List<String> extendedComponents, List<String> interfaces,
      List<String> registeredEvents, List<String> childComponents) {
    this.extendedComponents = ImmutableList.copyOf(extendedComponents);
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.registeredEvents = ImmutableList.copyOf(registeredEvents);
    this.childComponents = ImmutableList.copyOf(childComponents);
  }

  /** Values of {@code extends} attributes. */
  public List<String> getExtendedComponents() {
    return extendedComponents;
  }

  /** Interfaces named in {@code implements} attributes. */
  public List<String> getInterfaces() {
    return interfaces;
  }

  /** Names of {@code aura:registerEvent} declarations. */
  public List<String> getRegisteredEvents() {
    return registeredEvents;
  }

  /** Components of the default namespace used as {@code <c:Name>} tags. */
  public List<String> getChildComponents() {
    return childComponents;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ComponentDependencies)) {
      return false;
    }
    ComponentDependencies other = (ComponentDependencies) obj;
    return extendedComponents.equals(other.extendedComponents)
        && interfaces.equals(other.interfaces)
        && registeredEvents.equals(other.registeredEvents)
        && childComponents.equals(other.childComponents);
  }

  @Override
  public int hashCode() {
    return Objects.hash(extendedComponents, interfaces, registeredEvents, childComponents);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("extends", extendedComponents)
        .add("implements", interfaces)
        .add("events", registeredEvents)
        .add("components", childComponents)
        .toString();
  }
}
