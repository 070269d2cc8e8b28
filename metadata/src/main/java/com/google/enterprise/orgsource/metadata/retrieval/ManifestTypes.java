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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Catalogue of the metadata types that can be selected for manifest driven retrievals, in
 * display order.
 */
public final class ManifestTypes {

  /** A selectable manifest type. */
  public static final class ManifestType {
    private final String name;
    private final String displayName;
    private final String description;
    private final String category;
    private final boolean enabledByDefault;

    ManifestType(String name, String displayName, String description, String category,
        boolean enabledByDefault) {
      this.name = checkNotNull(name);
      this.displayName = checkNotNull(displayName);
      this.description = checkNotNull(description);
      this.category = checkNotNull(category);
      this.enabledByDefault = enabledByDefault;
    }

    public String getName() {
      return name;
    }

    public String getDisplayName() {
      return displayName;
    }

    public String getDescription() {
      return description;
    }

    public String getCategory() {
      return category;
    }

    public boolean isEnabledByDefault() {
      return enabledByDefault;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("category", category)
          .add("enabledByDefault", enabledByDefault)
          .toString();
    }
  }

  /** Types selected by {@link ManifestSettings#enableCoreTypesOnly}. */
  public static final ImmutableSet<String> CORE_TYPES = ImmutableSet.of(
      "ApexClass",
      "ApexTrigger",
      "LightningComponentBundle",
      "AuraDefinitionBundle",
      "CustomObject");

  private static final ImmutableList<ManifestType> ALL = ImmutableList.of(
      type("ApexClass", "Apex Classes", "Apex class files (.cls)", "Apex", true),
      type("ApexTrigger", "Apex Triggers", "Apex trigger files (.trigger)", "Apex", true),
      type("ApexTestSuite", "Apex Test Suites", "Test suite definitions", "Apex", true),
      type("LightningComponentBundle", "Lightning Web Components", "LWC bundles", "Components",
          true),
      type("AuraDefinitionBundle", "Aura Components", "Aura component bundles", "Components",
          true),
      type("CustomObject", "Custom Objects", "Custom object definitions", "Objects", true),
      type("CustomField", "Custom Fields", "Custom field definitions", "Objects", false),
      type("CustomMetadata", "Custom Metadata Types", "Custom metadata type definitions",
          "Objects", false),
      type("Flow", "Flows", "Flow definitions", "Automation", true),
      type("WorkflowRule", "Workflow Rules", "Workflow rule definitions", "Automation", false),
      type("ProcessBuilder", "Process Builder", "Process builder definitions", "Automation",
          false),
      type("Layout", "Page Layouts", "Page layout definitions", "UI", true),
      type("ListView", "List Views", "List view definitions", "UI", false),
      type("FlexiPage", "Lightning Pages", "Lightning page definitions", "UI", false),
      type("PermissionSet", "Permission Sets", "Permission set definitions", "Security", true),
      type("Profile", "Profiles", "Profile definitions", "Security", false),
      type("Role", "Roles", "Role hierarchy definitions", "Security", false),
      type("EmailTemplate", "Email Templates", "Email template definitions", "Communication",
          false),
      type("LetterHead", "Letterheads", "Letterhead definitions", "Communication", false),
      type("Report", "Reports", "Report definitions", "Analytics", false),
      type("Dashboard", "Dashboards", "Dashboard definitions", "Analytics", false),
      type("ReportType", "Report Types", "Custom report type definitions", "Analytics", false),
      type("StaticResource", "Static Resources", "Static resource files", "Resources", false),
      type("ContentAsset", "Content Assets", "Content asset files", "Resources", false),
      type("RemoteSiteSetting", "Remote Site Settings", "Remote site setting definitions",
          "Integration", false),
      type("NamedCredential", "Named Credentials", "Named credential definitions",
          "Integration", false),
      type("ValidationRule", "Validation Rules", "Validation rule definitions",
          "Business Logic", false),
      type("AssignmentRule", "Assignment Rules", "Assignment rule definitions",
          "Business Logic", false),
      type("AutoResponseRule", "Auto-Response Rules", "Auto-response rule definitions",
          "Business Logic", false));

  private static final ImmutableMap<String, ManifestType> BY_NAME =
      ALL.stream().collect(ImmutableMap.toImmutableMap(ManifestType::getName, Function.identity()));

  private ManifestTypes() {}

  private static ManifestType type(String name, String displayName, String description,
      String category, boolean enabledByDefault) {
    return new ManifestType(name, displayName, description, category, enabledByDefault);
  }

  public static List<ManifestType> all() {
    return ALL;
  }

  public static Optional<ManifestType> find(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  public static boolean isKnown(String name) {
    return BY_NAME.containsKey(name);
  }

  /** Names of the types enabled for targets without explicit settings. */
  public static List<String> defaultEnabledNames() {
    return ALL.stream()
        .filter(ManifestType::isEnabledByDefault)
        .map(ManifestType::getName)
        .collect(ImmutableList.toImmutableList());
  }

  public static List<String> allNames() {
    return ALL.stream().map(ManifestType::getName).collect(ImmutableList.toImmutableList());
  }

  /** All types keyed by category, categories in first appearance order. */
  public static ImmutableListMultimap<String, ManifestType> byCategory() {
    return Multimaps.index(ALL, ManifestType::getCategory);
  }
}
