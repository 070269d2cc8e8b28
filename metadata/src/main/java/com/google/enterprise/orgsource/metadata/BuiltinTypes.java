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

import static com.google.enterprise.orgsource.metadata.RetrievalStrategy.MANIFEST_RETRIEVE;
import static com.google.enterprise.orgsource.metadata.RetrievalStrategy.TOOLING_QUERY;
import static com.google.enterprise.orgsource.metadata.SupportedOperation.FETCH;
import static com.google.enterprise.orgsource.metadata.SupportedOperation.LIST;
import static com.google.enterprise.orgsource.metadata.SupportedOperation.QUERY;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Optional;

/** Definitions of the metadata types known out of the box. */
public final class BuiltinTypes {
  public static final String APEX_CLASS = "ApexClass";
  public static final String APEX_TRIGGER = "ApexTrigger";
  public static final String CUSTOM_OBJECT = "CustomObject";
  public static final String CUSTOM_FIELD = "CustomField";
  public static final String VALIDATION_RULE = "ValidationRule";
  public static final String LIGHTNING_COMPONENT_BUNDLE = "LightningComponentBundle";
  public static final String AURA_DEFINITION_BUNDLE = "AuraDefinitionBundle";
  public static final String PERMISSION_SET = "PermissionSet";
  public static final String PROFILE = "Profile";
  public static final String CUSTOM_LABELS = "CustomLabels";
  public static final String CUSTOM_METADATA = "CustomMetadata";
  public static final String FLOW = "Flow";
  public static final String LAYOUT = "Layout";
  public static final String EMAIL_TEMPLATE = "EmailTemplate";
  public static final String STATIC_RESOURCE = "StaticResource";
  public static final String CUSTOM_SETTING = "CustomSetting";
  public static final String REPORT = "Report";
  public static final String DASHBOARD = "Dashboard";

  private static final ImmutableMap<String, TypeDefinition> DEFINITIONS;

  static {
    ImmutableList<TypeDefinition> all = ImmutableList.of(
        new TypeDefinition.Builder(APEX_CLASS)
            .setDisplayName("Apex Classes")
            .setFileExtensions(".cls")
            .setRetrievalStrategy(TOOLING_QUERY)
            .setSupportedOperations(LIST, FETCH, QUERY)
            .build(),
        new TypeDefinition.Builder(APEX_TRIGGER)
            .setDisplayName("Apex Triggers")
            .setFileExtensions(".trigger")
            .setRetrievalStrategy(TOOLING_QUERY)
            .setSupportedOperations(LIST, FETCH, QUERY)
            .build(),
        new TypeDefinition.Builder(CUSTOM_OBJECT)
            .setDisplayName("Custom Objects")
            .setFileExtensions(".object-meta.xml")
            .setChildren(ImmutableList.of(
                new TypeDefinition.Builder(CUSTOM_FIELD)
                    .setDisplayName("Custom Fields")
                    .setFileExtensions(".field-meta.xml")
                    .build(),
                new TypeDefinition.Builder(VALIDATION_RULE)
                    .setDisplayName("Validation Rules")
                    .setFileExtensions(".validationRule-meta.xml")
                    .build()))
            .build(),
        new TypeDefinition.Builder(LIGHTNING_COMPONENT_BUNDLE)
            .setDisplayName("Lightning Web Components")
            .setFileExtensions(".js", ".html", ".css", ".js-meta.xml", ".svg")
            .setBundle(true)
            .build(),
        new TypeDefinition.Builder(AURA_DEFINITION_BUNDLE)
            .setDisplayName("Aura Components")
            .setFileExtensions(".cmp", ".app", ".evt", ".js", ".css", ".auradoc", ".design", ".svg")
            .setBundle(true)
            .setRetrievalStrategy(TOOLING_QUERY)
            .build(),
        manifestType(PERMISSION_SET, "Permission Sets", ".permissionset-meta.xml"),
        manifestType(PROFILE, "Profiles", ".profile-meta.xml"),
        manifestType(CUSTOM_LABELS, "Custom Labels", ".labels-meta.xml"),
        manifestType(CUSTOM_METADATA, "Custom Metadata Types", ".md-meta.xml"),
        manifestType(FLOW, "Flows", ".flow-meta.xml"),
        manifestType(LAYOUT, "Layouts", ".layout-meta.xml"),
        manifestType(EMAIL_TEMPLATE, "Email Templates", ".email-meta.xml"),
        manifestType(STATIC_RESOURCE, "Static Resources", ".resource-meta.xml"),
        manifestType(CUSTOM_SETTING, "Custom Settings", ".object-meta.xml")
            .toBuilder()
            .setCliTypeName(CUSTOM_OBJECT)
            .build(),
        manifestType(REPORT, "Reports", ".report-meta.xml"),
        manifestType(DASHBOARD, "Dashboards", ".dashboard-meta.xml"));
    ImmutableMap.Builder<String, TypeDefinition> definitions = ImmutableMap.builder();
    all.forEach(definition -> definitions.put(definition.getName(), definition));
    DEFINITIONS = definitions.build();
  }

  private BuiltinTypes() {}

  private static TypeDefinition manifestType(String name, String displayName, String extension) {
    return new TypeDefinition.Builder(name)
        .setDisplayName(displayName)
        .setFileExtensions(extension)
        .setRetrievalStrategy(MANIFEST_RETRIEVE)
        .build();
  }

  /** All built-in definitions in declaration order. */
  public static List<TypeDefinition> all() {
    return DEFINITIONS.values().asList();
  }

  public static Optional<TypeDefinition> find(String name) {
    return Optional.ofNullable(DEFINITIONS.get(name));
  }

  /**
   * Returns the definition of a built-in type.
   *
   * @throws IllegalArgumentException if {@code name} is not built in
   */
  public static TypeDefinition get(String name) {
    return find(name)
        .orElseThrow(() -> new IllegalArgumentException("Not a built-in type: " + name));
  }
}
