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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/** Custom fields, validation rules and relationships of the custom objects of an org. */
public final class ObjectAnalysis {
  private final ImmutableList<ObjectDescription> objects;

  public ObjectAnalysis(List<ObjectDescription> objects) {
    this.objects = ImmutableList.copyOf(objects);
  }

  public List<ObjectDescription> getObjects() {
    return objects;
  }

  public int getFieldCount() {
    return objects.stream().mapToInt(object -> object.getFields().size()).sum();
  }

  public int getRequiredFieldCount() {
    return (int) fields().filter(FieldDescription::isRequired).count();
  }

  public int getUniqueFieldCount() {
    return (int) fields().filter(FieldDescription::isUnique).count();
  }

  public int getValidationRuleCount() {
    return objects.stream().mapToInt(object -> object.getValidationRules().size()).sum();
  }

  public int getActiveValidationRuleCount() {
    return (int) objects.stream()
        .flatMap(object -> object.getValidationRules().stream())
        .filter(ValidationRuleDescription::isActive)
        .count();
  }

  /** Objects referenced from each object's lookup and master-detail fields. */
  public Map<String, List<String>> getRelationships() {
    ImmutableMap.Builder<String, List<String>> relationships = ImmutableMap.builder();
    for (ObjectDescription object : objects) {
      List<String> referenced = object.getFields().stream()
          .flatMap(field -> field.getReferenceTo().stream())
          .distinct()
          .collect(ImmutableList.toImmutableList());
      if (!referenced.isEmpty()) {
        relationships.put(object.getName(), referenced);
      }
    }
    return relationships.build();
  }

  private Stream<FieldDescription> fields() {
    return objects.stream().flatMap(object -> object.getFields().stream());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("objects", objects.size())
        .add("fields", getFieldCount())
        .add("validationRules", getValidationRuleCount())
        .toString();
  }

  /** One object. Empty fields and rules when the object could not be described. */
  public static final class ObjectDescription {
    private final String name;
    private final String label;
    private final ImmutableList<FieldDescription> fields;
    private final ImmutableList<ValidationRuleDescription> validationRules;

    public ObjectDescription(String name, String label, List<FieldDescription> fields,
        List<ValidationRuleDescription> validationRules) {
      this.name = checkNotNull(name);
      this.label = Strings.isNullOrEmpty(label) ? name : label;
      this.fields = ImmutableList.copyOf(fields);
      this.validationRules = ImmutableList.copyOf(validationRules);
    }

    public String getName() {
      return name;
    }

    public String getLabel() {
      return label;
    }

    /** Custom fields only. */
    public List<FieldDescription> getFields() {
      return fields;
    }

    public List<ValidationRuleDescription> getValidationRules() {
      return validationRules;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("fields", fields)
          .add("validationRules", validationRules)
          .toString();
    }
  }

  /** One custom field. */
  public static final class FieldDescription {
    private final String name;
    private final String label;
    private final String type;
    private final boolean required;
    private final boolean unique;
    private final ImmutableList<String> referenceTo;

    public FieldDescription(String name, String label, String type, boolean required,
        boolean unique, List<String> referenceTo) {
      this.name = checkNotNull(name);
      this.label = Strings.nullToEmpty(label);
      this.type = Strings.nullToEmpty(type);
      this.required = required;
      this.unique = unique;
      this.referenceTo = ImmutableList.copyOf(referenceTo);
    }

    public String getName() {
      return name;
    }

    public String getLabel() {
      return label;
    }

    public String getType() {
      return type;
    }

    /** A value must be supplied on create: not nillable and without a default. */
    public boolean isRequired() {
      return required;
    }

    public boolean isUnique() {
      return unique;
    }

    /** Referenced objects of a lookup or master-detail field, empty otherwise. */
    public List<String> getReferenceTo() {
      return referenceTo;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("type", type)
          .add("required", required)
          .add("unique", unique)
          .add("referenceTo", referenceTo)
          .toString();
    }
  }

  /** One validation rule. */
  public static final class ValidationRuleDescription {
    private final String name;
    private final boolean active;
    private final String errorMessage;
    private final String description;

    public ValidationRuleDescription(
        String name, boolean active, String errorMessage, String description) {
      this.name = checkNotNull(name);
      this.active = active;
      this.errorMessage = Strings.nullToEmpty(errorMessage);
      this.description = Strings.nullToEmpty(description);
    }

    public String getName() {
      return name;
    }

    public boolean isActive() {
      return active;
    }

    public String getErrorMessage() {
      return errorMessage;
    }

    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("active", active)
          .toString();
    }
  }
}
