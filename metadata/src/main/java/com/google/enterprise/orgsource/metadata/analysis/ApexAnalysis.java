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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Size, complexity and coverage of the Apex classes of an org, and what its triggers fire on. */
public final class ApexAnalysis {
  private final ImmutableList<ClassMetrics> classes;
  private final ImmutableList<TriggerUsage> triggers;

  public ApexAnalysis(List<ClassMetrics> classes, List<TriggerUsage> triggers) {
    this.classes = ImmutableList.copyOf(classes);
    this.triggers = ImmutableList.copyOf(triggers);
  }

  public List<ClassMetrics> getClasses() {
    return classes;
  }

  public List<TriggerUsage> getTriggers() {
    return triggers;
  }

  /** Coverage over all lines of all classes, in percent. Zero when no line is measured. */
  public double getOverallCoverage() {
    long covered = 0;
    long total = 0;
    for (ClassMetrics metrics : classes) {
      covered += metrics.getLinesCovered();
      total += metrics.getLinesCovered() + metrics.getLinesUncovered();
    }
    return ClassMetrics.percent(covered, total);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("classes", classes)
        .add("triggers", triggers)
        .toString();
  }

  /** Metrics of one Apex class. */
  public static final class ClassMetrics {
    private final String name;
    private final long lengthWithoutComments;
    private final long linesCovered;
    private final long linesUncovered;

    public ClassMetrics(
        String name, long lengthWithoutComments, long linesCovered, long linesUncovered) {
      this.name = checkNotNull(name);
      this.lengthWithoutComments = lengthWithoutComments;
      this.linesCovered = linesCovered;
      this.linesUncovered = linesUncovered;
    }

    public String getName() {
      return name;
    }

    public long getLengthWithoutComments() {
      return lengthWithoutComments;
    }

    public long getLinesCovered() {
      return linesCovered;
    }

    public long getLinesUncovered() {
      return linesUncovered;
    }

    /** 1 for small classes up to 5 for classes of 500 characters or more without comments. */
    public int getComplexity() {
      return complexity(lengthWithoutComments);
    }

    /** Covered share of the measured lines in percent, rounded to two decimals. */
    public double getCoverage() {
      return percent(linesCovered, linesCovered + linesUncovered);
    }

    @VisibleForTesting
    static int complexity(long length) {
      if (length < 50) {
        return 1;
      } else if (length < 100) {
        return 2;
      } else if (length < 200) {
        return 3;
      } else if (length < 500) {
        return 4;
      }
      return 5;
    }

    static double percent(long part, long total) {
      if (total <= 0) {
        return 0;
      }
      return Math.round(part * 10000.0 / total) / 100.0;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ClassMetrics)) {
        return false;
      }
      ClassMetrics other = (ClassMetrics) obj;
      return name.equals(other.name)
          && lengthWithoutComments == other.lengthWithoutComments
          && linesCovered == other.linesCovered
          && linesUncovered == other.linesUncovered;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, lengthWithoutComments, linesCovered, linesUncovered);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("length", lengthWithoutComments)
          .add("complexity", getComplexity())
          .add("coverage", getCoverage())
          .toString();
    }
  }

  /** The object a trigger is defined on and the DML events it handles. */
  public static final class TriggerUsage {
    public static final String UNKNOWN_OBJECT = "Unknown";

    private final String name;
    private final String objectName;
    private final ImmutableList<String> events;

    public TriggerUsage(String name, String objectName, List<String> events) {
      this.name = checkNotNull(name);
      this.objectName = checkNotNull(objectName);
      this.events = ImmutableList.copyOf(events);
    }

    public String getName() {
      return name;
    }

    /** API name of the object, or {@value #UNKNOWN_OBJECT}. */
    public String getObjectName() {
      return objectName;
    }

    /** Events such as {@code before insert}, in firing order. */
    public List<String> getEvents() {
      return events;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof TriggerUsage)) {
        return false;
      }
      TriggerUsage other = (TriggerUsage) obj;
      return name.equals(other.name)
          && objectName.equals(other.objectName)
          && events.equals(other.events);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, objectName, events);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("object", objectName)
          .add("events", events)
          .toString();
    }
  }
}
