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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;

/** Counts of known, supported and configured types of an {@link OrgSourceManager}. */
public final class ConfigurationSummary {
  private final int totalTypes;
  private final int supportedTypes;
  private final int handlerCount;
  private final HandlerSettings.Summary settings;

  ConfigurationSummary(int totalTypes, int supportedTypes, int handlerCount,
      HandlerSettings.Summary settings) {
    this.totalTypes = totalTypes;
    this.supportedTypes = supportedTypes;
    this.handlerCount = handlerCount;
    this.settings = checkNotNull(settings);
  }

  /** Types with a definition, whether or not a handler serves them. */
  public int getTotalTypes() {
    return totalTypes;
  }

  /** Types with a registered handler. */
  public int getSupportedTypes() {
    return supportedTypes;
  }

  /** Distinct handler instances. A handler serving two types counts once. */
  public int getHandlerCount() {
    return handlerCount;
  }

  public HandlerSettings.Summary getSettings() {
    return settings;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("totalTypes", totalTypes)
        .add("supportedTypes", supportedTypes)
        .add("handlerCount", handlerCount)
        .add("settings", settings)
        .toString();
  }
}
