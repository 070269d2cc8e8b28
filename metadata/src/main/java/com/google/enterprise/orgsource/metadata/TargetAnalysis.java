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
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.orgsource.metadata.retrieval.Target;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import java.util.Map;

/** Item counts of every enabled type of one target, with the listing result they come from. */
public final class TargetAnalysis {
  private final Target target;
  private final ProcessingResult<TypeItems> result;
  private final ImmutableMap<String, Integer> itemsByType;

  public TargetAnalysis(Target target, ProcessingResult<TypeItems> result) {
    this.target = checkNotNull(target);
    this.result = checkNotNull(result);
    ImmutableMap.Builder<String, Integer> counts = ImmutableMap.builder();
    result.getSuccess().forEach(type -> counts.put(type.getTypeName(), type.getItems().size()));
    this.itemsByType = counts.build();
  }

  public Target getTarget() {
    return target;
  }

  /** Number of types listed successfully. */
  public int getTypeCount() {
    return itemsByType.size();
  }

  public int getTotalItems() {
    return itemsByType.values().stream().mapToInt(Integer::intValue).sum();
  }

  /** Item count of each type listed successfully, in listing order. */
  public Map<String, Integer> getItemsByType() {
    return itemsByType;
  }

  /** Listed items and the types whose listing failed. */
  public ProcessingResult<TypeItems> getResult() {
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("target", target.getId())
        .add("itemsByType", itemsByType)
        .add("failures", result.getFailures().size())
        .toString();
  }
}
