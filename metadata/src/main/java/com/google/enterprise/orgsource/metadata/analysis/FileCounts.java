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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Number of bundle files per kind, e.g. {@code js} or {@code html}, plus the total. */
public final class FileCounts {
  private final int total;
  private final ImmutableMap<String, Integer> byKind;

  private FileCounts(int total, Map<String, Integer> byKind) {
    this.total = total;
    this.byKind = ImmutableMap.copyOf(byKind);
  }

  /**
   * Counts {@code fileNames} by the kind {@code classifier} assigns them. Every kind in {@code
   * kinds} is present in the result, possibly with zero.
   */
  static FileCounts count(
      List<String> fileNames, List<String> kinds, Function<String, String> classifier) {
    checkNotNull(fileNames);
    Map<String, Integer> counts = new LinkedHashMap<>();
    kinds.forEach(kind -> counts.put(kind, 0));
    for (String fileName : fileNames) {
      String kind = classifier.apply(fileName);
      if (kind != null) {
        counts.merge(kind, 1, Integer::sum);
      }
    }
    return new FileCounts(fileNames.size(), counts);
  }

  public int getTotal() {
    return total;
  }

  /** Count of {@code kind}, zero if no file is of that kind. */
  public int get(String kind) {
    return byKind.getOrDefault(kind, 0);
  }

  public Map<String, Integer> getByKind() {
    return byKind;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("total", total)
        .add("byKind", byKind)
        .toString();
  }
}
