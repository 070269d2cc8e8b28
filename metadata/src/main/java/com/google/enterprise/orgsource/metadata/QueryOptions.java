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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Which types to list for a target and how. */
public final class QueryOptions {
  private final ImmutableList<String> typeNames;
  private final boolean parallel;
  private final int maxConcurrency;

  private QueryOptions(Builder builder) {
    this.typeNames = ImmutableList.copyOf(builder.typeNames);
    this.parallel = builder.parallel;
    this.maxConcurrency = builder.maxConcurrency;
  }

  public static QueryOptions forTypes(List<String> typeNames) {
    return new Builder(typeNames).build();
  }

  public List<String> getTypeNames() {
    return typeNames;
  }

  public boolean isParallel() {
    return parallel;
  }

  /** Requested concurrency, or 0 to use the processor's default. */
  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  @Override
  public String toString() {
    return "QueryOptions[types=" + typeNames + ", parallel=" + parallel + ", maxConcurrency="
        + maxConcurrency + "]";
  }

  /** Builder for {@link QueryOptions}. Parallel with the default concurrency unless set. */
  public static class Builder {
    private final List<String> typeNames;
    private boolean parallel = true;
    private int maxConcurrency;

    public Builder(List<String> typeNames) {
      this.typeNames = checkNotNull(typeNames, "typeNames can not be null");
    }

    public Builder setParallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    public Builder setMaxConcurrency(int maxConcurrency) {
      checkArgument(maxConcurrency >= 0, "maxConcurrency can not be negative");
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    public QueryOptions build() {
      return new QueryOptions(this);
    }
  }
}
