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

import java.util.Optional;
import java.util.function.ToIntFunction;
import javax.annotation.Nullable;

/**
 * Options of {@link ParallelProcessor#batchProcessRequests}. Zero concurrency or timeout means
 * the processor's default.
 *
 * @param <T> request type
 */
public final class BatchOptions<T> {
  private final int maxConcurrency;
  private final long timeoutMillis;
  @Nullable private final ToIntFunction<T> priority;

  private BatchOptions(Builder<T> builder) {
    this.maxConcurrency = builder.maxConcurrency;
    this.timeoutMillis = builder.timeoutMillis;
    this.priority = builder.priority;
  }

  public static <T> BatchOptions<T> defaults() {
    return new Builder<T>().build();
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  /** Higher priority requests are started first. */
  public Optional<ToIntFunction<T>> getPriority() {
    return Optional.ofNullable(priority);
  }

  /** Builder for {@link BatchOptions}. */
  public static class Builder<T> {
    private int maxConcurrency;
    private long timeoutMillis;
    private ToIntFunction<T> priority;

    public Builder<T> setMaxConcurrency(int maxConcurrency) {
      checkArgument(maxConcurrency >= 0, "maxConcurrency can not be negative");
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    public Builder<T> setTimeoutMillis(long timeoutMillis) {
      checkArgument(timeoutMillis >= 0, "timeout can not be negative");
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public Builder<T> setPriority(@Nullable ToIntFunction<T> priority) {
      this.priority = priority;
      return this;
    }

    public BatchOptions<T> build() {
      return new BatchOptions<>(this);
    }
  }
}
