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
package com.google.enterprise.orgsource.sdk.batch;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a batch: the values that were produced, the inputs that failed and how long the
 * whole batch took. Every attempted input appears exactly once, either as a success value or
 * as a {@link Failure}.
 *
 * @param <T> type of the success values
 */
public final class ProcessingResult<T> {
  private final ImmutableList<T> success;
  private final ImmutableList<Failure> failures;
  private final long processingTimeMillis;

  private ProcessingResult(List<T> success, List<Failure> failures, long processingTimeMillis) {
    this.success = ImmutableList.copyOf(success);
    this.failures = ImmutableList.copyOf(failures);
    this.processingTimeMillis = processingTimeMillis;
  }

  public static <T> ProcessingResult<T> empty() {
    return new ProcessingResult<>(ImmutableList.of(), ImmutableList.of(), 0);
  }

  public List<T> getSuccess() {
    return success;
  }

  public List<Failure> getFailures() {
    return failures;
  }

  /** Wall-clock time of the whole batch in milliseconds. */
  public long getProcessingTimeMillis() {
    return processingTimeMillis;
  }

  public int getAttemptedCount() {
    return success.size() + failures.size();
  }

  @Override
  public String toString() {
    return "ProcessingResult[success=" + success.size() + ", failures=" + failures.size()
        + ", processingTime=" + processingTimeMillis + "ms]";
  }

  /** An input that could not be processed and the reason. */
  public static final class Failure {
    private final Object input;
    private final String error;

    public Failure(Object input, String error) {
      this.input = checkNotNull(input, "input can not be null");
      this.error = Strings.isNullOrEmpty(error) ? "Unknown error" : error;
    }

    public Object getInput() {
      return input;
    }

    public String getError() {
      return error;
    }

    @Override
    public boolean equals(Object obj) {
      if (obj == this) {
        return true;
      }
      if (!(obj instanceof Failure)) {
        return false;
      }
      Failure other = (Failure) obj;
      return input.equals(other.input) && error.equals(other.error);
    }

    @Override
    public int hashCode() {
      return Objects.hash(input, error);
    }

    @Override
    public String toString() {
      return "Failure[input=" + input + ", error=" + error + "]";
    }
  }

  /** Thread-safe accumulator for a {@link ProcessingResult}. */
  public static final class Builder<T> {
    private final List<T> success = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();

    public synchronized Builder<T> addSuccess(T value) {
      success.add(checkNotNull(value));
      return this;
    }

    public synchronized Builder<T> addFailure(Object input, String error) {
      failures.add(new Failure(input, error));
      return this;
    }

    /** Adds every success value and failure of {@code result}. */
    public synchronized Builder<T> addAll(ProcessingResult<? extends T> result) {
      success.addAll(result.getSuccess());
      failures.addAll(result.getFailures());
      return this;
    }

    public synchronized ProcessingResult<T> build(long processingTimeMillis) {
      checkArgument(processingTimeMillis >= 0, "processing time can not be negative");
      return new ProcessingResult<>(success, failures, processingTimeMillis);
    }
  }
}
