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

/**
 * Summary figures for a {@link ProcessingResult}.
 *
 * <p>{@link #getAverageTimeMillis()} divides the batch wall-clock time by the number of
 * attempted inputs. For a concurrent batch this is the per-input share of the elapsed time, not
 * the mean duration of a single input.
 */
public final class ProcessingStats {
  private final int successCount;
  private final int failureCount;
  private final double successRate;
  private final double averageTimeMillis;

  private ProcessingStats(
      int successCount, int failureCount, double successRate, double averageTimeMillis) {
    this.successCount = successCount;
    this.failureCount = failureCount;
    this.successRate = successRate;
    this.averageTimeMillis = averageTimeMillis;
  }

  public static ProcessingStats of(ProcessingResult<?> result) {
    int successCount = result.getSuccess().size();
    int failureCount = result.getFailures().size();
    int total = successCount + failureCount;
    return new ProcessingStats(
        successCount,
        failureCount,
        total > 0 ? (successCount * 100.0) / total : 0,
        total > 0 ? (double) result.getProcessingTimeMillis() / total : 0);
  }

  public int getSuccessCount() {
    return successCount;
  }

  public int getFailureCount() {
    return failureCount;
  }

  /** Percentage of attempted inputs that succeeded, 0 when nothing was attempted. */
  public double getSuccessRate() {
    return successRate;
  }

  public double getAverageTimeMillis() {
    return averageTimeMillis;
  }

  @Override
  public String toString() {
    return String.format("ProcessingStats[success=%d, failures=%d, successRate=%.1f%%, "
        + "averageTime=%.1fms]", successCount, failureCount, successRate, averageTimeMillis);
  }
}
