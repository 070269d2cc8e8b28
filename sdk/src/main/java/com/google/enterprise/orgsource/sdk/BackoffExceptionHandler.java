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
package com.google.enterprise.orgsource.sdk;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExceptionHandler} that waits {@code delay * ntries} before each retry, so the
 * third retry of a one second policy waits three seconds.
 */
public class BackoffExceptionHandler implements ExceptionHandler {
  /** Retry delay used for command line calls. */
  public static final long DEFAULT_DELAY_MILLIS = 1000;

  private final int maximumRetries;
  private final long delay;
  private final TimeUnit delayUnit;

  /**
   * @param maximumRetries retries allowed after the first failure; zero disables retrying
   * @param delay base delay, multiplied by the attempt number
   * @param delayUnit unit of {@code delay}
   */
  public BackoffExceptionHandler(int maximumRetries, long delay, TimeUnit delayUnit) {
    checkArgument(maximumRetries >= 0, "maximumRetries can not be negative");
    checkArgument(delay >= 0, "delay can not be negative");
    this.maximumRetries = maximumRetries;
    this.delay = delay;
    this.delayUnit = checkNotNull(delayUnit);
  }

  /** Handler with {@value #DEFAULT_DELAY_MILLIS} ms steps. */
  public static BackoffExceptionHandler withRetries(int maximumRetries) {
    return new BackoffExceptionHandler(
        maximumRetries, DEFAULT_DELAY_MILLIS, TimeUnit.MILLISECONDS);
  }

  @Override
  public boolean handleException(Exception ex, int ntries) throws InterruptedException {
    if (ntries > maximumRetries) {
      return false;
    }
    delayUnit.sleep(delay * ntries);
    return true;
  }

  public int getMaximumRetries() {
    return maximumRetries;
  }

  @Override
  public int hashCode() {
    return Objects.hash(maximumRetries, delay, delayUnit);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof BackoffExceptionHandler)) {
      return false;
    }
    BackoffExceptionHandler other = (BackoffExceptionHandler) obj;
    return maximumRetries == other.maximumRetries
        && delay == other.delay
        && delayUnit == other.delayUnit;
  }

  @Override
  public String toString() {
    return "BackoffExceptionHandler[retries=" + maximumRetries + ", delay=" + delay + " "
        + delayUnit + "]";
  }
}
