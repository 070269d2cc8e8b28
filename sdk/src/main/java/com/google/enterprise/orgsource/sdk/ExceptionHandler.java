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

/**
 * Decides whether a failed operation is attempted again.
 */
public interface ExceptionHandler {
  /**
   * Determines how to proceed after an attempt failed. Implementations may sleep before
   * returning to back off.
   *
   * @param ex the failure of the latest attempt
   * @param ntries the number of consecutive failures for the current operation
   * @return {@code true} to retry, {@code false} to give up
   * @throws InterruptedException if interrupted while backing off
   */
  boolean handleException(Exception ex, int ntries) throws InterruptedException;
}
