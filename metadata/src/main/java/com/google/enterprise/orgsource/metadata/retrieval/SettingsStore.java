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
package com.google.enterprise.orgsource.metadata.retrieval;

import java.io.IOException;
import javax.annotation.Nullable;

/** Key-value store for settings that outlive the process. */
public interface SettingsStore {

  /**
   * Returns the value stored under {@code key}, or {@code defaultValue} when there is none.
   *
   * @throws IOException if the store cannot be read
   */
  @Nullable
  String get(String key, @Nullable String defaultValue) throws IOException;

  /**
   * Stores {@code value} under {@code key}. A {@code null} value removes the key.
   *
   * @throws IOException if the store cannot be written
   */
  void set(String key, @Nullable String value) throws IOException;
}
