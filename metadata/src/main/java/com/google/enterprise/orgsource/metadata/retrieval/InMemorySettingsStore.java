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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/** {@link SettingsStore} kept in memory only. */
public class InMemorySettingsStore implements SettingsStore {
  private final Map<String, String> values = new ConcurrentHashMap<>();

  @Override
  @Nullable
  public String get(String key, @Nullable String defaultValue) {
    checkArgument(!Strings.isNullOrEmpty(key), "key can not be null or empty");
    return values.getOrDefault(key, defaultValue);
  }

  @Override
  public void set(String key, @Nullable String value) {
    checkArgument(!Strings.isNullOrEmpty(key), "key can not be null or empty");
    if (value == null) {
      values.remove(key);
    } else {
      values.put(key, value);
    }
  }
}
