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

/** How a handler obtains the content of an artifact. */
public enum RetrievalStrategy {
  /** Queries the tooling API for the source body. */
  TOOLING_QUERY,
  /** Retrieves the artifact into a local project and reads the files. */
  MANIFEST_RETRIEVE,
  /** Queries regular records. */
  SOQL,
  CUSTOM
}
