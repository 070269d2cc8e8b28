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

/**
 * Content of an {@link Item}: either a single text document or a {@link BundleContent} made of
 * several named files.
 */
public abstract class Content {

  Content() {}

  public abstract boolean isBundle();

  /** Returns this content as text. */
  public TextContent asText() {
    throw new IllegalStateException("Not a text content: " + this);
  }

  /** Returns this content as a bundle. */
  public BundleContent asBundle() {
    throw new IllegalStateException("Not a bundle content: " + this);
  }

  /** Returns {@code true} if there is nothing in this content. */
  public abstract boolean isEmpty();
}
