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

import static com.google.common.base.Preconditions.checkNotNull;

/** Single document content. */
public final class TextContent extends Content {
  private static final TextContent EMPTY = new TextContent("");

  private final String text;

  private TextContent(String text) {
    this.text = checkNotNull(text);
  }

  public static TextContent of(String text) {
    return text.isEmpty() ? EMPTY : new TextContent(text);
  }

  public static TextContent empty() {
    return EMPTY;
  }

  public String getText() {
    return text;
  }

  @Override
  public boolean isBundle() {
    return false;
  }

  @Override
  public TextContent asText() {
    return this;
  }

  @Override
  public boolean isEmpty() {
    return text.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TextContent && text.equals(((TextContent) obj).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return "TextContent[" + text.length() + " chars]";
  }
}
