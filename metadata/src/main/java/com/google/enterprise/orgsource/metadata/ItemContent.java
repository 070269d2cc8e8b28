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

import java.util.Objects;

/** An {@link Item} together with its fetched {@link Content}. */
public final class ItemContent {
  private final Item item;
  private final Content content;

  public ItemContent(Item item, Content content) {
    this.item = checkNotNull(item);
    this.content = checkNotNull(content);
  }

  public Item getItem() {
    return item;
  }

  public Content getContent() {
    return content;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ItemContent)) {
      return false;
    }
    ItemContent other = (ItemContent) obj;
    return item.equals(other.item) && content.equals(other.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(item, content);
  }

  @Override
  public String toString() {
    return "ItemContent[" + item.getId() + ", " + content + "]";
  }
}
