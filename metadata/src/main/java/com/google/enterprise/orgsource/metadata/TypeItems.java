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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Items listed for one metadata type. */
public final class TypeItems {
  private final String typeName;
  private final ImmutableList<Item> items;

  public TypeItems(String typeName, List<Item> items) {
    this.typeName = checkNotNull(typeName);
    this.items = ImmutableList.copyOf(items);
  }

  public String getTypeName() {
    return typeName;
  }

  public List<Item> getItems() {
    return items;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeItems)) {
      return false;
    }
    TypeItems other = (TypeItems) obj;
    return typeName.equals(other.typeName) && items.equals(other.items);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, items);
  }

  @Override
  public String toString() {
    return "TypeItems[" + typeName + ", " + items.size() + " items]";
  }
}
