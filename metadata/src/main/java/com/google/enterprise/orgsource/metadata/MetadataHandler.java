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

import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import java.util.List;
import java.util.Set;

/**
 * Lists and fetches the artifacts of one or more metadata types.
 *
 * <p>Implementations must be safe for concurrent use: the same handler instance serves every
 * target and is called from several threads at once.
 */
public interface MetadataHandler {

  /** Definition of the primary type served by this handler. */
  TypeDefinition getDefinition();

  HandlerConfig getConfig();

  /**
   * Lists every artifact of every type this handler serves in the target org.
   *
   * @param targetId stable id of the target, used in item ids
   * @param targetIdentifier username or alias passed to the command line tool
   * @return the items, empty if the type has no instances
   * @throws RetrievalException if the listing fails, with the tool's error text as message
   */
  List<Item> listItems(String targetId, String targetIdentifier) throws RetrievalException;

  /**
   * Lists the artifacts of {@code typeName}, one of {@link #getSupportedTypes()}. Handlers that
   * serve a single type list everything.
   */
  default List<Item> listItems(String targetId, String targetIdentifier, String typeName)
      throws RetrievalException {
    return listItems(targetId, targetIdentifier);
  }

  /**
   * Fetches the content of one item. Failures are logged and yield empty content: empty text,
   * or for bundle types a bundle whose only file is the empty main file.
   */
  Content fetchContent(String targetId, String targetIdentifier, Item item);

  /**
   * Fetches several items, honoring {@link HandlerConfig#isParallel()} and {@link
   * HandlerConfig#getMaxConcurrency()}. Items that fail are reported as failures, not as empty
   * content.
   */
  ProcessingResult<ItemContent> fetchContentBatch(
      String targetId, String targetIdentifier, List<Item> items);

  /** Returns {@code true} if this handler serves {@code typeName}. */
  boolean supports(String typeName);

  /** Every type name this handler serves. */
  Set<String> getSupportedTypes();
}
