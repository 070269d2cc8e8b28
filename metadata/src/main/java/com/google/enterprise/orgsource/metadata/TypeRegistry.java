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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Maps metadata type names to their definitions and handlers.
 *
 * <p>The registry starts out with the {@link BuiltinTypes} definitions and no handlers. Handlers
 * are registered by the caller; registering a type again replaces the previous handler. All
 * methods are safe for concurrent use.
 */
public class TypeRegistry {
  private static final Logger logger = Logger.getLogger(TypeRegistry.class.getName());

  static final String NO_HANDLER = "No handler registered for metadata type: ";

  private final ConcurrentMap<String, MetadataHandler> handlers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, TypeDefinition> definitions = new ConcurrentHashMap<>();
  private final ChunkedExecutor executor;

  public TypeRegistry(ChunkedExecutor executor) {
    this.executor = checkNotNull(executor, "executor can not be null");
    BuiltinTypes.all().forEach(this::registerDefinition);
  }

  /** Registers {@code handler} for {@code typeName}, replacing any previous handler. */
  public void registerHandler(String typeName, MetadataHandler handler) {
    checkArgument(!Strings.isNullOrEmpty(typeName), "type name can not be null or empty");
    checkNotNull(handler, "handler can not be null");
    MetadataHandler previous = handlers.put(typeName, handler);
    if (previous != null && previous != handler) {
      logger.log(Level.FINE, "Replaced handler for {0}", typeName);
    }
    definitions.putIfAbsent(typeName, handler.getDefinition());
  }

  /** Registers {@code handler} under each of its {@link MetadataHandler#getSupportedTypes}. */
  public void register(MetadataHandler handler) {
    checkNotNull(handler, "handler can not be null");
    handler.getSupportedTypes().forEach(type -> registerHandler(type, handler));
  }

  /** Removes the handler of {@code typeName}. Its definition stays known. */
  public Optional<MetadataHandler> unregisterHandler(String typeName) {
    MetadataHandler removed = handlers.remove(typeName);
    if (removed != null) {
      logger.log(Level.FINE, "Removed handler for {0}", typeName);
    }
    return Optional.ofNullable(removed);
  }

  public Optional<MetadataHandler> getHandler(String typeName) {
    return Optional.ofNullable(handlers.get(typeName));
  }

  /** Distinct registered handlers. */
  public List<MetadataHandler> getAllHandlers() {
    return ImmutableSet.copyOf(handlers.values()).asList();
  }

  public void registerDefinition(TypeDefinition definition) {
    checkNotNull(definition, "definition can not be null");
    definitions.put(definition.getName(), definition);
  }

  public Optional<TypeDefinition> getDefinition(String typeName) {
    return Optional.ofNullable(definitions.get(typeName));
  }

  /** All known definitions, ordered by type name. */
  public List<TypeDefinition> getAllDefinitions() {
    return definitions.values().stream()
        .sorted((a, b) -> a.getName().compareTo(b.getName()))
        .collect(ImmutableList.toImmutableList());
  }

  /** Names of the types that have a handler, in alphabetical order. */
  public List<String> listSupportedTypes() {
    return handlers.keySet().stream().sorted().collect(ImmutableList.toImmutableList());
  }

  public boolean isTypeSupported(String typeName) {
    return handlers.containsKey(typeName);
  }

  /** Supported types whose artifacts are multi-file bundles. */
  public List<String> getBundleTypes() {
    return supportedMatching(definition -> definition.isBundle());
  }

  public List<String> getTypesByOperation(SupportedOperation operation) {
    checkNotNull(operation);
    return supportedMatching(definition -> definition.supports(operation));
  }

  public List<String> getTypesByStrategy(RetrievalStrategy strategy) {
    checkNotNull(strategy);
    return supportedMatching(definition -> definition.getRetrievalStrategy() == strategy);
  }

  private List<String> supportedMatching(Predicate<TypeDefinition> filter) {
    return listSupportedTypes().stream()
        .filter(type -> getDefinition(type).map(filter::test).orElse(false))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Lists the items of every type in {@code typeNames}, all types at once. A type without handler
   * or whose listing fails is reported as a failure; the others are unaffected.
   */
  public ProcessingResult<TypeItems> getFilesForTypes(
      String targetId, String targetIdentifier, List<String> typeNames) {
    checkNotNull(typeNames, "typeNames can not be null");
    return executor.process(typeNames, Math.max(1, typeNames.size()), true,
        type -> new TypeItems(type,
            requireHandler(type).listItems(targetId, targetIdentifier, type)));
  }

  /**
   * Fetches the content of {@code items}, grouped by type and delegated to each type's handler.
   * Items of a type without handler each become a failure.
   */
  public ProcessingResult<ItemContent> getContentForFiles(
      String targetId, String targetIdentifier, List<Item> items) {
    checkNotNull(items, "items can not be null");
    Stopwatch stopwatch = Stopwatch.createStarted();
    Map<String, List<Item>> byType = items.stream()
        .collect(Collectors.groupingBy(Item::getTypeName, LinkedHashMap::new,
            Collectors.toList()));
    List<String> types = new ArrayList<>(byType.keySet());
    ProcessingResult<ProcessingResult<ItemContent>> perType =
        executor.process(types, Math.max(1, types.size()), true,
            type -> {
              List<Item> group = byType.get(type);
              Optional<MetadataHandler> handler = getHandler(type);
              if (!handler.isPresent()) {
                ProcessingResult.Builder<ItemContent> unsupported =
                    new ProcessingResult.Builder<>();
                group.forEach(item -> unsupported.addFailure(item, NO_HANDLER + type));
                return unsupported.build(0);
              }
              return handler.get().fetchContentBatch(targetId, targetIdentifier, group);
            });
    ProcessingResult.Builder<ItemContent> result = new ProcessingResult.Builder<>();
    perType.getSuccess().forEach(result::addAll);
    for (ProcessingResult.Failure failure : perType.getFailures()) {
      byType.get((String) failure.getInput())
          .forEach(item -> result.addFailure(item, failure.getError()));
    }
    return result.build(stopwatch.elapsed(TimeUnit.MILLISECONDS));
  }

  /**
   * Returns the handler of {@code typeName}.
   *
   * @throws RetrievalException of type {@link ErrorType#UNREGISTERED_TYPE} if there is none
   */
  public MetadataHandler requireHandler(String typeName) throws RetrievalException {
    MetadataHandler handler = handlers.get(typeName);
    if (handler == null) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.UNREGISTERED_TYPE)
          .setErrorMessage(NO_HANDLER + typeName)
          .build();
    }
    return handler;
  }

  /** Removes every handler and restores the built-in definitions. */
  public void clear() {
    handlers.clear();
    definitions.clear();
    BuiltinTypes.all().forEach(this::registerDefinition);
  }
}
