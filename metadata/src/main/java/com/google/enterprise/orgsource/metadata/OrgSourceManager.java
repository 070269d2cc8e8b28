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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.enterprise.orgsource.metadata.HandlerConfig.Priority;
import com.google.enterprise.orgsource.metadata.analysis.ApexAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.AuraAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.BundleStructure;
import com.google.enterprise.orgsource.metadata.analysis.ComponentDependencies;
import com.google.enterprise.orgsource.metadata.analysis.LwcAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis;
import com.google.enterprise.orgsource.metadata.handlers.ApexHandler;
import com.google.enterprise.orgsource.metadata.handlers.AuraHandler;
import com.google.enterprise.orgsource.metadata.handlers.CustomObjectHandler;
import com.google.enterprise.orgsource.metadata.handlers.GeneralMetadataHandler;
import com.google.enterprise.orgsource.metadata.handlers.LwcHandler;
import com.google.enterprise.orgsource.metadata.retrieval.LocalFileSettingsStore;
import com.google.enterprise.orgsource.metadata.retrieval.ManifestSettings;
import com.google.enterprise.orgsource.metadata.retrieval.SourceRetrievalCoordinator;
import com.google.enterprise.orgsource.metadata.retrieval.Target;
import com.google.enterprise.orgsource.metadata.retrieval.TargetDiscovery;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.batch.ProcessingStats;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Entry point for listing, fetching and retrieving metadata of target orgs.
 *
 * <p>Wires the {@link TypeRegistry} with the built-in handlers enabled in {@link Configuration},
 * the {@link ParallelProcessor} and the {@link SourceRetrievalCoordinator}. Instances own their
 * worker threads and must be {@linkplain #close closed}.
 *
 * <pre>{@code
 * Configuration.initConfig(args);
 * try (OrgSourceManager manager = OrgSourceManager.fromConfiguration()) {
 *   Target target = new Target("00D000000000001", "admin@example.com", null);
 *   ProcessingResult<TypeItems> listed =
 *       manager.listItems(target, QueryOptions.forTypes(ImmutableList.of("ApexClass")));
 *   ...
 * }
 * }</pre>
 */
public class OrgSourceManager implements Closeable {
  private static final Logger logger = Logger.getLogger(OrgSourceManager.class.getName());

  private final ChunkedExecutor chunkedExecutor;
  private final ListeningExecutorService retrievalExecutor;
  private final HandlerContext context;
  private final HandlerSettings handlerSettings;
  private final TypeRegistry registry;
  private final ParallelProcessor processor;
  private final SourceRetrievalCoordinator coordinator;
  private final ManifestSettings manifestSettings;
  private final TargetDiscovery discovery;

  @VisibleForTesting
  OrgSourceManager(ChunkedExecutor chunkedExecutor, ListeningExecutorService retrievalExecutor,
      HandlerContext context, HandlerSettings handlerSettings, TypeRegistry registry,
      ParallelProcessor processor, SourceRetrievalCoordinator coordinator,
      ManifestSettings manifestSettings) {
    this.chunkedExecutor = checkNotNull(chunkedExecutor);
    this.retrievalExecutor = checkNotNull(retrievalExecutor);
    this.context = checkNotNull(context);
    this.handlerSettings = checkNotNull(handlerSettings);
    this.registry = checkNotNull(registry);
    this.processor = checkNotNull(processor);
    this.coordinator = checkNotNull(coordinator);
    this.manifestSettings = checkNotNull(manifestSettings);
    this.discovery = new TargetDiscovery(context, HandlerConfig.DEFAULT.getRetryCount());
  }

  /**
   * Creates a manager from {@link Configuration}.
   *
   * @throws IOException if the saved manifest settings cannot be read
   */
  public static OrgSourceManager fromConfiguration() throws IOException {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    ChunkedExecutor chunkedExecutor = new ChunkedExecutor("metadata");
    ListeningExecutorService retrievalExecutor = MoreExecutors.listeningDecorator(
        Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("source-retrieval-%d")
            .setDaemon(true)
            .build()));
    try {
      HandlerContext context = HandlerContext.fromConfiguration(chunkedExecutor);
      HandlerSettings handlerSettings = HandlerSettings.fromConfiguration();
      TypeRegistry registry = new TypeRegistry(chunkedExecutor);
      registerBuiltinHandlers(registry, context, handlerSettings::get);
      ManifestSettings settings =
          new ManifestSettings(LocalFileSettingsStore.fromConfiguration(), context.getApiVersion());
      return new OrgSourceManager(chunkedExecutor, retrievalExecutor, context, handlerSettings,
          registry,
          ParallelProcessor.fromConfiguration(registry, chunkedExecutor),
          SourceRetrievalCoordinator.fromConfiguration(context, settings, retrievalExecutor),
          settings);
    } catch (IOException | RuntimeException e) {
      shutdown(retrievalExecutor);
      chunkedExecutor.close();
      throw e;
    }
  }

  /**
   * Registers a handler for every built-in type whose configuration is enabled. A handler that
   * serves several types is created once and registered for each of them that is enabled.
   *
   * @param configs configuration of each type, by type name
   */
  public static void registerBuiltinHandlers(TypeRegistry registry, HandlerContext context,
      Function<String, HandlerConfig> configs) {
    Set<String> registered = new HashSet<>();
    for (TypeDefinition definition : BuiltinTypes.all()) {
      String name = definition.getName();
      HandlerConfig config = configs.apply(name);
      if (!config.isEnabled()) {
        logger.log(Level.FINE, "Handler for {0} is disabled", name);
        continue;
      }
      if (registered.contains(name)) {
        continue;
      }
      Optional<MetadataHandler> handler = createBuiltinHandler(definition, config, context);
      if (!handler.isPresent()) {
        continue;
      }
      Set<String> served = handler.get().getSupportedTypes();
      List<String> enabled = served.stream()
          .filter(type -> configs.apply(type).isEnabled())
          .collect(Collectors.toList());
      if (enabled.size() == served.size()) {
        registry.register(handler.get());
      } else {
        enabled.forEach(type -> registry.registerHandler(type, handler.get()));
      }
      registered.addAll(enabled);
    }
    logger.log(Level.INFO, "Registered handlers for {0}", registry.listSupportedTypes());
  }

  @VisibleForTesting
  static Optional<MetadataHandler> createBuiltinHandler(
      TypeDefinition definition, HandlerConfig config, HandlerContext context) {
    String name = definition.getName();
    if (ApexHandler.TYPES.contains(name)) {
      return Optional.of(new ApexHandler(config, context));
    } else if (BuiltinTypes.LIGHTNING_COMPONENT_BUNDLE.equals(name)) {
      return Optional.of(new LwcHandler(definition, config, context));
    } else if (BuiltinTypes.AURA_DEFINITION_BUNDLE.equals(name)) {
      return Optional.of(new AuraHandler(definition, config, context));
    } else if (BuiltinTypes.CUSTOM_OBJECT.equals(name)) {
      return Optional.of(new CustomObjectHandler(definition, config, context));
    } else if (GeneralMetadataHandler.TYPES.contains(name)) {
      return Optional.of(new GeneralMetadataHandler(definition, config, context));
    }
    return Optional.empty();
  }

  /**
   * Enables a built-in type and registers its handler, reusing a registered handler that
   * already serves it.
   *
   * @return {@code false} if the type is not a configured type
   */
  public synchronized boolean enableType(String typeName) {
    if (!handlerSettings.enableType(typeName)) {
      return false;
    }
    if (registry.isTypeSupported(typeName)) {
      return true;
    }
    Optional<MetadataHandler> shared = registry.getAllHandlers().stream()
        .filter(handler -> handler.supports(typeName))
        .findFirst();
    Optional<MetadataHandler> handler = shared.isPresent()
        ? shared
        : registry.getDefinition(typeName).flatMap(definition ->
            createBuiltinHandler(definition, handlerSettings.get(typeName), context));
    handler.ifPresent(h -> registry.registerHandler(typeName, h));
    return true;
  }

  /**
   * Disables a type and removes its handler.
   *
   * @return {@code false} if the type is not a configured type
   */
  public synchronized boolean disableType(String typeName) {
    if (!handlerSettings.disableType(typeName)) {
      return false;
    }
    registry.unregisterHandler(typeName);
    return true;
  }

  /** Enabled types of {@code priority}. */
  public List<String> getTypesByPriority(Priority priority) {
    return handlerSettings.getTypesByPriority(priority);
  }

  public ConfigurationSummary getConfigurationSummary() {
    return new ConfigurationSummary(registry.getAllDefinitions().size(),
        registry.listSupportedTypes().size(), registry.getAllHandlers().size(),
        handlerSettings.getSummary());
  }

  /** Configured handler values that were out of range when the manager was created. */
  public List<HandlerSettings.Problem> validateConfiguration() {
    return handlerSettings.validate();
  }

  /** Orgs the command line tool is authorized against. */
  public List<Target> discoverTargets() throws RetrievalException {
    return discovery.discover();
  }

  /**
   * Lists every enabled type of {@code target} that has a handler, high priority types first,
   * and counts the items per type.
   *
   * @throws IllegalArgumentException if the target cannot be addressed on the command line
   */
  public TargetAnalysis analyzeTarget(Target target) {
    List<String> types = handlerSettings.getEnabledTypes().stream()
        .filter(registry::isTypeSupported)
        .collect(Collectors.toList());
    TargetAnalysis analysis = new TargetAnalysis(target, listItems(target,
        QueryOptions.forTypes(types)));
    logger.log(Level.INFO, "Analyzed {0}: {1} items in {2} types", new Object[] {
        target.getId(), analysis.getTotalItems(), analysis.getTypeCount()});
    return analysis;
  }

  public ApexAnalysis analyzeApex(Target target) throws RetrievalException {
    return handler(BuiltinTypes.APEX_CLASS, ApexHandler.class)
        .analyze(target.getId(), checkedIdentifier(target));
  }

  public LwcAnalysis analyzeLwc(Target target) throws RetrievalException {
    return handler(BuiltinTypes.LIGHTNING_COMPONENT_BUNDLE, LwcHandler.class)
        .analyze(target.getId(), checkedIdentifier(target));
  }

  public AuraAnalysis analyzeAura(Target target) throws RetrievalException {
    return handler(BuiltinTypes.AURA_DEFINITION_BUNDLE, AuraHandler.class)
        .analyze(target.getId(), checkedIdentifier(target));
  }

  public ObjectAnalysis analyzeObjects(Target target) throws RetrievalException {
    return handler(BuiltinTypes.CUSTOM_OBJECT, CustomObjectHandler.class)
        .analyze(target.getId(), checkedIdentifier(target));
  }

  /**
   * Tells which file of a Lightning web component or Aura bundle plays which role.
   *
   * @throws RetrievalException if the item is not a component bundle or cannot be fetched
   */
  public BundleStructure getBundleStructure(Target target, Item item) throws RetrievalException {
    String identifier = checkedIdentifier(target);
    MetadataHandler handler = registry.requireHandler(item.getTypeName());
    if (handler instanceof LwcHandler) {
      return ((LwcHandler) handler).getBundleStructure(target.getId(), identifier, item);
    } else if (handler instanceof AuraHandler) {
      return ((AuraHandler) handler).getBundleStructure(target.getId(), identifier, item);
    }
    throw new RetrievalException.Builder()
        .setErrorType(ErrorType.CONTENT)
        .setErrorMessage(item.getTypeName() + " items are not component bundles")
        .build();
  }

  /** Dependencies declared in the markup of an Aura bundle. */
  public ComponentDependencies getComponentDependencies(Target target, Item item)
      throws RetrievalException {
    return handler(BuiltinTypes.AURA_DEFINITION_BUNDLE, AuraHandler.class)
        .getComponentDependencies(target.getId(), checkedIdentifier(target), item);
  }

  private <H extends MetadataHandler> H handler(String typeName, Class<H> handlerClass)
      throws RetrievalException {
    MetadataHandler handler = registry.requireHandler(typeName);
    if (!handlerClass.isInstance(handler)) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.UNREGISTERED_TYPE)
          .setErrorMessage(String.format("%s is served by %s, not %s", typeName,
              handler.getClass().getSimpleName(), handlerClass.getSimpleName()))
          .build();
    }
    return handlerClass.cast(handler);
  }

  private static String checkedIdentifier(Target target) {
    return CliCommands.checkOrgIdentifier(checkNotNull(target).identifier());
  }

  public List<String> listSupportedTypes() {
    return registry.listSupportedTypes();
  }

  public boolean isTypeSupported(String typeName) {
    return registry.isTypeSupported(typeName);
  }

  public Optional<TypeDefinition> getTypeDefinition(String typeName) {
    return registry.getDefinition(typeName);
  }

  /**
   * Lists the items of the types in {@code options}.
   *
   * @throws IllegalArgumentException if the target cannot be addressed on the command line
   */
  public ProcessingResult<TypeItems> listItems(Target target, QueryOptions options) {
    CliCommands.checkOrgIdentifier(checkNotNull(target).identifier());
    return processor.processTypes(target.getId(), target.identifier(), options);
  }

  /**
   * Fetches the content of {@code items}.
   *
   * @throws IllegalArgumentException if the target cannot be addressed on the command line
   */
  public ProcessingResult<ItemContent> fetchContent(Target target, List<Item> items) {
    CliCommands.checkOrgIdentifier(checkNotNull(target).identifier());
    return registry.getContentForFiles(target.getId(), target.identifier(), items);
  }

  /** Retrieves the manifest selection of {@code target}; see {@link SourceRetrievalCoordinator}. */
  public ListenableFuture<Path> retrieveSource(Target target) {
    CliCommands.checkOrgIdentifier(checkNotNull(target).identifier());
    return coordinator.retrieve(target);
  }

  public ListenableFuture<Path> refreshSource(Target target) throws IOException {
    CliCommands.checkOrgIdentifier(checkNotNull(target).identifier());
    return coordinator.refresh(target);
  }

  public void invalidateSource(String targetId) throws IOException {
    coordinator.invalidate(targetId);
  }

  public ProcessingStats getProcessingStats(ProcessingResult<?> result) {
    return processor.getProcessingStats(result);
  }

  public void setProcessorConcurrency(int concurrency) {
    processor.setDefaultConcurrency(concurrency);
  }

  public void setProcessorTimeout(long timeoutMillis) {
    processor.setDefaultTimeout(timeoutMillis);
  }

  public HandlerSettings getHandlerSettings() {
    return handlerSettings;
  }

  public TypeRegistry getRegistry() {
    return registry;
  }

  public ParallelProcessor getProcessor() {
    return processor;
  }

  public SourceRetrievalCoordinator getCoordinator() {
    return coordinator;
  }

  public ManifestSettings getManifestSettings() {
    return manifestSettings;
  }

  /** Stops the worker threads. Running retrievals are given ten seconds to finish. */
  @Override
  public void close() {
    shutdown(retrievalExecutor);
    chunkedExecutor.close();
  }

  private static void shutdown(ExecutorService executor) {
    if (executor.isShutdown()) {
      return;
    }
    executor.shutdown();
    try {
      executor.awaitTermination(10L, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      logger.log(Level.WARNING, "Interrupted during executor termination.", e);
      Thread.currentThread().interrupt();
    }
    executor.shutdownNow();
  }
}
