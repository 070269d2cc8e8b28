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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Base class for handlers that talk to the org through the command line tool.
 *
 * <p>Subclasses implement {@link #listItems} and {@link #retrieveContent}. The latter throws on
 * failure; {@link #fetchContent} turns that into empty content while {@link #fetchContentBatch}
 * reports it as a failure of the item.
 */
public abstract class AbstractMetadataHandler implements MetadataHandler {
  private static final Logger logger = Logger.getLogger(AbstractMetadataHandler.class.getName());

  protected final TypeDefinition definition;
  protected final HandlerConfig config;
  protected final HandlerContext context;

  protected AbstractMetadataHandler(
      TypeDefinition definition, HandlerConfig config, HandlerContext context) {
    this.definition = checkNotNull(definition, "definition can not be null");
    this.config = checkNotNull(config, "config can not be null");
    this.context = checkNotNull(context, "context can not be null");
  }

  @Override
  public TypeDefinition getDefinition() {
    return definition;
  }

  @Override
  public HandlerConfig getConfig() {
    return config;
  }

  /**
   * Fetches the content of {@code item}.
   *
   * @throws RetrievalException if the content cannot be obtained
   */
  protected abstract Content retrieveContent(String targetId, String targetIdentifier, Item item)
      throws RetrievalException;

  /** Content returned by {@link #fetchContent} when retrieval fails. */
  protected Content emptyContent(Item item) {
    return TextContent.empty();
  }

  @Override
  public final Content fetchContent(String targetId, String targetIdentifier, Item item) {
    try {
      return retrieveContent(targetId, targetIdentifier, item);
    } catch (RetrievalException | RuntimeException e) {
      logger.log(Level.WARNING,
          String.format("Failed to fetch content of %s from %s", item.getId(), targetIdentifier),
          e);
      return emptyContent(item);
    }
  }

  @Override
  public ProcessingResult<ItemContent> fetchContentBatch(
      String targetId, String targetIdentifier, List<Item> items) {
    return context.getChunkedExecutor().process(
        items,
        config.getMaxConcurrency(),
        config.isParallel(),
        item -> new ItemContent(item, retrieveContent(targetId, targetIdentifier, item)));
  }

  @Override
  public boolean supports(String typeName) {
    return getSupportedTypes().contains(typeName);
  }

  @Override
  public Set<String> getSupportedTypes() {
    return ImmutableSet.of(definition.getName());
  }

  /** Executable of the command line tool. */
  protected String cli() throws RetrievalException {
    return context.getCliLocator().locate();
  }

  /**
   * Runs {@code command} with this handler's timeout and retry policy and returns the parsed
   * response.
   */
  protected CliResponse runCli(List<String> command, @Nullable Path workingDirectory)
      throws RetrievalException {
    return CliResponse.run(context.getCommandExecutor(), command, workingDirectory,
        config.getTimeoutMillis(), context.retryPolicy(config.getRetryCount()));
  }

  /**
   * Returns the {@code org list metadata} records of {@code cliTypeName}.
   *
   * @throws RetrievalException of type {@link ErrorType#LISTING}
   */
  protected List<Map<String, Object>> listMetadataRecords(
      String cliTypeName, String targetIdentifier) throws RetrievalException {
    try {
      return runCli(CliCommands.listMetadata(cli(), cliTypeName, targetIdentifier), null)
          .getRecords();
    } catch (RetrievalException e) {
      throw asListingFailure(e);
    }
  }

  /** Rewraps {@code e} as a listing failure, keeping its message. */
  protected static RetrievalException asListingFailure(RetrievalException e) {
    if (e.getErrorType() == ErrorType.LISTING) {
      return e;
    }
    RetrievalException.Builder builder = new RetrievalException.Builder()
        .setErrorType(ErrorType.LISTING)
        .setErrorMessage(e.getMessage())
        .setCause(e);
    e.getExitCode().ifPresent(builder::setExitCode);
    return builder.build();
  }

  /**
   * Retrieves one member into the target's item directory and returns that directory.
   */
  protected Path retrieveMember(String targetId, String targetIdentifier, String cliTypeName,
      String memberName) throws RetrievalException {
    Path directory = context.getWorkspace().itemDirectory(targetId);
    try {
      context.getWorkspace().ensureProject(directory, context.getApiVersion());
    } catch (IOException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.CONTENT)
          .setErrorMessage("Failed to prepare " + directory + ": " + e.getMessage())
          .setCause(e)
          .build();
    }
    runCli(CliCommands.retrieveMetadata(cli(), cliTypeName, memberName, targetIdentifier),
        directory);
    return directory;
  }

  /**
   * Reads the first of {@code relativePaths} found under a source root of {@code directory}.
   *
   * @throws RetrievalException of type {@link ErrorType#CONTENT} if none exists
   */
  protected static String readRetrievedFile(Path directory, List<String> relativePaths)
      throws RetrievalException {
    Path file = TargetWorkspace.findRetrievedFile(directory, relativePaths)
        .orElseThrow(() -> new RetrievalException.Builder()
            .setErrorType(ErrorType.CONTENT)
            .setErrorMessage("Retrieved file not found, tried " + relativePaths)
            .build());
    try {
      return new String(Files.readAllBytes(file), UTF_8);
    } catch (IOException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.CONTENT)
          .setErrorMessage("Failed to read " + file + ": " + e.getMessage())
          .setCause(e)
          .build();
    }
  }

  /** Orders items by display name. */
  protected static List<Item> sortedByName(List<Item> items) {
    return items.stream()
        .sorted(Comparator.comparing(Item::getName))
        .collect(Collectors.toList());
  }

  protected static RetrievalException contentFailure(String message) {
    return new RetrievalException.Builder()
        .setErrorType(ErrorType.CONTENT)
        .setErrorMessage(message)
        .build();
  }
}
