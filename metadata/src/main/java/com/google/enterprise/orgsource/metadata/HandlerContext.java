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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.enterprise.orgsource.sdk.BackoffExceptionHandler;
import com.google.enterprise.orgsource.sdk.ExceptionHandler;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.command.CliLocator;
import com.google.enterprise.orgsource.sdk.command.CommandExecutor;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.util.concurrent.TimeUnit;

/**
 * Shared services handed to every handler.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #API_VERSION} - API version written into project descriptors. Default {@value
 *       #DEFAULT_API_VERSION}.
 * </ul>
 */
public final class HandlerContext {
  public static final String API_VERSION = "cli.apiVersion";
  public static final String DEFAULT_API_VERSION = "58.0";

  private final CommandExecutor commandExecutor;
  private final CliLocator cliLocator;
  private final TargetWorkspace workspace;
  private final ChunkedExecutor chunkedExecutor;
  private final String apiVersion;
  private final long retryDelayMillis;

  public HandlerContext(
      CommandExecutor commandExecutor,
      CliLocator cliLocator,
      TargetWorkspace workspace,
      ChunkedExecutor chunkedExecutor,
      String apiVersion) {
    this(commandExecutor, cliLocator, workspace, chunkedExecutor, apiVersion,
        BackoffExceptionHandler.DEFAULT_DELAY_MILLIS);
  }

  /**
   * @param retryDelayMillis base delay between command retries, multiplied by the attempt number
   */
  public HandlerContext(
      CommandExecutor commandExecutor,
      CliLocator cliLocator,
      TargetWorkspace workspace,
      ChunkedExecutor chunkedExecutor,
      String apiVersion,
      long retryDelayMillis) {
    checkArgument(!Strings.isNullOrEmpty(apiVersion), "apiVersion can not be null or empty");
    checkArgument(retryDelayMillis >= 0, "retryDelayMillis can not be negative");
    this.retryDelayMillis = retryDelayMillis;
    this.commandExecutor = checkNotNull(commandExecutor);
    this.cliLocator = checkNotNull(cliLocator);
    this.workspace = checkNotNull(workspace);
    this.chunkedExecutor = checkNotNull(chunkedExecutor);
    this.apiVersion = apiVersion;
  }

  /** Creates a context from {@link Configuration}. */
  public static HandlerContext fromConfiguration(ChunkedExecutor chunkedExecutor) {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    CommandExecutor executor = CommandExecutor.fromConfiguration();
    return new HandlerContext(
        executor,
        new CliLocator(executor),
        TargetWorkspace.fromConfiguration(),
        chunkedExecutor,
        Configuration.getString(API_VERSION, DEFAULT_API_VERSION).get());
  }

  public CommandExecutor getCommandExecutor() {
    return commandExecutor;
  }

  public CliLocator getCliLocator() {
    return cliLocator;
  }

  public TargetWorkspace getWorkspace() {
    return workspace;
  }

  public ChunkedExecutor getChunkedExecutor() {
    return chunkedExecutor;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  /** Retry policy for commands of a handler allowing {@code retryCount} retries. */
  public ExceptionHandler retryPolicy(int retryCount) {
    return new BackoffExceptionHandler(retryCount, retryDelayMillis, TimeUnit.MILLISECONDS);
  }
}
