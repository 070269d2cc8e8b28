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
package com.google.enterprise.orgsource.metadata.retrieval;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListenableFutureTask;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.TargetWorkspace;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrieves the manifest selection of a target into a local directory, at most once at a time per
 * target.
 *
 * <p>A retrieval requested while another one for the same target is running joins the running
 * one. Retrieved sources stay on disk until the target is {@linkplain #invalidate invalidated}
 * and are overwritten in place by the next retrieval.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #TIMEOUT} - timeout of a whole-org retrieval in milliseconds. Default {@value
 *       #DEFAULT_TIMEOUT_MILLIS}.
 *   <li>{@value #RETRY_COUNT} - retries of a failed retrieval. Default {@value
 *       #DEFAULT_RETRY_COUNT}.
 * </ul>
 */
public class SourceRetrievalCoordinator {
  private static final Logger logger =
      Logger.getLogger(SourceRetrievalCoordinator.class.getName());

  public static final String TIMEOUT = "retrieval.timeout";
  public static final String RETRY_COUNT = "retrieval.retryCount";
  public static final long DEFAULT_TIMEOUT_MILLIS = 300000;
  public static final int DEFAULT_RETRY_COUNT = 1;
  @VisibleForTesting static final String MANIFEST_FILE = "package.xml";

  private final HandlerContext context;
  private final ManifestSettings settings;
  private final ListeningExecutorService executor;
  private final long timeoutMillis;
  private final int retryCount;
  private final ConcurrentMap<String, ListenableFuture<Path>> activeRetrievals =
      new ConcurrentHashMap<>();

  public SourceRetrievalCoordinator(HandlerContext context, ManifestSettings settings,
      ListeningExecutorService executor, long timeoutMillis, int retryCount) {
    checkArgument(retryCount >= 0, "retryCount can not be negative");
    this.context = checkNotNull(context, "context can not be null");
    this.settings = checkNotNull(settings, "settings can not be null");
    this.executor = checkNotNull(executor, "executor can not be null");
    this.timeoutMillis = timeoutMillis;
    this.retryCount = retryCount;
  }

  public static SourceRetrievalCoordinator fromConfiguration(HandlerContext context,
      ManifestSettings settings, ListeningExecutorService executor) {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    return new SourceRetrievalCoordinator(context, settings, executor,
        Configuration.getLong(TIMEOUT, DEFAULT_TIMEOUT_MILLIS).get(),
        Configuration.getInteger(RETRY_COUNT, DEFAULT_RETRY_COUNT).get());
  }

  /**
   * Retrieves the sources of {@code target}, or joins the retrieval already running for it.
   *
   * <p>The returned future yields the directory holding the retrieved sources. It fails with a
   * {@link RetrievalException} when the command line tool is missing or the retrieval fails.
   * Cancelling it does not affect other callers waiting for the same retrieval.
   */
  public ListenableFuture<Path> retrieve(Target target) {
    checkNotNull(target, "target can not be null");
    String targetId = target.getId();
    ListenableFuture<Path> retrieval;
    synchronized (activeRetrievals) {
      ListenableFuture<Path> running = activeRetrievals.get(targetId);
      if (running != null) {
        logger.log(Level.INFO, "Joining running retrieval of {0}", targetId);
        return Futures.nonCancellationPropagating(running);
      }
      ListenableFutureTask<Path> task = ListenableFutureTask.create(() -> retrieveNow(target));
      activeRetrievals.put(targetId, task);
      task.addListener(() -> activeRetrievals.remove(targetId, task),
          MoreExecutors.directExecutor());
      try {
        executor.execute(task);
      } catch (RejectedExecutionException e) {
        activeRetrievals.remove(targetId, task);
        return Futures.immediateFailedFuture(e);
      }
      retrieval = task;
    }
    logger.log(Level.INFO, "Started retrieval of {0}", targetId);
    return Futures.nonCancellationPropagating(retrieval);
  }

  /** Drops cached sources of {@code target} and retrieves them again. */
  public ListenableFuture<Path> refresh(Target target) throws IOException {
    checkNotNull(target, "target can not be null");
    invalidate(target.getId());
    return retrieve(target);
  }

  /**
   * Forgets the running retrieval of {@code targetId}, if any, and deletes its local sources. A
   * forgotten retrieval keeps running but is no longer joined.
   */
  public void invalidate(String targetId) throws IOException {
    activeRetrievals.remove(targetId);
    TargetWorkspace workspace = context.getWorkspace();
    workspace.delete(workspace.targetDirectory(targetId));
    workspace.delete(workspace.itemDirectory(targetId));
    logger.log(Level.INFO, "Cleared retrieved sources of {0}", targetId);
  }

  /** Deletes the local sources of every target. */
  public void cleanup() throws IOException {
    activeRetrievals.clear();
    TargetWorkspace workspace = context.getWorkspace();
    workspace.delete(workspace.getRoot());
    logger.log(Level.INFO, "Deleted retrieval root {0}", workspace.getRoot());
  }

  public boolean isRetrieving(String targetId) {
    return activeRetrievals.containsKey(targetId);
  }

  /** Returns the text of a retrieved file, or an empty string if it cannot be read. */
  public String getFileContent(Path file) {
    checkNotNull(file, "file can not be null");
    try {
      return new String(Files.readAllBytes(file), UTF_8);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to read retrieved file " + file, e);
      return "";
    }
  }

  @VisibleForTesting
  Path retrieveNow(Target target) throws RetrievalException {
    String targetId = target.getId();
    String cli = context.getCliLocator().locate();
    TargetWorkspace workspace = context.getWorkspace();
    String apiVersion = settings.getConfig(targetId).getApiVersion();
    Path directory;
    Path manifest;
    try {
      directory = workspace.ensureProject(workspace.targetDirectory(targetId), apiVersion);
      manifest = settings.writeManifest(targetId, directory.resolve(MANIFEST_FILE));
    } catch (IOException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.UNKNOWN)
          .setErrorMessage("Failed to prepare retrieval directory for " + targetId)
          .setCause(e)
          .build();
    }
    long start = System.currentTimeMillis();
    CliResponse.run(context.getCommandExecutor(),
        CliCommands.retrieveManifest(cli, manifest, target.identifier()),
        directory, timeoutMillis, context.retryPolicy(retryCount));
    Path sources = TargetWorkspace.findSourceRoot(directory)
        .orElseThrow(() -> new RetrievalException.Builder()
            .setErrorType(ErrorType.CONTENT)
            .setErrorMessage("No retrieved sources found in " + directory)
            .build());
    logger.log(Level.INFO, String.format("Retrieved sources of %s into %s in %d ms",
        targetId, sources, System.currentTimeMillis() - start));
    return sources;
  }
}
