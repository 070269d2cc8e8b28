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
package com.google.enterprise.orgsource.sdk.command;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.enterprise.orgsource.sdk.ExceptionHandler;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Runs whitelisted command line programs with an explicit argument vector.
 *
 * <p>No shell is involved: the first element of the command is the executable and every other
 * element reaches it as a single argument. Arguments are sanitized before use: null characters
 * are removed, line breaks become spaces, surrounding whitespace is trimmed and anything longer
 * than {@value #MAX_ARGUMENT_LENGTH} characters is rejected.
 *
 * <p>A command that outlives its timeout is killed, together with any child processes it
 * started, and reported as {@link ErrorType#TIMEOUT}.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #ALLOWED_COMMANDS} - executables that may be started. Default {@code sf,sfdx}.
 *   <li>{@value #TIMEOUT} - default timeout in milliseconds. Default {@value
 *       #DEFAULT_TIMEOUT_MILLIS}.
 * </ul>
 */
public class CommandExecutor {
  private static final Logger logger = Logger.getLogger(CommandExecutor.class.getName());

  public static final String ALLOWED_COMMANDS = "cli.allowedCommands";
  public static final String TIMEOUT = "cli.timeout";

  public static final long DEFAULT_TIMEOUT_MILLIS = 60000;
  public static final long MIN_TIMEOUT_MILLIS = 1000;
  public static final int MAX_ARGUMENT_LENGTH = 8192;
  @VisibleForTesting static final long KILL_GRACE_MILLIS = 5000;
  @VisibleForTesting static final List<String> DEFAULT_ALLOWED_COMMANDS =
      ImmutableList.of("sf", "sfdx");

  private static final ListeningExecutorService STREAM_READERS =
      MoreExecutors.listeningDecorator(
          Executors.newCachedThreadPool(
              new ThreadFactoryBuilder()
                  .setNameFormat("command-output-%d")
                  .setDaemon(true)
                  .build()));

  private final ImmutableSet<String> allowedCommands;
  private final long defaultTimeoutMillis;

  private CommandExecutor(Builder builder) {
    this.allowedCommands = ImmutableSet.copyOf(builder.allowedCommands);
    this.defaultTimeoutMillis = clampTimeout(builder.defaultTimeoutMillis);
  }

  /** Creates an executor from {@link Configuration}. */
  public static CommandExecutor fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    return new Builder()
        .setAllowedCommands(
            Configuration.getMultiValue(
                    ALLOWED_COMMANDS, DEFAULT_ALLOWED_COMMANDS, Configuration.STRING_PARSER)
                .get())
        .setDefaultTimeoutMillis(Configuration.getLong(TIMEOUT, DEFAULT_TIMEOUT_MILLIS).get())
        .build();
  }

  public Set<String> getAllowedCommands() {
    return allowedCommands;
  }

  public long getDefaultTimeoutMillis() {
    return defaultTimeoutMillis;
  }

  /** Runs {@code command} in the current directory with the default timeout. */
  public CommandResult execute(List<String> command) throws RetrievalException {
    return execute(command, null, defaultTimeoutMillis);
  }

  /**
   * Runs {@code command} and waits for it to exit.
   *
   * <p>A non-zero exit code is not an error here; see {@link CommandResult#checkSuccess()}.
   *
   * @param command executable followed by its arguments
   * @param workingDirectory directory to run in, or {@code null} for the current one
   * @param timeoutMillis time to wait before killing the process, at least {@value
   *     #MIN_TIMEOUT_MILLIS}
   * @throws RetrievalException if the process cannot be started, times out or is interrupted
   * @throws IllegalArgumentException if the executable is not allowed or an argument is too long
   */
  public CommandResult execute(
      List<String> command, @Nullable Path workingDirectory, long timeoutMillis)
      throws RetrievalException {
    List<String> sanitized = sanitizeCommand(command);
    long timeout = clampTimeout(timeoutMillis);
    ProcessBuilder processBuilder = new ProcessBuilder(sanitized);
    if (workingDirectory != null) {
      processBuilder.directory(workingDirectory.toFile());
    }
    logger.log(Level.FINE, "Executing {0}", sanitized);
    Process process;
    try {
      process = processBuilder.start();
    } catch (IOException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.EXTERNAL_TOOL)
          .setErrorMessage("Failed to start command " + sanitized.get(0) + ": " + e.getMessage())
          .setCause(e)
          .build();
    }
    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      logger.log(Level.FINE, "Failed to close standard input of " + sanitized.get(0), e);
    }
    ListenableFuture<String> stdout = readAsync(process.getInputStream());
    ListenableFuture<String> stderr = readAsync(process.getErrorStream());
    try {
      if (!process.waitFor(timeout, TimeUnit.MILLISECONDS)) {
        kill(process);
        throw new RetrievalException.Builder()
            .setErrorType(ErrorType.TIMEOUT)
            .setErrorMessage(
                String.format("Command %s timed out after %d ms", sanitized.get(0), timeout))
            .build();
      }
      return new CommandResult(
          process.exitValue(),
          stdout.get(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS),
          stderr.get(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      kill(process);
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.EXTERNAL_TOOL)
          .setErrorMessage("Interrupted while waiting for " + sanitized.get(0))
          .setCause(e)
          .build();
    } catch (ExecutionException | TimeoutException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.EXTERNAL_TOOL)
          .setErrorMessage("Failed to read output of " + sanitized.get(0))
          .setCause(e)
          .build();
    }
  }

  /**
   * Invokes {@code call} until it succeeds or {@code exceptionHandler} gives up, in which case
   * the latest failure is thrown.
   */
  public static <T> T callWithRetry(RetriableCall<T> call, ExceptionHandler exceptionHandler)
      throws RetrievalException {
    checkNotNull(call);
    checkNotNull(exceptionHandler);
    int ntries = 0;
    while (true) {
      try {
        return call.call();
      } catch (RetrievalException e) {
        ntries++;
        boolean retry;
        try {
          retry = exceptionHandler.handleException(e, ntries);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
        if (!retry) {
          throw e;
        }
        logger.log(Level.FINE, String.format("Retrying after failure #%d: %s", ntries,
            e.getMessage()));
      }
    }
  }

  /** A unit of work that may be retried. */
  public interface RetriableCall<T> {
    T call() throws RetrievalException;
  }

  @VisibleForTesting
  List<String> sanitizeCommand(List<String> command) {
    checkNotNull(command, "command can not be null");
    checkArgument(!command.isEmpty(), "command can not be empty");
    String executable = sanitizeArgument(command.get(0));
    checkArgument(allowedCommands.contains(executable),
        "Command not allowed: %s. Allowed commands: %s", executable, allowedCommands);
    ImmutableList.Builder<String> sanitized = ImmutableList.builder();
    sanitized.add(executable);
    command.subList(1, command.size()).forEach(arg -> sanitized.add(sanitizeArgument(arg)));
    return sanitized.build();
  }

  /**
   * Removes null characters, replaces line breaks with spaces and trims {@code argument}.
   *
   * @throws IllegalArgumentException if the result exceeds {@value #MAX_ARGUMENT_LENGTH}
   *     characters
   */
  public static String sanitizeArgument(String argument) {
    checkNotNull(argument, "argument can not be null");
    String sanitized = argument.replace("\0", "").replaceAll("[\\r\\n]+", " ").trim();
    checkArgument(sanitized.length() <= MAX_ARGUMENT_LENGTH,
        "Argument exceeds maximum length of %s characters", MAX_ARGUMENT_LENGTH);
    return sanitized;
  }

  static long clampTimeout(long timeoutMillis) {
    return Math.max(MIN_TIMEOUT_MILLIS, timeoutMillis);
  }

  private static ListenableFuture<String> readAsync(InputStream stream) {
    return STREAM_READERS.submit(
        () -> {
          try (InputStream in = stream) {
            return new String(ByteStreams.toByteArray(in), UTF_8);
          }
        });
  }

  private static void kill(Process process) {
    process.descendants().forEach(ProcessHandle::destroy);
    process.destroy();
    try {
      if (!process.waitFor(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Process {0} ignored termination, killing forcibly",
            process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }

  /** Builder for {@link CommandExecutor}. */
  public static class Builder {
    private List<String> allowedCommands = DEFAULT_ALLOWED_COMMANDS;
    private long defaultTimeoutMillis = DEFAULT_TIMEOUT_MILLIS;

    public Builder setAllowedCommands(List<String> allowedCommands) {
      this.allowedCommands = ImmutableList.copyOf(allowedCommands);
      return this;
    }

    public Builder setAllowedCommands(String... allowedCommands) {
      return setAllowedCommands(Arrays.asList(allowedCommands));
    }

    public Builder setDefaultTimeoutMillis(long defaultTimeoutMillis) {
      this.defaultTimeoutMillis = defaultTimeoutMillis;
      return this;
    }

    public CommandExecutor build() {
      checkArgument(!allowedCommands.isEmpty(), "at least one command must be allowed");
      return new CommandExecutor(this);
    }
  }
}
